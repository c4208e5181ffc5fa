package com.github.alvarosanchez.rpmrepo.service;

import com.github.alvarosanchez.rpmrepo.model.ReleaseKey;

final class StoreKeys {

    private StoreKeys() {
    }

    static String providerPrefix(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("Provider id is required.");
        }
        return providerId + ":";
    }

    static String metadata(String providerId, ReleaseKey key) {
        return providerPrefix(providerId) + "metadata:" + key.identity();
    }

    static String lastVersionCheck(String providerId) {
        return providerPrefix(providerId) + "last-version-check";
    }
}
