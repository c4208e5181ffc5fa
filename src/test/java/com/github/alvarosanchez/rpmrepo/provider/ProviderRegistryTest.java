package com.github.alvarosanchez.rpmrepo.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.rpmrepo.exception.NotFoundException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProviderRegistryTest {

    @Test
    void providersAreOrderedById() {
        ProviderRegistry registry = new ProviderRegistry(List.of(new StubProvider("zed"), new StubProvider("alpha")));

        assertEquals(List.of("alpha", "zed"), registry.all().stream().map(Provider::id).toList());
    }

    @Test
    void duplicateIdsAreRejected() {
        IllegalStateException error = assertThrows(
            IllegalStateException.class,
            () -> new ProviderRegistry(List.of(new StubProvider("tool"), new StubProvider("tool")))
        );

        assertTrue(error.getMessage().contains("tool"));
    }

    @Test
    void requireFailsForUnknownProvider() {
        ProviderRegistry registry = new ProviderRegistry(List.of(new StubProvider("tool")));

        assertEquals("tool", registry.require("tool").id());
        assertTrue(registry.find("other").isEmpty());
        NotFoundException error = assertThrows(NotFoundException.class, () -> registry.require("other"));
        assertEquals("Provider `other` not found.", error.getMessage());
    }
}
