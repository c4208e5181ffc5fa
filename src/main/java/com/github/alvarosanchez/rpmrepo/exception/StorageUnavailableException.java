package com.github.alvarosanchez.rpmrepo.exception;

/**
 * The state store could not be read or written.
 */
public class StorageUnavailableException extends RpmRepoException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
