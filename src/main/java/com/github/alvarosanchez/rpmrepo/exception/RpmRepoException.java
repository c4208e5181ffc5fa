package com.github.alvarosanchez.rpmrepo.exception;

/**
 * Base type of the failures raised by the metadata pipeline.
 */
public abstract class RpmRepoException extends RuntimeException {

    protected RpmRepoException(String message) {
        super(message);
    }

    protected RpmRepoException(String message, Throwable cause) {
        super(message, cause);
    }
}
