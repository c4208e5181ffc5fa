package com.github.alvarosanchez.rpmrepo.exception;

/**
 * The full-content stream ended before the checksum could be finalized.
 */
public class ChecksumIncompleteException extends RpmRepoException {

    public ChecksumIncompleteException(String message) {
        super(message);
    }

    public ChecksumIncompleteException(String message, Throwable cause) {
        super(message, cause);
    }
}
