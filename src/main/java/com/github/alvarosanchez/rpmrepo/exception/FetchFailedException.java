package com.github.alvarosanchez.rpmrepo.exception;

/**
 * An upstream API or artifact origin was unreachable, answered with a non-success status, or timed out.
 */
public class FetchFailedException extends RpmRepoException {

    public FetchFailedException(String message) {
        super(message);
    }

    public FetchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
