package com.github.alvarosanchez.rpmrepo.exception;

/**
 * The artifact header region did not contain the expected structure.
 */
public class ParseFailedException extends RpmRepoException {

    public ParseFailedException(String message) {
        super(message);
    }

    public ParseFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
