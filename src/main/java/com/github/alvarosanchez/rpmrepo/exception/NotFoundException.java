package com.github.alvarosanchez.rpmrepo.exception;

/**
 * A requested provider, release or record does not exist.
 */
public class NotFoundException extends RpmRepoException {

    public NotFoundException(String message) {
        super(message);
    }
}
