package com.github.alvarosanchez.rpmrepo.model;

/**
 * Repository presentation settings of a provider.
 *
 * @param name repository id used in {@code .repo} files
 * @param displayName human readable repository name
 * @param description short description
 */
public record RepoConfig(String name, String displayName, String description) {
}
