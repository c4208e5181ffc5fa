package com.github.alvarosanchez.rpmrepo.repodata;

import java.util.List;

/**
 * Complete set of repository index documents generated from one metadata list.
 *
 * <p>{@code repomd} is copied on the way in and on the way out, like the arrays of {@link IndexDocument}.
 *
 * @param revision shared revision timestamp in epoch seconds
 * @param repomd uncompressed root document
 * @param primary package document
 * @param filelists file listing document
 * @param other changelog and miscellaneous document
 */
public record RepositoryIndexBundle(
    long revision,
    byte[] repomd,
    IndexDocument primary,
    IndexDocument filelists,
    IndexDocument other
) {

    /**
     * Path of the root document relative to the repository root.
     */
    public static final String REPOMD_LOCATION = "repodata/repomd.xml";

    public RepositoryIndexBundle {
        repomd = repomd.clone();
    }

    @Override
    public byte[] repomd() {
        return repomd.clone();
    }

    /**
     * Returns the compressed documents in the order {@code repomd.xml} lists them.
     *
     * @return primary, filelists and other documents
     */
    public List<IndexDocument> documents() {
        return List.of(primary, filelists, other);
    }
}
