package com.github.alvarosanchez.rpmrepo.repodata;

/**
 * One compressed index document together with the facts {@code repomd.xml} declares about it.
 *
 * <p>The byte arrays are copied on the way in and on the way out, so the declared checksums and sizes
 * always describe the bytes a caller reads.
 *
 * @param type data type referenced from {@code repomd.xml}, e.g. {@code primary}
 * @param location path relative to the repository root
 * @param xml uncompressed document bytes
 * @param gz gzip-compressed document bytes
 * @param checksum SHA-256 of {@code gz}
 * @param openChecksum SHA-256 of {@code xml}
 * @param size length of {@code gz}
 * @param openSize length of {@code xml}
 */
public record IndexDocument(
    String type,
    String location,
    byte[] xml,
    byte[] gz,
    String checksum,
    String openChecksum,
    long size,
    long openSize
) {

    public IndexDocument {
        xml = xml.clone();
        gz = gz.clone();
    }

    @Override
    public byte[] xml() {
        return xml.clone();
    }

    @Override
    public byte[] gz() {
        return gz.clone();
    }
}
