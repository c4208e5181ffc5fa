package com.github.alvarosanchez.rpmrepo.hash;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.junit.jupiter.api.Test;

class HashUtilTest {

    @Test
    void sha256MatchesKnownVector() {
        assertEquals(
            "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            HashUtil.sha256("abc".getBytes(StandardCharsets.US_ASCII))
        );
    }

    @Test
    void sha1MatchesKnownVector() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", HashUtil.sha1("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void incrementalDigestEqualsOneShotDigest() {
        byte[] data = "incremental content".getBytes(StandardCharsets.UTF_8);
        MessageDigest digest = HashUtil.newSha256();
        digest.update(data, 0, 5);
        digest.update(data, 5, data.length - 5);

        assertEquals(HashUtil.sha256(data), HashUtil.hex(digest.digest()));
    }
}
