package com.github.alvarosanchez.rpmrepo.rpm;

/**
 * Tag numbers read from RPM signature and main headers.
 */
final class RpmTags {

    // signature header
    static final int SIG_MD5 = 1004;
    static final int SIG_SHA1 = 269;
    static final int SIG_SHA256 = 273;

    // main header
    static final int NAME = 1000;
    static final int VERSION = 1001;
    static final int RELEASE = 1002;
    static final int SUMMARY = 1004;
    static final int DESCRIPTION = 1005;
    static final int BUILD_TIME = 1006;
    static final int BUILD_HOST = 1007;
    static final int SIZE = 1009;
    static final int VENDOR = 1011;
    static final int LICENSE = 1014;
    static final int PACKAGER = 1015;
    static final int GROUP = 1016;
    static final int URL = 1020;
    static final int OS = 1021;
    static final int ARCH = 1022;
    static final int REQUIRE_FLAGS = 1048;
    static final int REQUIRE_NAME = 1049;
    static final int REQUIRE_VERSION = 1050;
    static final int PLATFORM = 1132;
    static final int LONG_SIZE = 5009;
    static final int PAYLOAD_DIGEST = 5092;
    static final int PAYLOAD_DIGEST_ALGO = 5093;

    // entry types
    static final int TYPE_CHAR = 1;
    static final int TYPE_INT8 = 2;
    static final int TYPE_INT16 = 3;
    static final int TYPE_INT32 = 4;
    static final int TYPE_INT64 = 5;
    static final int TYPE_STRING = 6;
    static final int TYPE_BIN = 7;
    static final int TYPE_STRING_ARRAY = 8;
    static final int TYPE_I18NSTRING = 9;

    private RpmTags() {
    }
}
