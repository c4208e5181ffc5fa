package com.github.alvarosanchez.rpmrepo.model;

import java.util.Optional;

/**
 * Version comparison operator of a package dependency, as encoded in the low bits of RPM sense flags.
 */
public enum ComparisonFlag {
    LT(0x02),
    GT(0x04),
    EQ(0x08),
    LE(0x02 | 0x08),
    GE(0x04 | 0x08);

    private static final int COMPARISON_MASK = 0x0F;

    private final int bits;

    ComparisonFlag(int bits) {
        this.bits = bits;
    }

    /**
     * Returns the sense bits of this operator.
     *
     * @return comparison bits
     */
    public int bits() {
        return bits;
    }

    /**
     * Maps RPM sense flags to a comparison operator, ignoring every bit above the low four.
     *
     * @param senseFlags raw dependency flags
     * @return matching operator, or empty when the low bits name none
     */
    public static Optional<ComparisonFlag> fromSenseFlags(long senseFlags) {
        int comparisonBits = (int) (senseFlags & COMPARISON_MASK);
        for (ComparisonFlag flag : values()) {
            if (flag.bits == comparisonBits) {
                return Optional.of(flag);
            }
        }
        return Optional.empty();
    }
}
