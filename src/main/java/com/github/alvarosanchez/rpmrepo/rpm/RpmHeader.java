package com.github.alvarosanchez.rpmrepo.rpm;

import static com.github.alvarosanchez.rpmrepo.rpm.RpmTags.TYPE_BIN;
import static com.github.alvarosanchez.rpmrepo.rpm.RpmTags.TYPE_CHAR;
import static com.github.alvarosanchez.rpmrepo.rpm.RpmTags.TYPE_I18NSTRING;
import static com.github.alvarosanchez.rpmrepo.rpm.RpmTags.TYPE_INT16;
import static com.github.alvarosanchez.rpmrepo.rpm.RpmTags.TYPE_INT32;
import static com.github.alvarosanchez.rpmrepo.rpm.RpmTags.TYPE_INT64;
import static com.github.alvarosanchez.rpmrepo.rpm.RpmTags.TYPE_INT8;
import static com.github.alvarosanchez.rpmrepo.rpm.RpmTags.TYPE_STRING;
import static com.github.alvarosanchez.rpmrepo.rpm.RpmTags.TYPE_STRING_ARRAY;

import com.github.alvarosanchez.rpmrepo.exception.ParseFailedException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Random access view over one RPM header structure (index entries plus data store).
 */
final class RpmHeader {

    static final int INTRO_SIZE = 16;
    static final int INDEX_ENTRY_SIZE = 16;

    private final Map<Integer, IndexEntry> entries;
    private final byte[] section;
    private final int storeOffset;
    private final int storeLength;

    private RpmHeader(Map<Integer, IndexEntry> entries, byte[] section, int storeOffset, int storeLength) {
        this.entries = entries;
        this.section = section;
        this.storeOffset = storeOffset;
        this.storeLength = storeLength;
    }

    /**
     * Parses a complete header section, starting at its magic.
     *
     * @param section raw section bytes
     * @return header view
     */
    static RpmHeader parse(byte[] section) {
        ByteBuffer buffer = ByteBuffer.wrap(section);
        int indexCount = buffer.getInt(8);
        int storeLength = buffer.getInt(12);
        int storeOffset = INTRO_SIZE + indexCount * INDEX_ENTRY_SIZE;
        if (storeOffset + storeLength != section.length) {
            throw new ParseFailedException("Header section length does not match its index and store sizes");
        }

        Map<Integer, IndexEntry> entries = new HashMap<>();
        for (int i = 0; i < indexCount; i++) {
            int position = INTRO_SIZE + i * INDEX_ENTRY_SIZE;
            int tag = buffer.getInt(position);
            int type = buffer.getInt(position + 4);
            int offset = buffer.getInt(position + 8);
            int count = buffer.getInt(position + 12);
            if (offset < 0 || offset > storeLength || count < 0) {
                throw new ParseFailedException("Header entry for tag " + tag + " points outside the data store");
            }
            entries.putIfAbsent(tag, new IndexEntry(type, offset, count));
        }
        return new RpmHeader(entries, section, storeOffset, storeLength);
    }

    boolean has(int tag) {
        return entries.containsKey(tag);
    }

    Optional<String> string(int tag) {
        List<String> values = strings(tag);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    List<String> strings(int tag) {
        IndexEntry entry = entries.get(tag);
        if (entry == null) {
            return List.of();
        }
        int count;
        if (entry.type() == TYPE_STRING) {
            count = 1;
        } else if (entry.type() == TYPE_STRING_ARRAY || entry.type() == TYPE_I18NSTRING) {
            count = entry.count();
        } else {
            throw new ParseFailedException("Tag " + tag + " is not a string (type " + entry.type() + ")");
        }

        List<String> values = new ArrayList<>(count);
        int position = entry.offset();
        for (int i = 0; i < count; i++) {
            int end = position;
            while (end < storeLength && section[storeOffset + end] != 0) {
                end++;
            }
            if (end >= storeLength) {
                throw new ParseFailedException("Unterminated string for tag " + tag);
            }
            values.add(new String(section, storeOffset + position, end - position, StandardCharsets.UTF_8));
            position = end + 1;
        }
        return values;
    }

    OptionalLong integer(int tag) {
        long[] values = integers(tag);
        return values.length == 0 ? OptionalLong.empty() : OptionalLong.of(values[0]);
    }

    long[] integers(int tag) {
        IndexEntry entry = entries.get(tag);
        if (entry == null) {
            return new long[0];
        }
        int width = integerWidth(tag, entry.type());
        checkBounds(tag, entry.offset(), (long) width * entry.count());

        ByteBuffer buffer = ByteBuffer.wrap(section);
        long[] values = new long[entry.count()];
        for (int i = 0; i < values.length; i++) {
            int position = storeOffset + entry.offset() + i * width;
            if (width == 1) {
                values[i] = Byte.toUnsignedLong(section[position]);
            } else if (width == 2) {
                values[i] = Short.toUnsignedLong(buffer.getShort(position));
            } else if (width == 4) {
                values[i] = Integer.toUnsignedLong(buffer.getInt(position));
            } else {
                values[i] = buffer.getLong(position);
            }
        }
        return values;
    }

    Optional<byte[]> binary(int tag) {
        IndexEntry entry = entries.get(tag);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.type() != TYPE_BIN) {
            throw new ParseFailedException("Tag " + tag + " is not binary (type " + entry.type() + ")");
        }
        checkBounds(tag, entry.offset(), entry.count());
        byte[] value = new byte[entry.count()];
        System.arraycopy(section, storeOffset + entry.offset(), value, 0, value.length);
        return Optional.of(value);
    }

    private static int integerWidth(int tag, int type) {
        if (type == TYPE_CHAR || type == TYPE_INT8) {
            return 1;
        }
        if (type == TYPE_INT16) {
            return 2;
        }
        if (type == TYPE_INT32) {
            return 4;
        }
        if (type == TYPE_INT64) {
            return 8;
        }
        throw new ParseFailedException("Tag " + tag + " is not an integer (type " + type + ")");
    }

    private void checkBounds(int tag, int offset, long length) {
        if (offset + length > storeLength) {
            throw new ParseFailedException("Value of tag " + tag + " extends past the data store");
        }
    }

    private record IndexEntry(int type, int offset, int count) {
    }
}
