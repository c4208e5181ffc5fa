package com.github.alvarosanchez.rpmrepo.command;

import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import com.github.kusoroadeolu.clique.Clique;
import com.github.kusoroadeolu.clique.tables.Table;
import com.github.kusoroadeolu.clique.tables.TableType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static com.github.alvarosanchez.rpmrepo.command.Cli.TABLE_CFG;
import static com.github.alvarosanchez.rpmrepo.command.Cli.th;

final class ReleaseTableRenderer {

    static final String METADATA_MARKER = "✓";
    private static final int DEFAULT_MAX_TABLE_WIDTH = 120;
    private static final int COLUMN_COUNT = 5;
    private static final String VERSION_HEADER = "VERSION";
    private static final String RELEASE_HEADER = "RELEASE";
    private static final String ADDED_HEADER = "ADDED";
    private static final String METADATA_HEADER = "METADATA";
    private static final String FILENAME_HEADER = "FILENAME";

    private ReleaseTableRenderer() {
    }

    static void print(List<ReleaseRow> rows) {
        print(rows, System.getenv());
    }

    static void print(List<ReleaseRow> rows, Map<String, String> environment) {
        int filenameWidth = filenameWidth(rows, maxTableWidth(environment));

        Table table = Clique.table(TableType.ROUNDED_BOX_DRAW, TABLE_CFG);
        table.addHeaders(
            th(VERSION_HEADER),
            th(RELEASE_HEADER),
            th(ADDED_HEADER),
            th(METADATA_HEADER),
            th(FILENAME_HEADER)
        );
        for (ReleaseRow row : rows) {
            ReleaseDescriptor release = row.release();
            List<String> filenameLines = wrap(release.filename(), filenameWidth);
            for (int line = 0; line < filenameLines.size(); line++) {
                boolean firstLine = line == 0;
                table.addRows(
                    firstLine ? release.version() : "",
                    firstLine ? release.release() : "",
                    firstLine ? added(release) : "",
                    firstLine ? metadataMarker(row) : "",
                    filenameLines.get(line)
                );
            }
        }
        table.render();
    }

    static int maxTableWidth(Map<String, String> environment) {
        OptionalInt columns = parseColumns(environment.get("COLUMNS"));
        if (columns.isPresent()) {
            return columns.getAsInt();
        }
        return DEFAULT_MAX_TABLE_WIDTH;
    }

    private static String added(ReleaseDescriptor release) {
        return release.added() == null ? "" : release.added();
    }

    private static String metadataMarker(ReleaseRow row) {
        if (!row.hasMetadata()) {
            return "";
        }
        return METADATA_MARKER;
    }

    private static int filenameWidth(List<ReleaseRow> rows, int maxTableWidth) {
        int versionWidth = VERSION_HEADER.length();
        int releaseWidth = RELEASE_HEADER.length();
        int addedWidth = ADDED_HEADER.length();
        int filenameWidth = FILENAME_HEADER.length();
        for (ReleaseRow row : rows) {
            versionWidth = Math.max(versionWidth, row.release().version().length());
            releaseWidth = Math.max(releaseWidth, row.release().release().length());
            addedWidth = Math.max(addedWidth, added(row.release()).length());
            filenameWidth = Math.max(filenameWidth, row.release().filename().length());
        }
        int fixedWidth = versionWidth + releaseWidth + addedWidth + METADATA_HEADER.length();
        int available = maxTableWidth - columnOverhead(COLUMN_COUNT) - fixedWidth;
        return Math.max(FILENAME_HEADER.length(), Math.min(filenameWidth, available));
    }

    private static int columnOverhead(int columnCount) {
        return (5 * columnCount) + 1;
    }

    private static OptionalInt parseColumns(String value) {
        if (value == null || value.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            int parsedColumns = Integer.parseInt(value.trim());
            if (parsedColumns <= 0) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(parsedColumns);
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    // filenames carry no spaces, so they are broken at the column width
    private static List<String> wrap(String value, int width) {
        if (value.length() <= width) {
            return List.of(value);
        }
        List<String> lines = new ArrayList<>();
        int index = 0;
        while (value.length() - index > width) {
            lines.add(value.substring(index, index + width));
            index += width;
        }
        if (index < value.length()) {
            lines.add(value.substring(index));
        }
        return lines;
    }

    record ReleaseRow(ReleaseDescriptor release, boolean hasMetadata) {
    }
}
