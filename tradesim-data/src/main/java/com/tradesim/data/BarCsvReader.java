package com.tradesim.data;

import com.tradesim.core.exception.BarDataException;
import com.tradesim.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Reads OHLCV bars from CSV.
 *
 * With a header row, columns are located by name (case-insensitive, any order, extra columns
 * ignored). Without one, the first six columns are taken as timestamp,open,high,low,close,volume.
 * Timestamps are epoch milliseconds or ISO-8601 instants. Rows come back sorted by timestamp.
 */
public final class BarCsvReader {

    private static final Logger log = LoggerFactory.getLogger(BarCsvReader.class);

    static final String[] COLUMNS = {"timestamp", "open", "high", "low", "close", "volume"};

    private BarCsvReader() {
    }

    public static List<Bar> read(Path file) throws BarDataException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<Bar> bars = read(reader);
            log.debug("Loaded {} bars from {}", bars.size(), file);
            return bars;
        } catch (IOException e) {
            throw new BarDataException("Cannot read bar file " + file, e);
        }
    }

    public static List<Bar> read(Reader source) throws BarDataException, IOException {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        List<Bar> bars = new ArrayList<>();
        int[] positions = null;
        int lineNumber = 0;
        String line;

        while ((line = reader.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty()) continue;

            String[] cells = line.split(",", -1);
            if (positions == null) {
                positions = headerPositions(cells, lineNumber);
                if (positions != null) {
                    continue;
                }
                positions = new int[] {0, 1, 2, 3, 4, 5};
            }
            bars.add(parseRow(cells, positions, lineNumber));
        }

        bars.sort(Comparator.comparingLong(Bar::timestamp));
        for (int i = 1; i < bars.size(); i++) {
            if (bars.get(i).timestamp() == bars.get(i - 1).timestamp()) {
                throw new BarDataException("Duplicate bar timestamp " + bars.get(i).timestamp());
            }
        }
        return bars;
    }

    /**
     * Column positions when {@code cells} is a header row, null when it is data.
     */
    private static int[] headerPositions(String[] cells, int lineNumber) throws BarDataException {
        if (!startsWithLetter(cells[0])) {
            return null;
        }
        int[] positions = new int[COLUMNS.length];
        for (int c = 0; c < COLUMNS.length; c++) {
            positions[c] = -1;
            for (int i = 0; i < cells.length; i++) {
                if (cells[i].replace("\"", "").trim().toLowerCase(Locale.ROOT).equals(COLUMNS[c])) {
                    positions[c] = i;
                    break;
                }
            }
            if (positions[c] < 0) {
                throw new BarDataException("Header is missing column '" + COLUMNS[c] + "'", lineNumber, null);
            }
        }
        return positions;
    }

    private static boolean startsWithLetter(String cell) {
        String trimmed = cell.trim();
        if (trimmed.startsWith("\"")) {
            trimmed = trimmed.substring(1);
        }
        return !trimmed.isEmpty() && Character.isLetter(trimmed.charAt(0));
    }

    private static Bar parseRow(String[] cells, int[] positions, int lineNumber) throws BarDataException {
        for (int position : positions) {
            if (position >= cells.length) {
                throw new BarDataException("Expected at least " + (position + 1) + " columns, got " + cells.length,
                    lineNumber, null);
            }
        }
        try {
            return new Bar(
                parseTimestamp(cells[positions[0]].trim()),
                Double.parseDouble(cells[positions[1]].trim()),
                Double.parseDouble(cells[positions[2]].trim()),
                Double.parseDouble(cells[positions[3]].trim()),
                Double.parseDouble(cells[positions[4]].trim()),
                Double.parseDouble(cells[positions[5]].trim())
            );
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new BarDataException("Malformed value: " + e.getMessage(), lineNumber, e);
        } catch (IllegalArgumentException e) {
            throw new BarDataException(e.getMessage(), lineNumber, e);
        }
    }

    private static long parseTimestamp(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return Instant.parse(value).toEpochMilli();
        }
    }
}
