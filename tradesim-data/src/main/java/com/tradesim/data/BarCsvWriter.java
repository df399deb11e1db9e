package com.tradesim.data;

import com.tradesim.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes bars as CSV with the canonical timestamp,open,high,low,close,volume header.
 */
public final class BarCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(BarCsvWriter.class);

    private BarCsvWriter() {
    }

    public static void write(Path file, List<Bar> bars) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(String.join(",", BarCsvReader.COLUMNS));
            writer.newLine();
            for (Bar bar : bars) {
                writer.write(toCsv(bar));
                writer.newLine();
            }
        }
        log.debug("Saved {} bars to {}", bars.size(), file);
    }

    static String toCsv(Bar bar) {
        return bar.timestamp() + "," + bar.open() + "," + bar.high() + "," + bar.low() + ","
            + bar.close() + "," + bar.volume();
    }
}
