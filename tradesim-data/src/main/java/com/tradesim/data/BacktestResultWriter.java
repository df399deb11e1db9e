package com.tradesim.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pretty-printed JSON export of {@link BacktestResult}s.
 */
public class BacktestResultWriter {

    private static final Logger log = LoggerFactory.getLogger(BacktestResultWriter.class);

    private final ObjectMapper mapper;

    public BacktestResultWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Path file, BacktestResult result) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        mapper.writeValue(file.toFile(), result);
        log.info("Exported results to {} ({} trades)", file, result.performance().totalTrades());
    }

    public String toJson(BacktestResult result) throws IOException {
        return mapper.writeValueAsString(result);
    }

    /**
     * Load a previously exported result.
     */
    public BacktestResult read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), BacktestResult.class);
    }
}
