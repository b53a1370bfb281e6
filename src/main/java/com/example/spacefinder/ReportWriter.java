package com.example.spacefinder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class ReportWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReportWriter.class);

    public static final String REPORT_FILE = "report.json";

    private final ObjectMapper mapper;
    private final Path outputDirectory;

    /**
     * Writes scan reports as pretty-printed JSON into the output directory.
     */
    public ReportWriter(Path outputDirectory) {
        this(null, outputDirectory);
    }

    public ReportWriter(ObjectMapper mapper, Path outputDirectory) {
        this.mapper = mapper == null ? defaultMapper() : mapper;
        this.outputDirectory = outputDirectory;
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Writes the report, creating the output directory if needed, and returns the file written.
     */
    public Path write(ScanReport report) throws IOException {
        Files.createDirectories(outputDirectory);
        Path file = outputDirectory.resolve(REPORT_FILE);
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        LOGGER.info("Report written to {}", file.toAbsolutePath());
        return file;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }
}
