package com.example.spacefinder;

import com.example.spacefinder.analysis.ClassifiedFile;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exports a file list as CSV, one row per file.
 */
public class CsvExporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvExporter.class);

    public static final String CSV_FILE = "files.csv";

    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema = mapper.schemaFor(FileRow.class).withHeader();

    public Path export(List<ClassifiedFile> files, Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);
        Path file = outputDirectory.resolve(CSV_FILE);
        try (SequenceWriter writer = mapper.writer(schema).writeValues(file.toFile())) {
            for (ClassifiedFile entry : files) {
                writer.write(FileRow.from(entry));
            }
        }
        LOGGER.info("Exported {} files to {}", files.size(), file.toAbsolutePath());
        return file;
    }

    @JsonPropertyOrder({"Name", "Size (bytes)", "Size", "Category", "Last Accessed", "Path"})
    record FileRow(
            @JsonProperty("Name") String name,
            @JsonProperty("Size (bytes)") long sizeBytes,
            @JsonProperty("Size") String size,
            @JsonProperty("Category") String category,
            @JsonProperty("Last Accessed") String lastAccessed,
            @JsonProperty("Path") String path
    ) {
        static FileRow from(ClassifiedFile entry) {
            return new FileRow(
                    entry.file().name(),
                    entry.size(),
                    SizeFormat.format(entry.size()),
                    entry.category().label(),
                    SizeFormat.formatDate(entry.file().lastAccessed()),
                    entry.path()
            );
        }
    }
}
