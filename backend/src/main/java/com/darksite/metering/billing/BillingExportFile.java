package com.darksite.metering.billing;

import com.darksite.metering.domain.model.BillingRow;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Tab-separated billing export.
 *
 * Header row first, columns in billing row order. Files are named after the
 * export's trigger time, written to a temporary file in the target directory
 * and moved into place once complete. An existing export is never overwritten.
 */
@Slf4j
public class BillingExportFile {

    static final String FILE_PREFIX = "metering_export_";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final CsvMapper mapper;
    private final CsvSchema schema;
    private final Path directory;
    private final String extension;
    private final ZoneId zone;

    public BillingExportFile(Path directory, String extension, ZoneId zone) {
        this.directory = directory;
        this.extension = extension;
        this.zone = zone;
        this.mapper = CsvMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                // quote only values containing a tab, quote or line break
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
        this.schema = mapper.schemaFor(BillingRow.class).withColumnSeparator('\t');
    }

    /**
     * File name for an export triggered at the given instant.
     */
    public String fileName(Instant triggeredAt) {
        return FILE_PREFIX + STAMP.format(triggeredAt.atZone(zone)) + "." + extension;
    }

    /**
     * Write the rows to a new export file.
     *
     * @return path of the written file
     * @throws FileAlreadyExistsException when an export with the same name exists
     * @throws IOException when the file cannot be written; no partial file is left behind
     */
    public Path write(List<BillingRow> rows, Instant triggeredAt) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(fileName(triggeredAt));
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }

        Path temp = Files.createTempFile(directory, "." + FILE_PREFIX, ".tmp");
        try {
            try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                out.write(headerLine());
                mapper.writer(schema).writeValues(out).writeAll(rows).close();
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }

        log.info("Wrote {} billing rows to {}", rows.size(), target);
        return target;
    }

    /**
     * Parse an export written by {@link #write}.
     */
    public List<BillingRow> read(Path file) throws IOException {
        try (MappingIterator<BillingRow> it = mapper.readerFor(BillingRow.class)
                .with(schema.withHeader())
                .readValues(file.toFile())) {
            return it.readAll();
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private String headerLine() {
        return StreamSupport.stream(schema.spliterator(), false)
                .map(CsvSchema.Column::getName)
                .collect(Collectors.joining("\t", "", String.valueOf(schema.getLineSeparator())));
    }
}
