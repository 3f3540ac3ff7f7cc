package com.evolver.core.memory;

import com.evolver.core.config.EvolverProperties;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Append-only CSV with one row per cycle. Write failures are logged and never
 * interrupt the engine.
 */
@Service
public class EvolutionLog {

    private static final Logger log = LoggerFactory.getLogger(EvolutionLog.class);

    private final Path file;
    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(EvolutionLogRow.class);

    @Autowired
    public EvolutionLog(EvolverProperties properties) {
        this(properties.getEvolutionLogFile());
    }

    public EvolutionLog(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public synchronized void append(EvolutionLogRow row) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            boolean writeHeader = !Files.exists(file) || Files.size(file) == 0;
            ObjectWriter writer = csvMapper.writer(writeHeader ? schema.withHeader() : schema.withoutHeader());
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.writeValue(out, row);
            }
        } catch (IOException e) {
            log.error("Failed to append cycle {} to evolution log {}", row.cycle(), file, e);
        }
    }

    /**
     * Reads every row back, oldest first. Returns an empty list when the file is absent or unreadable.
     */
    public synchronized List<EvolutionLogRow> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try (MappingIterator<EvolutionLogRow> rows = csvMapper.readerFor(EvolutionLogRow.class)
                .with(schema.withHeader())
                .readValues(file.toFile())) {
            return rows.readAll();
        } catch (IOException e) {
            log.error("Failed to read evolution log {}", file, e);
            return List.of();
        }
    }
}
