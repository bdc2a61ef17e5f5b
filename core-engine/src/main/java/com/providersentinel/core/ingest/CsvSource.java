package com.providersentinel.core.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streams a header-first CSV file and coerces each row into a typed record.
 *
 * <p>
 * Rows are read as column-name to value maps, so only the columns a loader
 * asks for matter and extra columns are ignored. Two failure classes are
 * kept apart:
 * </p>
 * <ul>
 * <li>a row that cannot be parsed or coerced is skipped and counted;</li>
 * <li>a missing or unreadable file raises {@link DatasetLoadException}.</li>
 * </ul>
 *
 * <h3>Unbalanced quotes</h3>
 * <p>
 * A quoted cell that is never closed runs on through the following lines,
 * so every row up to the next closing quote (or the end of the file) is
 * consumed by that one failure and counted as a single skipped row. A
 * failure spanning more than one physical line is logged at WARN with the
 * line range.
 * </p>
 *
 * @since 1.0.0
 */
public final class CsvSource {

    private static final Logger LOG = LoggerFactory.getLogger(CsvSource.class);

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    /**
     * Coerces one raw row into a record.
     *
     * @param <T> record type
     */
    @FunctionalInterface
    public interface RowMapper<T> {

        /**
         * @param row column name to raw value; blank cells map to {@code ""}
         * @return the typed record
         * @throws IllegalArgumentException if a field cannot be coerced
         * @throws DateTimeException        if a date field cannot be parsed
         */
        T map(Map<String, String> row);
    }

    private CsvSource() {
        // utility class
    }

    /**
     * Read every row of {@code file} through {@code mapper}.
     *
     * @param file   CSV file with a header line
     * @param mapper row coercion
     * @param <T>    record type
     * @return coerced records and row accounting
     * @throws DatasetLoadException if the file is missing or unreadable
     */
    public static <T> LoadResult<T> read(Path file, RowMapper<T> mapper) {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");

        List<T> records = new ArrayList<>();
        long rowsRead = 0;
        long rowsSkipped = 0;
        long lastFailureOffset = -1;

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> rows = MAPPER.readerForMapOf(String.class)
                        .with(HEADER_SCHEMA)
                        .readValues(reader)) {

            while (true) {
                Map<String, String> row;
                int lineBefore = rows.getCurrentLocation().getLineNr();
                try {
                    if (!rows.hasNextValue()) {
                        break;
                    }
                    row = rows.nextValue();
                } catch (JsonProcessingException e) {
                    long offset = rows.getCurrentLocation().getCharOffset();
                    if (offset == lastFailureOffset) {
                        throw new DatasetLoadException("Unrecoverable CSV structure in " + file
                                + " near offset " + offset, e);
                    }
                    lastFailureOffset = offset;
                    rowsRead++;
                    rowsSkipped++;
                    int lineAfter = rows.getCurrentLocation().getLineNr();
                    if (lineAfter - lineBefore > 1) {
                        LOG.warn("Malformed row in {} consumed lines {} to {}, likely an unbalanced quote: {}",
                                file.getFileName(), lineBefore, lineAfter, e.getOriginalMessage());
                    }
                    LOG.trace("Skipping malformed row in {}: {}", file.getFileName(), e.getOriginalMessage());
                    continue;
                }

                rowsRead++;
                try {
                    records.add(mapper.map(row));
                } catch (IllegalArgumentException | DateTimeException e) {
                    rowsSkipped++;
                    LOG.trace("Skipping row {} of {}: {}", rowsRead, file.getFileName(), e.getMessage());
                }
            }
        } catch (NoSuchFileException e) {
            throw new DatasetLoadException("Required input not found: " + file, e);
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to read input: " + file, e);
        }

        if (rowsSkipped > 0) {
            LOG.warn("{}: skipped {} of {} row(s) that could not be parsed",
                    file.getFileName(), rowsSkipped, rowsRead);
        }
        LOG.info("{}: loaded {} record(s)", file.getFileName(), records.size());
        return new LoadResult<>(file.getFileName().toString(), records, rowsRead, rowsSkipped);
    }

    // ---------------------------------------------------------------
    // Field helpers shared by the loaders
    // ---------------------------------------------------------------

    /**
     * @return the trimmed value, or {@code null} when missing or blank
     */
    static String optional(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * @return the trimmed value
     * @throws IllegalArgumentException when missing or blank
     */
    static String required(Map<String, String> row, String column) {
        String value = optional(row, column);
        if (value == null) {
            throw new IllegalArgumentException("Missing required column '" + column + "'");
        }
        return value;
    }

    /**
     * @return the value parsed as a finite double
     * @throws IllegalArgumentException when missing, malformed or not finite
     */
    static double requiredAmount(Map<String, String> row, String column) {
        double value = Double.parseDouble(required(row, column));
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Non-finite value in column '" + column + "'");
        }
        return value;
    }
}
