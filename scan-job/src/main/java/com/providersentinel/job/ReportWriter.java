package com.providersentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.providersentinel.core.report.FraudScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Renders a {@link FraudScanReport} as pretty-printed JSON: snake_case
 * property names, ISO-8601 dates and months.
 *
 * @since 1.0.0
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @param report the report to render
     * @return the JSON text
     * @throws JsonProcessingException if the report cannot be serialized
     */
    public String toJson(FraudScanReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(Objects.requireNonNull(report, "report must not be null"));
    }

    /**
     * Write the report to {@code target}, creating parent directories as
     * needed.
     *
     * @param report the report to render
     * @param target output file
     * @throws IOException if the file cannot be written
     */
    public void write(FraudScanReport report, Path target) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(report));
        LOG.info("Report written to {}", target.toAbsolutePath());
    }
}
