package com.entity.research.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders {@link JobReport}s as indented JSON with ISO-8601 timestamps and durations.
 */
public class JobReportExporter {
    private static final Logger log = LoggerFactory.getLogger(JobReportExporter.class);

    private final ObjectMapper objectMapper;

    public JobReportExporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson(JobReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report for job " + report.jobId(), e);
        }
    }

    /**
     * Writes the report to a file, creating parent directories as needed.
     */
    public Path writeTo(JobReport report, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(report));
            log.info("report.written jobId={} path={}", report.jobId(), target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report for job " + report.jobId(), e);
        }
    }
}
