package com.planlens.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planlens.core.config.PlanlensProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Resolves the CLI output format and serializes analysis results as JSON.
 */
@Component
public class ReportWriter {

    public enum Format { TEXT, JSON }

    private final ObjectMapper objectMapper;
    private final PlanlensProperties properties;

    public ReportWriter(ObjectMapper objectMapper, PlanlensProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @param requested value of --format, or null to use the configured default
     * @throws IllegalArgumentException for anything other than "text" or "json"
     */
    public Format resolve(String requested) {
        String value = requested != null ? requested : properties.getDefaultFormat();
        if (value == null || value.isBlank()) {
            return Format.TEXT;
        }
        try {
            return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format: " + value + " (expected text or json)", e);
        }
    }

    public String toJson(Object result) throws JsonProcessingException {
        return properties.isPrettyJson()
                ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result)
                : objectMapper.writeValueAsString(result);
    }
}
