package com.chronoplan.core.portfolio;

import com.chronoplan.core.model.Portfolio;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads portfolio snapshots from JSON and validates them before they reach the engine.
 * Dates are plain {@code YYYY-MM-DD} strings.
 */
@Service
public class PortfolioReader {

    private static final Logger log = LoggerFactory.getLogger(PortfolioReader.class);

    private final ObjectMapper objectMapper;
    private final PortfolioValidator validator;

    public PortfolioReader(ObjectMapper objectMapper, PortfolioValidator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /** Mapper configured the way the reader expects, for use outside a Spring context. */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Portfolio read(Path file) {
        log.debug("Reading portfolio from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new PortfolioReadException("Cannot read portfolio file " + file + ": " + e.getMessage(), e);
        }
    }

    public Portfolio read(InputStream in, String sourceName) {
        Portfolio portfolio;
        try {
            portfolio = objectMapper.readValue(in, Portfolio.class);
        } catch (IOException e) {
            throw new PortfolioReadException("Cannot parse portfolio " + sourceName + ": " + e.getMessage(), e);
        }
        validator.validate(portfolio);
        log.info("Loaded portfolio {}: {} project(s), {} pooled resource(s)",
                sourceName, portfolio.projectsOrEmpty().size(), portfolio.resourcePoolOrEmpty().size());
        return portfolio;
    }
}
