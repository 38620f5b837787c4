package com.opro.optimization.service;

import com.opro.config.OproProperties;
import com.opro.optimization.api.BenchmarkSource;
import com.opro.optimization.model.QuestionAnswer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code question<TAB>goldAnswer} lines once and caches them for the life of the process.
 */
@Component
@Slf4j
public class TsvBenchmarkSource implements BenchmarkSource {

    private final ResourceLoader resourceLoader;
    private final String location;
    private volatile List<QuestionAnswer> questions;

    public TsvBenchmarkSource(ResourceLoader resourceLoader, OproProperties properties) {
        this.resourceLoader = resourceLoader;
        this.location = properties.getBenchmark().getLocation();
    }

    @Override
    public List<QuestionAnswer> loadQuestions() {
        List<QuestionAnswer> loaded = questions;
        if (loaded == null) {
            synchronized (this) {
                loaded = questions;
                if (loaded == null) {
                    loaded = read();
                    questions = loaded;
                }
            }
        }
        return loaded;
    }

    private List<QuestionAnswer> read() {
        Resource resource = resourceLoader.getResource(location);
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            List<QuestionAnswer> parsed = parse(reader);
            log.info("Loaded {} benchmark questions from {}.", parsed.size(), location);
            return parsed;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read benchmark from " + location, ex);
        }
    }

    static List<QuestionAnswer> parse(Reader source) throws IOException {
        List<QuestionAnswer> results = new ArrayList<>();
        BufferedReader reader = new BufferedReader(source);
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] columns = line.split("\t");
            if (columns.length < 2) {
                log.warn("Line {} doesn't have enough columns", lineNumber);
                continue;
            }
            try {
                results.add(new QuestionAnswer(columns[0].trim(), Double.parseDouble(columns[1].trim())));
            } catch (NumberFormatException ex) {
                log.warn("Line {} has a non-numeric gold answer: {}", lineNumber, columns[1].trim());
            }
        }
        return List.copyOf(results);
    }
}
