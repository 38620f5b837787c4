package com.opro.optimization.service;

import com.opro.config.OproProperties;
import com.opro.optimization.model.QuestionAnswer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TsvBenchmarkSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testParseSkipsBlankShortAndNonNumericLines() throws IOException {
        String tsv = "What is 2+2?\t4\n"
                + "\n"
                + "no answer column\n"
                + "What is half of 3?\t1.5\n"
                + "Bad answer\tfour\n";

        List<QuestionAnswer> questions = TsvBenchmarkSource.parse(new StringReader(tsv));

        assertEquals(List.of(new QuestionAnswer("What is 2+2?", 4), new QuestionAnswer("What is half of 3?", 1.5)),
                questions);
        assertThrows(UnsupportedOperationException.class, () -> questions.add(new QuestionAnswer("x", 1)));
    }

    @Test
    void testLoadsBundledBenchmark() {
        TsvBenchmarkSource source = new TsvBenchmarkSource(new DefaultResourceLoader(), new OproProperties());

        List<QuestionAnswer> questions = source.loadQuestions();

        assertFalse(questions.isEmpty());
        assertEquals(72.0, questions.get(0).goldAnswer());
        assertSame(questions, source.loadQuestions());
    }

    @Test
    void testLoadsFromFile() throws IOException {
        Path file = tempDir.resolve("bench.tsv");
        Files.writeString(file, "Q1\t10\nQ2\t20\n");
        OproProperties properties = new OproProperties();
        properties.getBenchmark().setLocation(file.toUri().toString());

        List<QuestionAnswer> questions = new TsvBenchmarkSource(new DefaultResourceLoader(), properties).loadQuestions();

        assertEquals(2, questions.size());
        assertEquals("Q2", questions.get(1).question());
    }

    @Test
    void testMissingFile() {
        OproProperties properties = new OproProperties();
        properties.getBenchmark().setLocation(tempDir.resolve("missing.tsv").toUri().toString());

        TsvBenchmarkSource source = new TsvBenchmarkSource(new DefaultResourceLoader(), properties);

        assertThrows(UncheckedIOException.class, source::loadQuestions);
    }
}
