package com.opro.optimization.service;

import com.opro.optimization.api.PromptGrader;
import com.opro.optimization.model.GradeOutcome;
import com.opro.optimization.model.QuestionAnswer;
import com.opro.optimization.model.ScoreReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScorerEngineTest {

    private static final List<QuestionAnswer> QUESTIONS = List.of(
            new QuestionAnswer("q1", 1),
            new QuestionAnswer("q2", 2),
            new QuestionAnswer("q3", 3),
            new QuestionAnswer("q4", 4));

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testAccuracyCountsFailuresAsIncorrect() {
        Map<String, GradeOutcome> outcomes = Map.of(
                "q1", new GradeOutcome.Answered(1),
                "q2", new GradeOutcome.Answered(5),
                "q3", new GradeOutcome.Failed("exhausted"),
                "q4", new GradeOutcome.Answered(4));
        PromptGrader grader = (fullPrompt, temperature, model) -> outcomes.get(fullPrompt.substring(fullPrompt.lastIndexOf('\n') + 1));
        ScorerEngine engine = new ScorerEngine(grader, executor, Duration.ofSeconds(5), Duration.ZERO);

        ScoreReport report = engine.score("Solve carefully.", QUESTIONS, 0.0, "scorer");

        assertEquals(50.0, report.accuracy());
        assertEquals(2, report.correct());
        assertEquals(2, report.incorrect());
        assertEquals(1, report.failed());
        assertEquals(4, report.total());
    }

    @Test
    void testEvaluationPromptIsCandidateThenQuestion() {
        Set<String> seen = ConcurrentHashMap.newKeySet();
        PromptGrader grader = (fullPrompt, temperature, model) -> {
            seen.add(fullPrompt);
            return new GradeOutcome.Answered(0);
        };
        ScorerEngine engine = new ScorerEngine(grader, executor, Duration.ofSeconds(5), Duration.ofMillis(1));

        engine.score("Be precise.", QUESTIONS.subList(0, 2), 0.0, "scorer");

        assertEquals(Set.of("Be precise.\n\nq1", "Be precise.\n\nq2"), seen);
    }

    @Test
    void testAllQuestionsGradedConcurrently() throws InterruptedException {
        CountDownLatch allStarted = new CountDownLatch(QUESTIONS.size());
        PromptGrader grader = (fullPrompt, temperature, model) -> {
            allStarted.countDown();
            try {
                // every call blocks until all four are in flight
                if (!allStarted.await(5, TimeUnit.SECONDS)) {
                    return new GradeOutcome.Failed("not concurrent");
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return new GradeOutcome.Answered(Double.parseDouble(fullPrompt.substring(fullPrompt.length() - 1)));
        };
        ScorerEngine engine = new ScorerEngine(grader, executor, Duration.ofSeconds(10), Duration.ZERO);

        ScoreReport report = engine.score("x", QUESTIONS, 0.0, "scorer");

        assertEquals(100.0, report.accuracy());
        assertEquals(0, allStarted.getCount());
    }

    @Test
    void testTimedOutCallCountsAsFailed() {
        PromptGrader grader = (fullPrompt, temperature, model) -> {
            if (fullPrompt.endsWith("q1")) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            return new GradeOutcome.Answered(2);
        };
        ScorerEngine engine = new ScorerEngine(grader, executor, Duration.ofMillis(100), Duration.ZERO);

        ScoreReport report = engine.score("x", QUESTIONS.subList(0, 2), 0.0, "scorer");

        assertEquals(1, report.correct());
        assertEquals(1, report.failed());
        assertEquals(50.0, report.accuracy());
    }

    @Test
    void testRejectsEmptyQuestionSetAndBlankCandidate() {
        ScorerEngine engine = new ScorerEngine((p, t, m) -> new GradeOutcome.Answered(0), executor,
                Duration.ofSeconds(1), Duration.ZERO);

        assertThrows(IllegalArgumentException.class, () -> engine.score("x", List.of(), 0.0, "scorer"));
        assertThrows(IllegalArgumentException.class, () -> engine.score(" ", QUESTIONS, 0.0, "scorer"));
    }

    @Test
    void testRoundedAccuracy() {
        assertEquals(33.33, new ScoreReport(100.0 / 3, 1, 2, 0, 3).roundedAccuracy());
        assertEquals(66.67, new ScoreReport(200.0 / 3, 2, 1, 0, 3).roundedAccuracy());
    }
}
