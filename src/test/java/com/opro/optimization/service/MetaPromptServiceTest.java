package com.opro.optimization.service;

import com.opro.optimization.api.ExampleSampler;
import com.opro.optimization.model.OproConfig;
import com.opro.optimization.model.Prompt;
import com.opro.optimization.model.PromptState;
import com.opro.optimization.model.QuestionAnswer;
import com.opro.optimization.model.Session;
import com.opro.optimization.model.Step;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MetaPromptServiceTest {

    private static final List<QuestionAnswer> BENCHMARK = List.of(
            new QuestionAnswer("Natalia sold 48 clips in April and half as many in May. How many in total?", 72),
            new QuestionAnswer("Weng earns $12 an hour. How much did she earn for 50 minutes?", 10),
            new QuestionAnswer("Betty needs $100 and has half. Parents give $15, grandparents twice that. How much more?", 5),
            new QuestionAnswer("James writes a 3-page letter to 2 friends twice a week. How many pages a year?", 624));

    // Deterministic: always the first n items
    private final ExampleSampler firstN = new ExampleSampler() {
        @Override
        public <T> List<T> sample(List<T> items, int n) {
            return List.copyOf(items.subList(0, Math.min(n, items.size())));
        }
    };

    private final MetaPromptService service = new MetaPromptService(firstN);

    @Test
    void testInitialMetaPromptUsesThreeExamplesAndK() {
        Session session = session(3, 5);

        String metaPrompt = service.synthesize(session, BENCHMARK);

        assertTrue(metaPrompt.contains("<INS>"));
        assertTrue(metaPrompt.contains(BENCHMARK.get(0).question()));
        assertTrue(metaPrompt.contains(BENCHMARK.get(2).question()));
        assertFalse(metaPrompt.contains(BENCHMARK.get(3).question()));
        assertTrue(metaPrompt.contains("Write 3 new instructions"));
        assertTrue(metaPrompt.contains("\n72\n"));
    }

    @Test
    void testInitialMetaPromptWithSmallBenchmark() {
        String metaPrompt = service.synthesize(session(2, 5), BENCHMARK.subList(0, 1));

        assertTrue(metaPrompt.contains(BENCHMARK.get(0).question()));
        assertFalse(metaPrompt.contains(BENCHMARK.get(1).question()));
    }

    @Test
    void testDuplicateTextsKeepHighestScore() {
        Session session = session(2, 5);
        addScored(session, "Think step by step.", 40.0);
        addScored(session, "Think step by step.", 90.0);
        advanceTo(session, 1);

        List<Prompt> top = service.topCandidates(session);

        assertEquals(1, top.size());
        assertEquals(90.0, top.get(0).getScore());
    }

    @Test
    void testEqualScoresKeepFirstSeen() {
        Session session = session(2, 5);
        addScored(session, "Same text", 50.0);
        addScored(session, "Same text", 50.0);
        String firstId = session.getSteps().get(0).getPrompts().get(0).getId();

        List<Prompt> top = service.topCandidates(session);

        assertEquals(1, top.size());
        assertEquals(firstId, top.get(0).getId());
    }

    @Test
    void testTopXTruncatesThenPresentsAscending() {
        Session session = session(2, 2);
        addScored(session, "ten", 10.0);
        addScored(session, "fifty", 50.0);
        addScored(session, "thirty", 30.0);
        advanceTo(session, 1);

        List<Prompt> top = service.topCandidates(session);
        assertEquals(List.of("thirty", "fifty"), top.stream().map(Prompt::getText).toList());

        String metaPrompt = service.synthesize(session, BENCHMARK);
        int thirty = metaPrompt.indexOf("Precision: 30 <Start>thirty</Start>");
        int fifty = metaPrompt.indexOf("Precision: 50 <Start>fifty</Start>");
        assertTrue(thirty >= 0);
        assertTrue(fifty > thirty);
        assertFalse(metaPrompt.contains("<Start>ten</Start>"));
    }

    @Test
    void testPoolSpansAllStepsAndIgnoresUnscored() {
        Session session = session(2, 10);
        addScored(session, "old", 60.0);
        advanceTo(session, 1);
        session.getActiveStep().getPrompts().add(prompt("unscored", PromptState.PENDING, null));
        addScored(session, "new", 70.0);

        List<Prompt> top = service.topCandidates(session);

        assertEquals(List.of("old", "new"), top.stream().map(Prompt::getText).toList());
    }

    @Test
    void testContinuationWithEmptyPool() {
        Session session = session(4, 5);
        advanceTo(session, 1);

        String metaPrompt = service.synthesize(session, BENCHMARK);

        assertFalse(metaPrompt.contains("Precision:"));
        assertTrue(metaPrompt.contains("Generate 4 new starting sentences"));
        assertTrue(metaPrompt.contains("Problem: " + BENCHMARK.get(0).question() + " <Start> Ground truth: 72"));
    }

    @Test
    void testFormatNumber() {
        assertEquals("72", MetaPromptService.formatNumber(72.0));
        assertEquals("33.33", MetaPromptService.formatNumber(33.33));
        assertEquals("0", MetaPromptService.formatNumber(0.0));
    }

    private static Session session(int k, int topX) {
        Session session = Session.builder()
                .id(UUID.randomUUID().toString())
                .name("test")
                .config(new OproConfig(k, topX, "optimizer", 1.0, "scorer", 0.0))
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
        session.getSteps().add(Step.builder().stepNumber(0).build());
        return session;
    }

    private static void addScored(Session session, String text, double score) {
        session.getActiveStep().getPrompts().add(prompt(text, PromptState.SCORED, score));
    }

    private static void advanceTo(Session session, int stepNumber) {
        session.getSteps().add(Step.builder().stepNumber(stepNumber).prompts(new ArrayList<>()).build());
        session.setCurrentStep(stepNumber);
    }

    private static Prompt prompt(String text, PromptState state, Double score) {
        return Prompt.builder()
                .id(UUID.randomUUID().toString())
                .text(text)
                .state(state)
                .score(score)
                .createdAt(Instant.now())
                .build();
    }
}
