package com.opro.optimization.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opro.config.OproProperties;
import com.opro.config.ResilienceConfig;
import com.opro.optimization.api.LanguageModelClient;
import com.opro.optimization.error.GenerationFailure;
import com.opro.optimization.model.ModelCompletion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ProposerClientTest {

    private LanguageModelClient languageModel;
    private ModelCallMetricsService metricsService;
    private ProposerClient proposer;

    @BeforeEach
    void setUp() {
        languageModel = mock(LanguageModelClient.class);
        metricsService = new ModelCallMetricsService();
        proposer = new ProposerClient(languageModel,
                new JsonProcessingService(new ObjectMapper()),
                metricsService,
                ResilienceConfig.modelCallRetry("proposer-test", new OproProperties.RetryConfig(2, Duration.ofMillis(1))));
    }

    @Test
    void testProposeStripsMarkersAndTruncatesToK() {
        when(languageModel.complete(anyString(), eq("gemini-2.5-flash"), eq(1.0)))
                .thenReturn(reply("{\"totalTexts\":\"3\",\"texts\":[\" <Start>Let's think step by step.</Start> \",\"Work backwards.\",\"Extra\"]}"));

        List<String> prompts = proposer.propose("meta prompt", 2, 1.0, "gemini-2.5-flash");

        assertEquals(List.of("Let's think step by step.", "Work backwards."), prompts);
        assertEquals(1, metricsService.read().proposal().requests());
        verify(languageModel).complete(contains("exactly 2 entries"), eq("gemini-2.5-flash"), eq(1.0));
    }

    @Test
    void testRetriesOnceAfterMalformedReply() {
        when(languageModel.complete(anyString(), anyString(), anyDouble()))
                .thenReturn(reply("I cannot produce JSON today"))
                .thenReturn(reply("{\"texts\":[\"Check units.\"]}"));

        List<String> prompts = proposer.propose("meta prompt", 1, 0.7, "model");

        assertEquals(List.of("Check units."), prompts);
        verify(languageModel, times(2)).complete(anyString(), anyString(), anyDouble());
    }

    @Test
    void testRetriesAfterTransportError() {
        when(languageModel.complete(anyString(), anyString(), anyDouble()))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(reply("{\"texts\":[\"Be careful.\"]}"));

        assertEquals(List.of("Be careful."), proposer.propose("meta prompt", 1, 0.7, "model"));
    }

    @Test
    void testFailsAfterTwoAttempts() {
        when(languageModel.complete(anyString(), anyString(), anyDouble())).thenReturn(reply(""));

        GenerationFailure failure = assertThrows(GenerationFailure.class,
                () -> proposer.propose("meta prompt", 4, 1.0, "model"));

        assertTrue(failure.getMessage().contains("Empty response"));
        verify(languageModel, times(2)).complete(anyString(), anyString(), anyDouble());
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> proposer.propose(" ", 2, 1.0, "model"));
        assertThrows(IllegalArgumentException.class, () -> proposer.propose("meta", 0, 1.0, "model"));
        assertThrows(IllegalArgumentException.class, () -> proposer.propose("meta", 17, 1.0, "model"));
        verifyNoInteractions(languageModel);
    }

    @Test
    void testClean() {
        assertEquals(List.of("a", "b"), ProposerClient.clean(Arrays.asList(" a ", null, "<Start></Start>", "b"), 4));
        assertEquals(List.of("a"), ProposerClient.clean(List.of("a", "b"), 1));
    }

    private static ModelCompletion reply(String text) {
        return new ModelCompletion(text, 100, 20);
    }
}
