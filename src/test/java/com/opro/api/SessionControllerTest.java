package com.opro.api;

import com.opro.optimization.OptimizationService;
import com.opro.optimization.error.IncompleteStepFailure;
import com.opro.optimization.error.InvalidConfigFailure;
import com.opro.optimization.error.NotFoundFailure;
import com.opro.optimization.model.BatchScoreResult;
import com.opro.optimization.model.GenerationResult;
import com.opro.optimization.model.OproConfig;
import com.opro.optimization.model.Prompt;
import com.opro.optimization.model.PromptScoreResult;
import com.opro.optimization.model.PromptState;
import com.opro.optimization.model.PromptView;
import com.opro.optimization.model.ScoreReport;
import com.opro.optimization.model.Session;
import com.opro.optimization.model.Step;
import com.opro.optimization.error.GenerationFailure;
import com.opro.optimization.service.OproConfigValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    private static final OproConfig CONFIG = new OproConfig(2, 5, "opt", 1.0, "scorer", 0.0);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OptimizationService optimizationService;

    @MockitoBean
    private OproConfigValidator configValidator;

    @Test
    void testCreateSession() throws Exception {
        when(configValidator.resolve(eq(2), isNull(), isNull(), isNull(), isNull(), isNull())).thenReturn(CONFIG);
        when(optimizationService.createSession("GSM8K", CONFIG)).thenReturn(session());

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"GSM8K\",\"k\":2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("s1"))
                .andExpect(jsonPath("$.currentStep").value(0))
                .andExpect(jsonPath("$.config.k").value(2))
                .andExpect(jsonPath("$.steps[0].prompts[0].state").value("pending"));
    }

    @Test
    void testCreateSessionRejectsOutOfRangeK() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"k\":17}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("validation_failed"));
        verifyNoInteractions(optimizationService);
    }

    @Test
    void testInvalidConfigIsUnprocessable() throws Exception {
        when(configValidator.resolve(any(), any(), any(), any(), any(), any()))
                .thenThrow(new InvalidConfigFailure(List.of("optimizerModel must not be blank")));

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details[0]").value("optimizerModel must not be blank"));
    }

    @Test
    void testListSessions() throws Exception {
        when(optimizationService.listSessions()).thenReturn(List.of(session()));

        mockMvc.perform(get("/api/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("s1"))
                .andExpect(jsonPath("$[0].promptCount").value(1));
    }

    @Test
    void testMissingSessionIsNotFound() throws Exception {
        when(optimizationService.getSession("nope")).thenThrow(NotFoundFailure.session("nope"));

        mockMvc.perform(get("/api/sessions/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Session nope not found"));
    }

    @Test
    void testDeleteSession() throws Exception {
        mockMvc.perform(delete("/api/sessions/s1"))
                .andExpect(status().isNoContent());
        verify(optimizationService).deleteSession("s1");
    }

    @Test
    void testGenerate() throws Exception {
        Session session = session();
        when(optimizationService.generate("s1"))
                .thenReturn(new GenerationResult(session, session.getActiveStep().getPrompts(), false));

        mockMvc.perform(post("/api/sessions/s1/generate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prompts[0].text").value("Let's think step by step."))
                .andExpect(jsonPath("$.discarded").value(false));
    }

    @Test
    void testGenerationFailureIsBadGateway() throws Exception {
        when(optimizationService.generate("s1"))
                .thenThrow(new GenerationFailure("Failed to generate prompts after 2 attempts", new IllegalStateException()));

        mockMvc.perform(post("/api/sessions/s1/generate"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void testScoreOne() throws Exception {
        when(optimizationService.scoreOne("s1", "p1"))
                .thenReturn(PromptScoreResult.scored("p1", 87.5, new ScoreReport(87.5, 7, 1, 0, 8)));

        mockMvc.perform(post("/api/sessions/s1/prompts/p1/score"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(87.5))
                .andExpect(jsonPath("$.report.correct").value(7));
    }

    @Test
    void testScoreBatchWithAndWithoutBody() throws Exception {
        when(optimizationService.scoreBatch(eq("s1"), any())).thenReturn(new BatchScoreResult("s1", 0, List.of()));

        mockMvc.perform(post("/api/sessions/s1/score-batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"batchSize\":3}"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/sessions/s1/score-batch"))
                .andExpect(status().isOk());

        verify(optimizationService).scoreBatch("s1", 3);
        verify(optimizationService).scoreBatch("s1", null);
    }

    @Test
    void testAdvanceIncompleteStepIsConflict() throws Exception {
        when(optimizationService.advance("s1")).thenThrow(new IncompleteStepFailure("s1", 0, 1, 2));

        mockMvc.perform(post("/api/sessions/s1/advance"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("incomplete_step"));
    }

    @Test
    void testCustomScoreRequiresText() throws Exception {
        mockMvc.perform(post("/api/sessions/s1/custom-score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"\"}"))
                .andExpect(status().isBadRequest());

        when(optimizationService.customScore("s1", "Be careful.")).thenReturn(new ScoreReport(50.0, 1, 1, 1, 2));
        mockMvc.perform(post("/api/sessions/s1/custom-score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Be careful.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accuracy").value(50.0))
                .andExpect(jsonPath("$.failed").value(1));
    }

    @Test
    void testPromptsAndMetaPrompt() throws Exception {
        when(optimizationService.listPrompts("s1"))
                .thenReturn(List.of(new PromptView(0, "p1", "Think.", PromptState.SCORED, 90.0, Instant.now())));
        when(optimizationService.previewMetaPrompt("s1")).thenReturn("Your task is ...");

        mockMvc.perform(get("/api/sessions/s1/prompts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].state").value("scored"));
        mockMvc.perform(get("/api/sessions/s1/meta-prompt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metaPrompt").value("Your task is ..."));
    }

    private static Session session() {
        Session session = Session.builder()
                .id("s1")
                .name("GSM8K")
                .config(CONFIG)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
        Step step = Step.builder().stepNumber(0).build();
        step.getPrompts().add(Prompt.builder()
                .id("p1")
                .text("Let's think step by step.")
                .state(PromptState.PENDING)
                .createdAt(Instant.now())
                .build());
        session.getSteps().add(step);
        return session;
    }
}
