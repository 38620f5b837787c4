package com.opro.optimization.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opro.optimization.model.GradeOutcome;
import com.opro.optimization.model.ProposalReply;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Turns raw model replies into validated, tagged results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private final ObjectMapper objectMapper;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProposalPayload(String totalTexts, List<String> texts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GradePayload(String solve, Double answer) {
    }

    public ProposalReply parseProposal(@Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            return new ProposalReply.EmptyResponse();
        }
        ProposalPayload payload = parseJsonResponse("proposal", raw, ProposalPayload.class);
        if (payload == null) {
            return new ProposalReply.ParseError("reply is not valid JSON", truncate(raw, 240));
        }
        if (payload.texts() == null || payload.texts().isEmpty()) {
            return new ProposalReply.ParseError("texts array is empty or missing", truncate(raw, 240));
        }
        return new ProposalReply.Texts(payload.texts());
    }

    public GradeOutcome parseGrade(@Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            return new GradeOutcome.EmptyResponse();
        }
        GradePayload payload = parseJsonResponse("grading", raw, GradePayload.class);
        if (payload == null || payload.answer() == null || payload.answer().isNaN()) {
            return new GradeOutcome.ParseError(truncate(raw, 240));
        }
        return new GradeOutcome.Answered(payload.answer());
    }

    public <T> @Nullable T parseJsonResponse(String label, @Nullable String raw, Class<T> type) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty response for {}. Unable to parse JSON.", label);
            return null;
        }
        String json = extractJsonObject(raw);
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception ex) {
            log.warn("Failed to parse {} response as JSON. Snippet: {}", label, truncate(raw, 240));
            return null;
        }
    }

    // Models sometimes wrap the object in prose or a fenced block
    private String extractJsonObject(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed;
        }
        int firstBrace = trimmed.indexOf('{');
        int lastBrace = trimmed.lastIndexOf('}');
        if (firstBrace >= 0 && lastBrace > firstBrace) {
            return trimmed.substring(firstBrace, lastBrace + 1);
        }
        return trimmed;
    }

    static String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    public <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), ex);
        }
    }
}
