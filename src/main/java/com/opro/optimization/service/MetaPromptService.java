package com.opro.optimization.service;

import com.opro.optimization.api.ExampleSampler;
import com.opro.optimization.model.Prompt;
import com.opro.optimization.model.QuestionAnswer;
import com.opro.optimization.model.Session;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.opro.optimization.OptimizationConstants.*;

/**
 * Renders the search prompt sent to the optimizer model. Pure apart from the example sampler.
 */
@Service
public class MetaPromptService {

    private final ExampleSampler sampler;

    public MetaPromptService(ExampleSampler sampler) {
        this.sampler = sampler;
    }

    public String synthesize(Session session, List<QuestionAnswer> benchmark) {
        if (session.getCurrentStep() == 0) {
            return initialMetaPrompt(benchmark, session.getConfig().k());
        }
        return continuationMetaPrompt(session, benchmark);
    }

    /**
     * Best distinct-text candidates across every step, lowest score first. For duplicate texts only a
     * strictly higher score replaces the first one seen.
     */
    public List<Prompt> topCandidates(Session session) {
        Map<String, Prompt> unique = new LinkedHashMap<>();
        for (Prompt prompt : session.getScoredPrompts()) {
            Prompt existing = unique.get(prompt.getText());
            if (existing == null || prompt.getScore() > existing.getScore()) {
                unique.put(prompt.getText(), prompt);
            }
        }
        List<Prompt> ranked = new ArrayList<>(unique.values());
        ranked.sort(Comparator.comparingDouble(Prompt::getScore).reversed());
        List<Prompt> top = new ArrayList<>(ranked.subList(0, Math.min(session.getConfig().topX(), ranked.size())));
        Collections.reverse(top);
        return top;
    }

    private String initialMetaPrompt(List<QuestionAnswer> benchmark, int k) {
        StringBuilder metaPrompt = new StringBuilder(INITIAL_META_PROMPT_HEADER);
        for (QuestionAnswer example : sampler.sample(benchmark, EXAMPLES_PER_META_PROMPT)) {
            metaPrompt.append(INITIAL_EXAMPLE_TEMPLATE.formatted(example.question(), formatNumber(example.goldAnswer())));
        }
        metaPrompt.append(INITIAL_META_PROMPT_FOOTER.formatted(k));
        return metaPrompt.toString();
    }

    private String continuationMetaPrompt(Session session, List<QuestionAnswer> benchmark) {
        int k = session.getConfig().k();
        StringBuilder metaPrompt = new StringBuilder(CONTINUATION_META_PROMPT_HEADER.formatted(k));
        for (Prompt prompt : topCandidates(session)) {
            metaPrompt.append(SCORED_CANDIDATE_LINE.formatted(formatNumber(prompt.getScore()), prompt.getText()));
        }
        metaPrompt.append(CONTINUATION_EXAMPLES_HEADER);
        for (QuestionAnswer example : sampler.sample(benchmark, EXAMPLES_PER_META_PROMPT)) {
            metaPrompt.append(CONTINUATION_EXAMPLE_LINE.formatted(example.question(), formatNumber(example.goldAnswer())));
        }
        metaPrompt.append(CONTINUATION_META_PROMPT_FOOTER.formatted(k));
        return metaPrompt.toString();
    }

    // 72.0 -> "72", 33.33 -> "33.33"
    static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
