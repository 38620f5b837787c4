package com.opro.optimization.api;

import com.opro.optimization.model.GradeOutcome;

/**
 * Asks the scorer model to solve one benchmark question framed by a candidate instruction.
 */
public interface PromptGrader {

    /**
     * Grades one evaluation prompt. Never throws; an exhausted retry budget yields
     * {@link GradeOutcome.Failed}.
     *
     * @param fullPrompt Candidate text followed by the question text.
     * @param temperature Scorer sampling temperature.
     * @param model Scorer model identifier.
     * @return The validated grading outcome.
     */
    GradeOutcome grade(String fullPrompt, double temperature, String model);
}
