package com.opro.optimization.model;

/**
 * One benchmark item. The gold answer is compared numerically against the grader's answer.
 */
public record QuestionAnswer(String question, double goldAnswer) {
}
