package com.opro.optimization.api;

import com.opro.optimization.model.QuestionAnswer;

import java.util.List;

/**
 * The fixed question set candidates are scored against.
 */
public interface BenchmarkSource {

    /**
     * @return The benchmark in file order; the same immutable list on every call.
     */
    List<QuestionAnswer> loadQuestions();
}
