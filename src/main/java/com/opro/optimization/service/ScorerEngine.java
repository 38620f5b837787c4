package com.opro.optimization.service;

import com.opro.config.OproProperties;
import com.opro.optimization.api.PromptGrader;
import com.opro.optimization.model.GradeOutcome;
import com.opro.optimization.model.QuestionAnswer;
import com.opro.optimization.model.ScoreReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.opro.optimization.OptimizationConstants.EVALUATION_SEPARATOR;

/**
 * Scores one candidate against a question set: one grading call per question, all in flight at once,
 * each with its own retry budget. Waits for every call to settle before computing accuracy.
 */
@Service
@Slf4j
public class ScorerEngine {

    private final PromptGrader grader;
    private final ExecutorService graderExecutor;
    private final Duration callTimeout;
    private final Duration dispatchStagger;

    @Autowired
    public ScorerEngine(PromptGrader grader,
                        @Qualifier("graderExecutor") ExecutorService graderExecutor,
                        OproProperties properties) {
        this(grader, graderExecutor, properties.getGrader().getCallTimeout(), properties.getGrader().getDispatchStagger());
    }

    ScorerEngine(PromptGrader grader, ExecutorService graderExecutor, Duration callTimeout, Duration dispatchStagger) {
        this.grader = grader;
        this.graderExecutor = graderExecutor;
        this.callTimeout = callTimeout;
        this.dispatchStagger = dispatchStagger;
    }

    /**
     * @throws IllegalArgumentException for a blank candidate or an empty question set
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public ScoreReport score(String candidateText, List<QuestionAnswer> questions, double temperature, String model) {
        if (!StringUtils.hasText(candidateText)) {
            throw new IllegalArgumentException("Prompt must be a non-empty string");
        }
        if (questions == null || questions.isEmpty()) {
            throw new IllegalArgumentException("Questions must be a non-empty list");
        }
        log.info("Scoring prompt against {} questions: \"{}\"", questions.size(),
                JsonProcessingService.truncate(candidateText, 120));

        List<CompletableFuture<GradeOutcome>> futures = IntStream.range(0, questions.size())
                .mapToObj(index -> gradeAsync(candidateText, questions.get(index), index, temperature, model))
                .toList();
        awaitAll(futures);

        int correct = 0;
        int failed = 0;
        for (int i = 0; i < questions.size(); i++) {
            GradeOutcome outcome = futures.get(i).join();
            if (outcome.matches(questions.get(i).goldAnswer())) {
                correct++;
            } else if (outcome instanceof GradeOutcome.Failed) {
                failed++;
            }
        }
        int total = questions.size();
        double accuracy = 100.0 * correct / total;
        ScoreReport report = new ScoreReport(accuracy, correct, total - correct, failed, total);
        log.info("Scoring complete: {}/{} correct, {} failures, accuracy={}%.", correct, total, failed,
                String.format("%.2f", accuracy));
        return report;
    }

    private CompletableFuture<GradeOutcome> gradeAsync(String candidateText, QuestionAnswer question, int index,
                                                       double temperature, String model) {
        String fullPrompt = candidateText + EVALUATION_SEPARATOR + question.question();
        long delayMillis = dispatchStagger.toMillis() * index;
        Executor dispatch = delayMillis > 0
                ? CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS, graderExecutor)
                : graderExecutor;
        return CompletableFuture.supplyAsync(() -> grader.grade(fullPrompt, temperature, model), dispatch)
                .orTimeout(callTimeout.toMillis() + delayMillis, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> new GradeOutcome.Failed("Grading call did not complete: " + ex));
    }

    private void awaitAll(List<CompletableFuture<GradeOutcome>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (InterruptedException ex) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Scoring interrupted");
        } catch (ExecutionException ex) {
            // each future already maps its failure to a Failed outcome
            throw new IllegalStateException("Unexpected grading failure", ex.getCause());
        }
    }
}
