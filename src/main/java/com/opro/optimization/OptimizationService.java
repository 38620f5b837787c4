package com.opro.optimization;

import com.opro.config.OproProperties;
import com.opro.optimization.api.BenchmarkSource;
import com.opro.optimization.api.PromptProposer;
import com.opro.optimization.api.SessionStore;
import com.opro.optimization.error.IllegalTransitionFailure;
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
import com.opro.optimization.model.QuestionAnswer;
import com.opro.optimization.model.ScoreReport;
import com.opro.optimization.model.Session;
import com.opro.optimization.model.Step;
import com.opro.optimization.service.MetaPromptService;
import com.opro.optimization.service.OproConfigValidator;
import com.opro.optimization.service.ScorerEngine;
import com.opro.optimization.service.SessionActivityTracker;
import com.opro.optimization.service.SessionActivityTracker.Ticket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Drives the generate, score and advance loop over sessions held in the {@link SessionStore}.
 * <p>
 * Every mutation is a read-modify-write of the whole session performed under a per-session lock, so
 * completions of concurrent scoring calls cannot overwrite each other. Model calls run outside the
 * lock. Completions started before the operator switched to another session are dropped.
 */
@Service
@Slf4j
public class OptimizationService {

    private static final String DEFAULT_SESSION_NAME = "Untitled session";

    private final SessionStore store;
    private final BenchmarkSource benchmarkSource;
    private final MetaPromptService metaPromptService;
    private final PromptProposer proposer;
    private final ScorerEngine scorer;
    private final SessionActivityTracker activity;
    private final OproConfigValidator configValidator;
    private final ExecutorService scoringExecutor;
    private final OproProperties properties;

    private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();
    private final Set<String> promptsInFlight = ConcurrentHashMap.newKeySet();

    public OptimizationService(SessionStore store,
                               BenchmarkSource benchmarkSource,
                               MetaPromptService metaPromptService,
                               PromptProposer proposer,
                               ScorerEngine scorer,
                               SessionActivityTracker activity,
                               OproConfigValidator configValidator,
                               @Qualifier("scoringExecutor") ExecutorService scoringExecutor,
                               OproProperties properties) {
        this.store = store;
        this.benchmarkSource = benchmarkSource;
        this.metaPromptService = metaPromptService;
        this.proposer = proposer;
        this.scorer = scorer;
        this.activity = activity;
        this.configValidator = configValidator;
        this.scoringExecutor = scoringExecutor;
        this.properties = properties;
    }

    // Session CRUD

    /**
     * Creates a session with an empty step 0 and makes it the active session.
     */
    public Session createSession(@Nullable String name, OproConfig config) {
        configValidator.validate(config);
        Instant now = Instant.now();
        Session session = Session.builder()
                .id(UUID.randomUUID().toString())
                .name(StringUtils.hasText(name) ? name.trim() : DEFAULT_SESSION_NAME)
                .currentStep(0)
                .config(config)
                .createdAt(now)
                .updatedAt(now)
                .build();
        session.getSteps().add(Step.builder().stepNumber(0).build());
        store.put(session);
        activity.activate(session.getId());
        log.info("Created session {} ('{}') with k={}, topX={}.", session.getId(), session.getName(),
                config.k(), config.topX());
        return session;
    }

    public Session getSession(String sessionId) {
        return store.get(sessionId).orElseThrow(() -> NotFoundFailure.session(sessionId));
    }

    /**
     * @return All sessions, newest first.
     */
    public List<Session> listSessions() {
        List<Session> sessions = new ArrayList<>(store.listAll());
        sessions.sort(Comparator.comparing(Session::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return sessions;
    }

    public void deleteSession(String sessionId) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            getSession(sessionId);
            store.delete(sessionId);
        } finally {
            lock.unlock();
        }
        sessionLocks.remove(sessionId);
        activity.deactivate(sessionId);
        log.info("Deleted session {}.", sessionId);
    }

    /**
     * Switches the operator to {@code sessionId}. In-flight completions for the previously active
     * session are discarded when they arrive. Prompts left in {@code scoring} by such discarded
     * completions are put back to {@code pending}.
     */
    public Session activateSession(String sessionId) {
        getSession(sessionId);
        activity.activate(sessionId);
        return update(sessionId, session -> session.getSteps().stream()
                .flatMap(step -> step.getPrompts().stream())
                .filter(prompt -> prompt.getState() == PromptState.SCORING)
                .filter(prompt -> !promptsInFlight.contains(prompt.getId()))
                .forEach(prompt -> {
                    log.info("Releasing prompt {} of session {} left in scoring.", prompt.getId(), sessionId);
                    prompt.setState(PromptState.PENDING);
                    prompt.setScore(null);
                }));
    }

    // Optimization loop

    public String previewMetaPrompt(String sessionId) {
        return metaPromptService.synthesize(getSession(sessionId), benchmarkSource.loadQuestions());
    }

    /**
     * Asks the proposer for {@code k} candidates and appends them to the current step as pending
     * prompts. Only allowed while the current step is empty. A proposer failure propagates and leaves
     * the step untouched.
     */
    public GenerationResult generate(String sessionId) {
        Session session = getSession(sessionId);
        Ticket ticket = activity.enter(sessionId);
        requireEmptyActiveStep(session);

        OproConfig config = session.getConfig();
        String metaPrompt = metaPromptService.synthesize(session, benchmarkSource.loadQuestions());
        log.info("Generating {} candidates for step {} of session {}.", config.k(), session.getCurrentStep(), sessionId);
        List<String> texts = proposer.propose(metaPrompt, config.k(), config.optimizerTemperature(), config.optimizerModel());

        Instant now = Instant.now();
        List<Prompt> prompts = texts.stream()
                .map(text -> Prompt.builder()
                        .id(UUID.randomUUID().toString())
                        .text(text)
                        .state(PromptState.PENDING)
                        .createdAt(now)
                        .build())
                .toList();

        Optional<Session> updated = updateIfCurrent(ticket, sessionId, current -> {
            requireEmptyActiveStep(current);
            current.getActiveStep().getPrompts().addAll(prompts);
        });
        if (updated.isEmpty()) {
            log.info("Discarding {} generated candidates for session {}: session no longer active.", prompts.size(), sessionId);
            return new GenerationResult(store.get(sessionId).orElse(session), List.of(), true);
        }
        log.info("Step {} of session {} now holds {} pending prompts.", updated.get().getCurrentStep(), sessionId, prompts.size());
        return new GenerationResult(updated.get(), prompts, false);
    }

    /**
     * Scores one pending prompt against the benchmark. On success the prompt becomes {@code scored}
     * with the accuracy rounded to two decimals; on failure it returns to {@code pending}.
     */
    public PromptScoreResult scoreOne(String sessionId, String promptId) {
        getSession(sessionId);
        Ticket ticket = activity.enter(sessionId);
        return scorePrompt(ticket, sessionId, promptId, requireBenchmark());
    }

    /**
     * Scores the first {@code batchSize} pending prompts of the current step concurrently. Membership is
     * fixed when the batch starts.
     */
    public BatchScoreResult scoreBatch(String sessionId, @Nullable Integer batchSize) {
        Session session = getSession(sessionId);
        Ticket ticket = activity.enter(sessionId);
        List<QuestionAnswer> benchmark = requireBenchmark();
        int size = resolveBatchSize(session, batchSize);

        Step step = session.getActiveStep();
        List<String> members = step.pendingPrompts().stream()
                .limit(size)
                .map(Prompt::getId)
                .toList();
        if (members.isEmpty()) {
            log.info("No pending prompts in step {} of session {}.", step.getStepNumber(), sessionId);
            return new BatchScoreResult(sessionId, step.getStepNumber(), List.of());
        }
        log.info("Scoring batch of {} prompts in step {} of session {}.", members.size(), step.getStepNumber(), sessionId);

        List<CompletableFuture<PromptScoreResult>> futures = members.stream()
                .map(promptId -> CompletableFuture
                        .supplyAsync(() -> scorePrompt(ticket, sessionId, promptId, benchmark), scoringExecutor)
                        .exceptionally(ex -> {
                            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                            log.warn("Prompt {} was not scored: {}", promptId, cause.getMessage());
                            return PromptScoreResult.failed(promptId, cause.getMessage(), false);
                        }))
                .toList();
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<PromptScoreResult> results = futures.stream().map(CompletableFuture::join).toList();
        BatchScoreResult result = new BatchScoreResult(sessionId, step.getStepNumber(), results);
        log.info("Batch finished for session {}: {} scored, {} failed.", sessionId, result.scoredCount(), result.failedCount());
        return result;
    }

    /**
     * Opens the next step. Refused with {@link IncompleteStepFailure} while the current step is empty
     * or holds a prompt that is not scored.
     */
    public Session advance(String sessionId) {
        getSession(sessionId);
        activity.enter(sessionId);
        Session advanced = update(sessionId, session -> {
            Step active = session.getActiveStep();
            long unscored = active.getPrompts().stream()
                    .filter(prompt -> prompt.getState() != PromptState.SCORED)
                    .count();
            if (active.getPrompts().isEmpty() || unscored > 0) {
                throw new IncompleteStepFailure(sessionId, active.getStepNumber(), unscored, active.getPrompts().size());
            }
            int next = session.getCurrentStep() + 1;
            session.getSteps().add(Step.builder().stepNumber(next).build());
            session.setCurrentStep(next);
        });
        log.info("Session {} advanced to step {}.", sessionId, advanced.getCurrentStep());
        return advanced;
    }

    /**
     * Scores ad-hoc text with the session's scorer settings. Does not touch the session.
     */
    public ScoreReport customScore(String sessionId, String candidateText) {
        OproConfig config = getSession(sessionId).getConfig();
        return scorer.score(candidateText, requireBenchmark(), config.scorerTemperature(), config.scorerModel());
    }

    /**
     * @return Every prompt of the session, best score first and unscored prompts last.
     */
    public List<PromptView> listPrompts(String sessionId) {
        Session session = getSession(sessionId);
        List<PromptView> views = new ArrayList<>();
        for (Step step : session.getSteps()) {
            step.getPrompts().forEach(prompt -> views.add(PromptView.of(step, prompt)));
        }
        views.sort(Comparator.comparing(PromptView::score, Comparator.nullsLast(Comparator.reverseOrder())));
        return views;
    }

    public boolean isActive(String sessionId) {
        return activity.isActive(sessionId);
    }

    private PromptScoreResult scorePrompt(Ticket ticket, String sessionId, String promptId, List<QuestionAnswer> benchmark) {
        Optional<Session> claim = updateIfCurrent(ticket, sessionId, session -> {
            Prompt prompt = session.findPrompt(promptId).orElseThrow(() -> NotFoundFailure.prompt(sessionId, promptId));
            transition(prompt, PromptState.SCORING);
        });
        if (claim.isEmpty()) {
            log.info("Skipping prompt {}: session {} no longer active.", promptId, sessionId);
            return PromptScoreResult.failed(promptId, "Session " + sessionId + " is no longer active", true);
        }
        Session claimed = claim.get();
        promptsInFlight.add(promptId);
        try {
            OproConfig config = claimed.getConfig();
            String text = claimed.findPrompt(promptId).map(Prompt::getText).orElseThrow();
            ScoreReport report;
            try {
                report = scorer.score(text, benchmark, config.scorerTemperature(), config.scorerModel());
            } catch (RuntimeException ex) {
                log.warn("Scoring prompt {} of session {} failed: {}", promptId, sessionId, ex.getMessage());
                Optional<Session> reverted = updateIfCurrent(ticket, sessionId, session -> session.findPrompt(promptId)
                        .ifPresent(prompt -> {
                            transition(prompt, PromptState.PENDING);
                            prompt.setScore(null);
                        }));
                return PromptScoreResult.failed(promptId, ex.getMessage(), reverted.isEmpty());
            }

            double score = report.roundedAccuracy();
            Optional<Session> applied = updateIfCurrent(ticket, sessionId, session -> session.findPrompt(promptId)
                    .ifPresent(prompt -> {
                        transition(prompt, PromptState.SCORED);
                        prompt.setScore(score);
                    }));
            if (applied.isEmpty()) {
                log.info("Discarding score {} for prompt {}: session {} no longer active.", score, promptId, sessionId);
                return PromptScoreResult.discarded(promptId, report);
            }
            return PromptScoreResult.scored(promptId, score, report);
        } finally {
            promptsInFlight.remove(promptId);
        }
    }

    private Session update(String sessionId, Consumer<Session> change) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            Session session = getSession(sessionId);
            change.accept(session);
            session.setUpdatedAt(Instant.now());
            store.put(session);
            return session;
        } finally {
            lock.unlock();
        }
    }

    // Empty when the ticket went stale or the session was deleted in the meantime.
    private Optional<Session> updateIfCurrent(Ticket ticket, String sessionId, Consumer<Session> change) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            if (!activity.isCurrent(ticket)) {
                return Optional.empty();
            }
            Optional<Session> fresh = store.get(sessionId);
            fresh.ifPresent(session -> {
                change.accept(session);
                session.setUpdatedAt(Instant.now());
                store.put(session);
            });
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, id -> new ReentrantLock());
    }

    private static void transition(Prompt prompt, PromptState next) {
        if (!prompt.getState().canTransitionTo(next)) {
            throw new IllegalTransitionFailure("Prompt " + prompt.getId() + " is " + prompt.getState().wireName()
                    + " and cannot move to " + next.wireName());
        }
        prompt.setState(next);
    }

    private static void requireEmptyActiveStep(Session session) {
        Step active = session.getActiveStep();
        if (!active.getPrompts().isEmpty()) {
            throw new IllegalTransitionFailure("Step " + active.getStepNumber() + " of session " + session.getId()
                    + " already has " + active.getPrompts().size() + " prompts");
        }
    }

    private List<QuestionAnswer> requireBenchmark() {
        List<QuestionAnswer> benchmark = benchmarkSource.loadQuestions();
        if (benchmark.isEmpty()) {
            throw new InvalidConfigFailure(List.of("benchmark has no questions"));
        }
        return benchmark;
    }

    private int resolveBatchSize(Session session, @Nullable Integer requested) {
        int size;
        if (requested != null) {
            size = requested;
        } else if (properties.getScoring().getBatchSize() != null) {
            size = properties.getScoring().getBatchSize();
        } else {
            size = session.getConfig().k();
        }
        if (size < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
        return size;
    }
}
