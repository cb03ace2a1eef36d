package dev.evalbench.session;

import dev.evalbench.batch.BatchConfig;
import dev.evalbench.batch.BatchScheduler;
import dev.evalbench.dataset.DatasetValidator;
import dev.evalbench.dataset.ParsedDataset;
import dev.evalbench.evaluation.AggregateStats;
import dev.evalbench.evaluation.EvaluationException;
import dev.evalbench.evaluation.EvaluationException.ErrorKind;
import dev.evalbench.evaluation.EvaluationExporter;
import dev.evalbench.evaluation.EvaluationResult;
import dev.evalbench.evaluation.EvaluationSummary;
import dev.evalbench.evaluation.ExportFormat;
import dev.evalbench.session.SessionCommand.Cancel;
import dev.evalbench.session.SessionCommand.Clear;
import dev.evalbench.session.SessionCommand.Log;
import dev.evalbench.session.SessionCommand.Pause;
import dev.evalbench.session.SessionCommand.Progress;
import dev.evalbench.session.SessionCommand.Result;
import dev.evalbench.session.SessionCommand.Resume;
import dev.evalbench.session.SessionCommand.Start;
import dev.evalbench.session.SessionCommand.SubmissionFailed;
import dev.evalbench.session.SessionCommand.SummaryReceived;
import dev.evalbench.stream.EventStreamConsumer;
import dev.evalbench.stream.ProgressEvent;
import dev.evalbench.stream.ResultEvent;
import dev.evalbench.stream.StreamListener;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Owns the single evaluation session and drives it through {@link SessionReducer}.
 *
 * <p>All state changes run on one mailbox thread: caller operations, the completion of the bulk
 * submission and every pushed event are queued there, so the session is never mutated
 * concurrently. Caller operations wait for their own command; pushed events are queued without
 * blocking the delivering thread. The latest state is published through a volatile field.
 */
@Service
public class EvaluationOrchestrator implements StreamListener {

    private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    private final BatchScheduler scheduler;
    private final EventStreamConsumer consumer;
    private final EvaluationExporter exporter;
    private final SessionProperties properties;
    private final Clock clock;
    private final Executor remoteExecutor;
    private final ExecutorService mailbox;

    // Mailbox thread only.
    private final Map<String, CompletableFuture<EvaluationSummary>> pendingRuns = new HashMap<>();

    private volatile SessionState state;
    private volatile @Nullable ParsedDataset selectedDataset;

    public EvaluationOrchestrator(BatchScheduler scheduler,
                                  EventStreamConsumer consumer,
                                  EvaluationExporter exporter,
                                  SessionProperties properties,
                                  Clock clock,
                                  @Qualifier("evaluationServiceExecutor") Executor remoteExecutor) {
        this.scheduler = scheduler;
        this.consumer = consumer;
        this.exporter = exporter;
        this.properties = properties;
        this.clock = clock;
        this.remoteExecutor = remoteExecutor;
        this.state = SessionState.initial(properties.getLogCapacity());
        this.mailbox = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "evaluation-session");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Parse and select an uploaded question file, replacing any previous selection.
     * An invalid file is selected too, so its errors can be shown, but cannot be started.
     *
     * @param csv raw CSV text
     * @return the parsed dataset with every validation error
     */
    public ParsedDataset selectDataset(@Nullable String csv) {
        ParsedDataset dataset = DatasetValidator.parse(csv);
        selectedDataset = dataset;
        log.info("Selected dataset with {} questions ({} errors)", dataset.size(), dataset.errors().size());
        return dataset;
    }

    public Optional<ParsedDataset> selectedDataset() {
        return Optional.ofNullable(selectedDataset);
    }

    public void removeDataset() {
        selectedDataset = null;
    }

    /**
     * Start a bulk run over the selected dataset.
     *
     * @throws EvaluationException {@code INVALID_INPUT} when nothing valid is selected,
     *                             {@code SESSION_CONFLICT} when a run is in progress
     */
    public CompletableFuture<EvaluationSummary> start(StartRequest request) {
        ParsedDataset dataset = selectedDataset;
        if (dataset == null) {
            throw new EvaluationException(ErrorKind.INVALID_INPUT,
                    "No dataset selected: upload a question CSV first");
        }
        return start(dataset, request);
    }

    /**
     * Start a bulk run over the given dataset under a freshly minted correlation id.
     *
     * @return a future completed with the service summary once the session is COMPLETED,
     *         failed with the submission error, or cancelled when the session is cancelled
     */
    public CompletableFuture<EvaluationSummary> start(ParsedDataset dataset, StartRequest request) {
        int batchSize = request.batchSize() != null ? request.batchSize() : properties.getDefaultBatchSize();
        String correlationId = UUID.randomUUID().toString();
        BatchConfig config = new BatchConfig(request.agentCode(), request.agentName(),
                request.agentDescription(), request.context(), correlationId, batchSize);
        Start command = new Start(correlationId, dataset, config, clock.instant(),
                properties.estimateSeconds(dataset.size(), batchSize));

        return call(() -> {
            CompletableFuture<EvaluationSummary> run = new CompletableFuture<>();
            pendingRuns.put(correlationId, run);
            try {
                applyOrThrow(command);
            } catch (RuntimeException e) {
                pendingRuns.remove(correlationId);
                throw e;
            }
            return run;
        });
    }

    public EvaluationSession pause() {
        return call(() -> applyOrThrow(new Pause())).session();
    }

    public EvaluationSession resume() {
        return call(() -> applyOrThrow(new Resume())).session();
    }

    /** Cancel the current run locally and ask the service to stop it. */
    public EvaluationSession cancel() {
        return call(() -> {
            String correlationId = state.session().id();
            SessionState next = applyOrThrow(new Cancel());
            settle(correlationId, run -> run.cancel(false));
            return next;
        }).session();
    }

    /** Release a finished session. */
    public EvaluationSession clear() {
        return call(() -> applyOrThrow(new Clear())).session();
    }

    /** Current state, after every command queued before this call has been applied. */
    public SessionState snapshot() {
        return call(() -> state);
    }

    public AggregateStats stats() {
        return snapshot().stats(clock.instant());
    }

    public List<EvaluationResult> results() {
        return snapshot().resultList();
    }

    public List<String> logs() {
        return snapshot().logs();
    }

    /**
     * Render the current results as a report.
     *
     * @throws IOException if rendering fails
     */
    public byte[] exportReport(ExportFormat format) throws IOException {
        SessionState current = snapshot();
        return exporter.render(current.resultList(), current.stats(clock.instant()),
                current.agentName(), format);
    }

    /**
     * Write the current results to the export directory.
     *
     * @return the path of the written report
     * @throws IOException if the report cannot be written
     */
    public Path exportToFile(ExportFormat format) throws IOException {
        SessionState current = snapshot();
        return exporter.export(current.resultList(), current.stats(clock.instant()),
                current.agentName(), format, exportLabel(current.agentName()));
    }

    /** Report filename for the current run, as used by {@link #exportToFile}. */
    public String exportFileName(ExportFormat format) {
        return exporter.fileName(format, exportLabel(state.agentName()));
    }

    @Override
    public void onProgress(String correlationId, ProgressEvent event) {
        enqueue(() -> dispatch(new Progress(correlationId, event)));
    }

    @Override
    public void onResult(String correlationId, ResultEvent event) {
        enqueue(() -> dispatch(new Result(correlationId, event)));
    }

    @Override
    public void onLog(String correlationId, String line) {
        enqueue(() -> dispatch(new Log(correlationId, line)));
    }

    @PreDestroy
    void shutdown() {
        String correlationId = state.session().id();
        if (correlationId != null) {
            consumer.close(correlationId);
        }
        mailbox.shutdownNow();
    }

    private SessionState applyOrThrow(SessionCommand command) {
        Transition transition = SessionReducer.reduce(state, command);
        if (!transition.accepted()) {
            throw transition.rejection();
        }
        publish(transition);
        return transition.state();
    }

    private void dispatch(SessionCommand command) {
        SessionState before = state;
        Transition transition = SessionReducer.reduce(before, command);
        if (!transition.accepted()) {
            log.debug("Rejected {}: {}", command.getClass().getSimpleName(),
                    transition.rejection().getMessage());
            return;
        }
        if (transition.state() == before) {
            log.debug("Dropped {} in status {}", command.getClass().getSimpleName(),
                    before.session().status());
            return;
        }
        publish(transition);
    }

    private void publish(Transition transition) {
        EvaluationSession previous = state.session();
        state = transition.state();
        EvaluationSession current = transition.state().session();
        if (previous.status() != current.status()) {
            log.info("Session {} {} -> {}", current.id() != null ? current.id() : previous.id(),
                    previous.status(), current.status());
        }
        for (SessionEffect effect : transition.effects()) {
            execute(effect);
        }
    }

    private void execute(SessionEffect effect) {
        if (effect instanceof SessionEffect.Subscribe subscribe) {
            consumer.open(subscribe.correlationId(), this);
        } else if (effect instanceof SessionEffect.Unsubscribe unsubscribe) {
            consumer.close(unsubscribe.correlationId());
        } else if (effect instanceof SessionEffect.SubmitBatch submit) {
            submit(submit);
        } else if (effect instanceof SessionEffect.AbortRemote abort) {
            CompletableFuture.runAsync(() -> scheduler.abort(abort.correlationId()), remoteExecutor);
        }
    }

    private void submit(SessionEffect.SubmitBatch effect) {
        String correlationId = effect.config().correlationId();
        CompletableFuture<EvaluationSummary> call;
        try {
            call = scheduler.submit(effect.dataset(), effect.config());
        } catch (EvaluationException e) {
            fail(correlationId, e);
            return;
        }
        call.whenComplete((summary, error) -> enqueue(() -> {
            if (error == null) {
                dispatch(new SummaryReceived(correlationId, summary, clock.instant()));
                settle(correlationId, run -> run.complete(summary));
            } else {
                fail(correlationId, asEvaluationException(error));
            }
        }));
    }

    private void fail(String correlationId, EvaluationException error) {
        dispatch(new SubmissionFailed(correlationId, error.getMessage(), clock.instant()));
        settle(correlationId, run -> run.completeExceptionally(error));
    }

    private void settle(@Nullable String correlationId,
                        Consumer<CompletableFuture<EvaluationSummary>> action) {
        if (correlationId == null) {
            return;
        }
        CompletableFuture<EvaluationSummary> run = pendingRuns.remove(correlationId);
        if (run != null) {
            action.accept(run);
        }
    }

    private void enqueue(Runnable task) {
        try {
            mailbox.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Session mailbox is shut down, dropping event: {}", e.getMessage());
        }
    }

    private <T> T call(Callable<T> task) {
        try {
            return mailbox.submit(task).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the session", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    private static EvaluationException asEvaluationException(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof EvaluationException evaluationException) {
            return evaluationException;
        }
        return new EvaluationException(ErrorKind.REMOTE_FAILURE, String.valueOf(cause.getMessage()), cause);
    }

    private static String exportLabel(@Nullable String agentName) {
        if (agentName == null || agentName.isBlank()) {
            return "session";
        }
        return agentName.trim().replaceAll("[^A-Za-z0-9_-]+", "-");
    }
}
