package com.companyintel.research.service;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.CancellationToken;
import com.companyintel.research.PipelineCancelledException;
import com.companyintel.research.ResearchPipelineException;
import com.companyintel.research.model.ExtractionBatch;
import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.ResearchOutcome;
import com.companyintel.research.model.ResearchRunState;
import com.companyintel.research.model.ResearchRunView;
import com.companyintel.research.model.ResearchTarget;
import com.companyintel.research.progress.LoggingProgressSink;
import com.companyintel.research.progress.RecordingProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class ResearchRunService {
    private static final Logger log = LoggerFactory.getLogger(ResearchRunService.class);

    private final ResearchPipeline pipeline;
    private final ResearchProperties properties;
    private final ExecutorService researchRunExecutor;
    private final Map<String, ResearchRun> runs = new ConcurrentHashMap<>();
    private final AtomicLong finishSequence = new AtomicLong();

    public ResearchRunService(
        ResearchPipeline pipeline,
        ResearchProperties properties,
        @Qualifier("researchRunExecutor") ExecutorService researchRunExecutor
    ) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.researchRunExecutor = researchRunExecutor;
    }

    public PipelineConfig defaultConfig() {
        return properties.toPipelineConfig();
    }

    public ResearchOutcome runNow(ResearchTarget target, PipelineConfig config) {
        return pipeline.research(
            target,
            config,
            new LoggingProgressSink(target.companyName()),
            CancellationToken.create()
        );
    }

    public ResearchRunView startAsync(ResearchTarget target, PipelineConfig config) {
        String runId = UUID.randomUUID().toString();
        ResearchRun run = new ResearchRun(runId, target, new RecordingProgressSink(new LoggingProgressSink(runId)));
        runs.put(runId, run);
        pruneFinishedRuns();
        researchRunExecutor.submit(() -> execute(run, config));
        log.info("research run queued runId={} company={}", runId, target.companyName());
        return run.view();
    }

    public Optional<ResearchRunView> getRun(String runId) {
        ResearchRun run = runs.get(runId);
        return run == null ? Optional.empty() : Optional.of(run.view());
    }

    public Optional<ResearchRunView> cancel(String runId, String reason) {
        ResearchRun run = runs.get(runId);
        if (run == null) {
            return Optional.empty();
        }
        run.token.cancel(reason == null || reason.isBlank() ? "cancelled_by_caller" : reason);
        log.info("research run cancel requested runId={} reason={}", runId, run.token.reason());
        return Optional.of(run.view());
    }

    private void pruneFinishedRuns() {
        int excess = runs.size() - properties.getMaxRetainedRuns();
        if (excess <= 0) {
            return;
        }
        List<ResearchRun> evictable = runs.values().stream()
            .filter(run -> run.state != ResearchRunState.RUNNING)
            .sorted(Comparator.comparingLong(run -> run.finishOrder))
            .limit(excess)
            .toList();
        for (ResearchRun run : evictable) {
            runs.remove(run.runId, run);
        }
        if (!evictable.isEmpty()) {
            log.debug("research runs evicted count={} retained={}", evictable.size(), runs.size());
        }
    }

    private void execute(ResearchRun run, PipelineConfig config) {
        try {
            ResearchOutcome outcome = pipeline.research(run.target, config, run.events, run.token);
            run.complete(outcome, finishSequence.incrementAndGet());
        } catch (PipelineCancelledException e) {
            log.warn("research run cancelled runId={} stage={} reason={}", run.runId, e.getStage(), e.getMessage());
            run.fail(
                ResearchRunState.CANCELLED,
                e.getErrorKey(),
                e.getMessage(),
                e.getPartialBatch(),
                finishSequence.incrementAndGet()
            );
        } catch (ResearchPipelineException e) {
            log.warn("research run failed runId={} errorKey={} error={}", run.runId, e.getErrorKey(), e.getMessage());
            run.fail(ResearchRunState.FAILED, e.getErrorKey(), e.getMessage(), null, finishSequence.incrementAndGet());
        } catch (RuntimeException e) {
            log.error("research run crashed runId={}", run.runId, e);
            run.fail(ResearchRunState.FAILED, "internal_error", e.toString(), null, finishSequence.incrementAndGet());
        }
    }

    private static final class ResearchRun {
        private final String runId;
        private final ResearchTarget target;
        private final RecordingProgressSink events;
        private final CancellationToken token = CancellationToken.create();
        private final Instant startedAt = Instant.now();
        private volatile ResearchRunState state = ResearchRunState.RUNNING;
        private volatile Instant finishedAt;
        private volatile long finishOrder;
        private volatile ResearchOutcome outcome;
        private volatile ExtractionBatch partialBatch;
        private volatile String errorKey;
        private volatile String errorMessage;

        private ResearchRun(String runId, ResearchTarget target, RecordingProgressSink events) {
            this.runId = runId;
            this.target = target;
            this.events = events;
        }

        private void complete(ResearchOutcome result, long order) {
            outcome = result;
            finishOrder = order;
            finishedAt = Instant.now();
            state = ResearchRunState.COMPLETED;
        }

        private void fail(
            ResearchRunState failedState,
            String key,
            String message,
            ExtractionBatch partial,
            long order
        ) {
            errorKey = key;
            errorMessage = message;
            partialBatch = partial;
            finishOrder = order;
            finishedAt = Instant.now();
            state = failedState;
        }

        private ResearchRunView view() {
            return new ResearchRunView(
                runId,
                state,
                target.companyName(),
                startedAt,
                finishedAt,
                events.events(),
                outcome,
                partialBatch,
                errorKey,
                errorMessage
            );
        }
    }
}
