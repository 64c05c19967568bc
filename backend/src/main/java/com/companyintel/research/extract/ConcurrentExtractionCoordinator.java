package com.companyintel.research.extract;

import com.companyintel.research.CancellationToken;
import com.companyintel.research.PipelineCancelledException;
import com.companyintel.research.fetch.PageFetcher;
import com.companyintel.research.model.ExtractionBatch;
import com.companyintel.research.model.HttpFetchResult;
import com.companyintel.research.model.PageExtractionResult;
import com.companyintel.research.model.PageStatus;
import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.PrioritizedPage;
import com.companyintel.research.progress.ProgressSink;
import com.companyintel.research.progress.ProgressStatus;
import com.companyintel.research.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches and extracts prioritized pages on a bounded worker pool. Every page produces exactly one
 * {@link PageExtractionResult}; failures are recorded as statuses and never cross worker
 * boundaries as exceptions.
 */
@Service
public class ConcurrentExtractionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentExtractionCoordinator.class);
    private static final long POLL_INTERVAL_MS = 50;
    private static final long CANCEL_GRACE_MS = 1000;
    static final String PAGE_STAGE = "extraction.page";

    private final PageFetcher pageFetcher;
    private final ExtractionStrategyChain strategyChain;
    private final ExecutorService extractionExecutor;

    public ConcurrentExtractionCoordinator(
        PageFetcher pageFetcher,
        ExtractionStrategyChain strategyChain,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor
    ) {
        this.pageFetcher = pageFetcher;
        this.strategyChain = strategyChain;
        this.extractionExecutor = extractionExecutor;
    }

    public ExtractionBatch extract(
        List<PrioritizedPage> pages,
        PipelineConfig config,
        ProgressSink sink,
        CancellationToken token
    ) {
        if (pages == null || pages.isEmpty()) {
            return ExtractionBatch.empty();
        }
        Semaphore slots = new Semaphore(config.concurrency());
        ExecutorCompletionService<PageExtractionResult> completion = new ExecutorCompletionService<>(extractionExecutor);
        Map<Future<PageExtractionResult>, PrioritizedPage> workers = new IdentityHashMap<>();
        for (PrioritizedPage page : pages) {
            log.debug("queue page rank={} url={}", page.rank(), page.url());
            workers.put(completion.submit(() -> runWorker(page, config, slots)), page);
        }

        List<PageExtractionResult> completed = new ArrayList<>();
        try {
            while (completed.size() < workers.size()) {
                if (token != null && token.isCancelled()) {
                    drainFinished(completion, workers, completed);
                    cancelAll(workers);
                    ExtractionBatch partial = new ExtractionBatch(completed);
                    log.warn(
                        "extraction cancelled reason={} completed={} of {}",
                        token.reason(),
                        partial.attempted(),
                        pages.size()
                    );
                    throw new PipelineCancelledException(ProgressSink.EXTRACTION, token.reason(), partial);
                }
                Future<PageExtractionResult> finished = completion.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (finished != null) {
                    record(finished, workers, completed, sink);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(workers);
            throw new PipelineCancelledException(ProgressSink.EXTRACTION, "interrupted", new ExtractionBatch(completed));
        }

        ExtractionBatch batch = new ExtractionBatch(completed);
        log.info(
            "extraction complete attempted={} succeeded={} chars={} byStatus={}",
            batch.attempted(),
            batch.succeeded(),
            batch.totalCharacters(),
            batch.countsByStatus()
        );
        return batch;
    }

    private PageExtractionResult runWorker(PrioritizedPage page, PipelineConfig config, Semaphore slots) {
        Instant queuedAt = Instant.now();
        boolean acquired = false;
        Future<PageExtractionResult> attempt = null;
        CountDownLatch attemptDone = new CountDownLatch(1);
        try {
            slots.acquire();
            acquired = true;
            Instant startedAt = Instant.now();
            attempt = extractionExecutor.submit(() -> {
                try {
                    return fetchAndExtract(page, config, startedAt);
                } finally {
                    attemptDone.countDown();
                }
            });
            long timeoutMs = config.perPageTimeout().toMillis();
            try {
                return attempt.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                attempt.cancel(true);
                awaitQuietly(attemptDone);
                return PageExtractionResult.failure(
                    page,
                    PageStatus.TIMEOUT,
                    0,
                    Duration.between(startedAt, Instant.now()),
                    null,
                    "exceeded per-page timeout of " + timeoutMs + "ms"
                );
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                return PageExtractionResult.failure(
                    page,
                    PageStatus.FETCH_ERROR,
                    0,
                    Duration.between(startedAt, Instant.now()),
                    null,
                    cause.toString()
                );
            }
        } catch (InterruptedException e) {
            if (attempt != null) {
                attempt.cancel(true);
                awaitQuietly(attemptDone);
            }
            Thread.currentThread().interrupt();
            return PageExtractionResult.failure(
                page,
                PageStatus.TIMEOUT,
                0,
                Duration.between(queuedAt, Instant.now()),
                null,
                "cancelled"
            );
        } finally {
            if (acquired) {
                slots.release();
            }
        }
    }

    private PageExtractionResult fetchAndExtract(PrioritizedPage page, PipelineConfig config, Instant startedAt) {
        HttpFetchResult fetch;
        try {
            fetch = pageFetcher.fetch(page.url(), config.perPageTimeout());
        } catch (RuntimeException e) {
            return PageExtractionResult.failure(page, PageStatus.FETCH_ERROR, 0, elapsedSince(startedAt), null, e.toString());
        }
        if (fetch == null) {
            return PageExtractionResult.failure(page, PageStatus.FETCH_ERROR, 0, elapsedSince(startedAt), null, "no response");
        }
        if (!fetch.isSuccessful()) {
            return PageExtractionResult.failure(
                page,
                ReasonCodeClassifier.pageStatusFor(fetch),
                fetch.byteLength(),
                elapsedSince(startedAt),
                null,
                describeFailure(fetch)
            );
        }
        if (!fetch.isHtmlLike() || fetch.body() == null || fetch.body().isBlank()) {
            return PageExtractionResult.failure(
                page,
                PageStatus.EMPTY,
                fetch.byteLength(),
                elapsedSince(startedAt),
                null,
                "no markup (contentType=" + fetch.contentType() + ")"
            );
        }

        ExtractionOutcome outcome = strategyChain.extract(
            fetch.body(),
            fetch.finalUrlOrRequested(),
            config.minSubstantialContentLength()
        );
        if (outcome.status() == PageStatus.SUCCESS) {
            return PageExtractionResult.success(page, outcome.text(), fetch.byteLength(), elapsedSince(startedAt), outcome.strategy());
        }
        return PageExtractionResult.failure(
            page,
            outcome.status(),
            fetch.byteLength(),
            elapsedSince(startedAt),
            outcome.strategy(),
            outcome.errorMessage()
        );
    }

    private void record(
        Future<PageExtractionResult> finished,
        Map<Future<PageExtractionResult>, PrioritizedPage> workers,
        List<PageExtractionResult> completed,
        ProgressSink sink
    ) {
        PageExtractionResult result = resultOf(finished, workers.get(finished));
        completed.add(result);
        if (result.isSuccessful()) {
            log.debug("page extracted rank={} url={} chars={} strategy={}", result.rank(), result.url(), result.charLength(), result.strategy());
        } else {
            log.debug("page not extracted rank={} url={} status={} error={}", result.rank(), result.url(), result.status(), result.errorMessage());
        }
        sink.emit(
            PAGE_STAGE,
            result.isSuccessful() ? ProgressStatus.COMPLETED : ProgressStatus.FAILED,
            "rank=" + result.rank() + " url=" + result.url() + " status=" + result.status() + " chars=" + result.charLength()
        );
    }

    private PageExtractionResult resultOf(Future<PageExtractionResult> finished, PrioritizedPage page) {
        try {
            return finished.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return PageExtractionResult.failure(page, PageStatus.FETCH_ERROR, 0, Duration.ZERO, null, cause.toString());
        } catch (CancellationException e) {
            return PageExtractionResult.failure(page, PageStatus.TIMEOUT, 0, Duration.ZERO, null, "cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PageExtractionResult.failure(page, PageStatus.TIMEOUT, 0, Duration.ZERO, null, "interrupted");
        }
    }

    private void drainFinished(
        ExecutorCompletionService<PageExtractionResult> completion,
        Map<Future<PageExtractionResult>, PrioritizedPage> workers,
        List<PageExtractionResult> completed
    ) {
        Future<PageExtractionResult> finished;
        while ((finished = completion.poll()) != null) {
            completed.add(resultOf(finished, workers.get(finished)));
        }
    }

    private void cancelAll(Map<Future<PageExtractionResult>, PrioritizedPage> workers) {
        for (Future<PageExtractionResult> worker : workers.keySet()) {
            worker.cancel(true);
        }
    }

    private void awaitQuietly(CountDownLatch latch) {
        try {
            if (!latch.await(CANCEL_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.debug("page worker did not stop within {}ms of cancellation", CANCEL_GRACE_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, Instant.now());
    }

    private String describeFailure(HttpFetchResult fetch) {
        String reason = ReasonCodeClassifier.fromFetch(fetch);
        if (fetch.errorCode() != null) {
            return reason + " (" + fetch.errorCode() + ": " + fetch.errorMessage() + ")";
        }
        return reason + " (http " + fetch.statusCode() + ")";
    }
}
