package com.companyintel.research.provider;

import com.companyintel.research.model.CallPurpose;
import com.companyintel.research.model.ProviderCallRecord;
import com.companyintel.research.model.ProviderRoute;
import com.companyintel.research.progress.ProgressEvent;
import com.companyintel.research.progress.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Sends a call to the primary provider of its route and, for quota or server-side failures, once
 * more to the secondary. Every attempt is reported to the progress sink as a
 * {@link ProviderCallRecord} with its estimated cost.
 */
@Service
public class ProviderRouter {
    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    private final ProviderRegistry registry;
    private final TokenBucketRateLimiter rateLimiter;

    public ProviderRouter(ProviderRegistry registry, TokenBucketRateLimiter rateLimiter) {
        this.registry = registry;
        this.rateLimiter = rateLimiter;
    }

    public <R extends ProviderResult> R route(
        CallPurpose purpose,
        ProviderRoute route,
        ProgressSink sink,
        Function<AiProvider, R> call
    ) {
        ProgressSink events = sink == null ? ProgressSink.noop() : sink;
        try {
            return attempt(route.primary(), purpose, events, call);
        } catch (ProviderException primaryFailure) {
            if (!primaryFailure.getKind().isFallbackEligible()) {
                throw primaryFailure;
            }
            if (!route.hasSecondary()) {
                throw new ProviderUnavailableException(
                    purpose,
                    primaryFailure,
                    "Provider " + route.primary() + " failed for " + purpose + " and no secondary is configured: "
                        + primaryFailure.getMessage()
                );
            }
            log.warn(
                "provider fallback purpose={} primary={} secondary={} kind={} error={}",
                purpose,
                route.primary(),
                route.secondary(),
                primaryFailure.getKind(),
                primaryFailure.getMessage()
            );
            try {
                return attempt(route.secondary(), purpose, events, call);
            } catch (ProviderException secondaryFailure) {
                throw new ProviderUnavailableException(
                    purpose,
                    secondaryFailure,
                    "Providers " + route.primary() + " and " + route.secondary() + " both failed for " + purpose
                        + ": " + primaryFailure.getMessage() + "; " + secondaryFailure.getMessage()
                );
            }
        }
    }

    /**
     * Prompt budget for a purpose: the smaller of both providers' budgets, so a fallback call never
     * receives a prompt built for a larger context.
     */
    public int contextBudget(CallPurpose purpose, ProviderRoute route) {
        int budget = Integer.MAX_VALUE;
        Optional<AiProvider> primary = registry.find(route.primary());
        if (primary.isPresent()) {
            budget = primary.get().metadata().contextBudgetChars();
        }
        if (route.hasSecondary()) {
            Optional<AiProvider> secondary = registry.find(route.secondary());
            if (secondary.isPresent()) {
                budget = Math.min(budget, secondary.get().metadata().contextBudgetChars());
            }
        }
        if (budget == Integer.MAX_VALUE) {
            log.debug("no provider registered for purpose={} route={}", purpose, route);
            return 0;
        }
        return budget;
    }

    private <R extends ProviderResult> R attempt(
        String providerName,
        CallPurpose purpose,
        ProgressSink sink,
        Function<AiProvider, R> call
    ) {
        AiProvider provider = registry.find(providerName).orElseThrow(() -> new ProviderException(
            providerName,
            ProviderFailureKind.NOT_CONFIGURED,
            "Provider " + providerName + " is not registered"
        ));
        rateLimiter.acquire();
        Instant startedAt = Instant.now();
        try {
            R result = call.apply(provider);
            ProviderUsage usage = result == null || result.usage() == null ? ProviderUsage.none() : result.usage();
            ProviderCallRecord record = new ProviderCallRecord(
                provider.providerName(),
                purpose,
                usage.inputTokens(),
                usage.outputTokens(),
                provider.metadata().estimateCostUsd(usage),
                true,
                Duration.between(startedAt, Instant.now()),
                null
            );
            sink.onEvent(ProgressEvent.providerCall(record));
            log.debug(
                "provider call ok provider={} purpose={} inputTokens={} outputTokens={} costUsd={}",
                record.providerName(),
                purpose,
                record.inputTokens(),
                record.outputTokens(),
                record.estimatedCostUsd()
            );
            return result;
        } catch (ProviderException e) {
            reportFailure(provider, purpose, startedAt, e.getKind(), sink);
            throw e;
        } catch (RuntimeException e) {
            reportFailure(provider, purpose, startedAt, ProviderFailureKind.UNEXPECTED, sink);
            throw new ProviderException(provider.providerName(), ProviderFailureKind.UNEXPECTED, e.toString(), e);
        }
    }

    private void reportFailure(
        AiProvider provider,
        CallPurpose purpose,
        Instant startedAt,
        ProviderFailureKind kind,
        ProgressSink sink
    ) {
        sink.onEvent(ProgressEvent.providerCall(new ProviderCallRecord(
            provider.providerName(),
            purpose,
            0,
            0,
            0.0,
            false,
            Duration.between(startedAt, Instant.now()),
            kind.name()
        )));
    }
}
