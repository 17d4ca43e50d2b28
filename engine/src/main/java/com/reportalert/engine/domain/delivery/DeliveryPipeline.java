package com.reportalert.engine.domain.delivery;

import com.reportalert.common.id.UlidGenerator;
import com.reportalert.engine.domain.artifact.ArtifactDeliverer;
import com.reportalert.engine.domain.artifact.ArtifactRenderer;
import com.reportalert.engine.domain.artifact.ArtifactRepository;
import com.reportalert.engine.domain.artifact.ScheduledArtifact;
import com.reportalert.engine.domain.exceptions.ArtifactDeliveryException;
import com.reportalert.engine.domain.exceptions.ArtifactRenderException;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one report through render and delivery, recording every attempt in the
 * delivery history. At most one delivery per report runs at a time; a
 * concurrent request for the same report is skipped rather than queued.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryPipeline {

    static final String ID_PREFIX = "rdh";

    private final ArtifactRepository artifactRepository;
    private final DeliveryHistoryRepository historyRepository;
    private final ArtifactRenderer artifactRenderer;
    private final ArtifactDeliverer artifactDeliverer;
    private final AsyncTaskExecutor collaboratorExecutor;
    private final DeliveryPolicy deliveryPolicy;
    private final Clock clock;
    private final Counter deliveriesSucceededCounter;
    private final Counter deliveriesFailedCounter;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    /**
     * Scheduled delivery: reports that are no longer scheduled are skipped.
     */
    public DeliveryOutcome deliverOnce(String artifactId) {
        return deliver(artifactId, false);
    }

    /**
     * Manual "send now": delivers regardless of the scheduled flag.
     */
    public DeliveryOutcome deliverNow(String artifactId) {
        return deliver(artifactId, true);
    }

    public void signalShutdown() {
        shuttingDown.set(true);
    }

    public void clearShutdownSignal() {
        shuttingDown.set(false);
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    private DeliveryOutcome deliver(String artifactId, boolean manual) {
        if (!inFlight.add(artifactId)) {
            log.debug("Delivery of report {} already in progress, skipping", artifactId);
            return DeliveryOutcome.skipped(artifactId, "delivery already in progress");
        }
        try {
            return deliverLocked(artifactId, manual);
        } finally {
            inFlight.remove(artifactId);
        }
    }

    boolean isDelivering(String artifactId) {
        return inFlight.contains(artifactId);
    }

    private DeliveryOutcome deliverLocked(String artifactId, boolean manual) {
        if (shuttingDown.get()) {
            return DeliveryOutcome.skipped(artifactId, "engine shutting down");
        }
        var found = artifactRepository.findById(artifactId);
        if (found.isEmpty()) {
            log.debug("Report {} not found, skipping delivery", artifactId);
            return DeliveryOutcome.skipped(artifactId, "report not found");
        }
        var artifact = found.get();
        if (!manual && !artifact.scheduled()) {
            log.debug("Report {} is no longer scheduled, skipping delivery", artifactId);
            return DeliveryOutcome.skipped(artifactId, "report not scheduled");
        }

        var attempt = historyRepository.create(
                DeliveryAttempt.pending(UlidGenerator.prefixed(ID_PREFIX), artifact, clock.instant()));
        byte[] delivered;
        try {
            var content = callWithTimeout("render", () -> artifactRenderer.render(artifact));
            checkpoint();
            if (!artifact.hasRecipients()) {
                throw ArtifactDeliveryException.noRecipients(artifactId);
            }
            callWithTimeout("deliver", () -> {
                artifactDeliverer.deliver(artifact, content, artifact.recipients());
                return null;
            });
            delivered = content;
        } catch (RuntimeException e) {
            return fail(artifact, attempt, e);
        }
        return succeed(artifact, attempt, delivered.length);
    }

    /**
     * Runs once the deliverer has returned. Bookkeeping errors here are logged only.
     */
    private DeliveryOutcome succeed(ScheduledArtifact artifact, DeliveryAttempt attempt, long fileSize) {
        deliveriesSucceededCounter.increment();
        try {
            artifactRepository.markSent(artifact.id(), clock.instant());
        } catch (RuntimeException e) {
            log.error("Report {} was delivered but could not be marked sent, attempt {}",
                    artifact.id(), attempt.id(), e);
        }
        try {
            historyRepository.markSucceeded(attempt.id(), fileSize);
        } catch (RuntimeException e) {
            log.error("Report {} was delivered but attempt {} could not be marked succeeded",
                    artifact.id(), attempt.id(), e);
        }
        log.info("Delivered report {} ({} bytes) to {} recipient(s), attempt {}",
                artifact.id(), fileSize, artifact.recipients().size(), attempt.id());
        return DeliveryOutcome.delivered(artifact.id(), attempt.id(), fileSize);
    }

    private DeliveryOutcome fail(ScheduledArtifact artifact, DeliveryAttempt attempt, RuntimeException e) {
        var reason = describe(e);
        historyRepository.markFailed(attempt.id(), reason);
        deliveriesFailedCounter.increment();
        if (e instanceof ArtifactRenderException || e instanceof ArtifactDeliveryException
                || e instanceof DeliveryAbandonedException) {
            log.warn("Delivery of report {} failed, attempt {}: {}", artifact.id(), attempt.id(), reason);
        } else {
            log.error("Delivery of report {} failed unexpectedly, attempt {}", artifact.id(), attempt.id(), e);
        }
        return DeliveryOutcome.failed(artifact.id(), attempt.id(), reason);
    }

    private void checkpoint() {
        if (shuttingDown.get()) {
            throw new DeliveryAbandonedException();
        }
    }

    private <T> T callWithTimeout(String step, Callable<T> call) {
        checkpoint();
        var timeout = deliveryPolicy.attemptTimeout();
        Future<T> future = collaboratorExecutor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw stepFailure(step, "Report " + step + " timed out after " + timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DeliveryAbandonedException();
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw stepFailure(step, "Report " + step + " failed: " + cause);
        }
    }

    private static RuntimeException stepFailure(String step, String message) {
        return "render".equals(step)
                ? new ArtifactRenderException(message)
                : new ArtifactDeliveryException(message);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
