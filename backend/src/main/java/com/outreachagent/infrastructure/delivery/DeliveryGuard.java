package com.outreachagent.infrastructure.delivery;

import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.delivery.service.DirectMessageChannel;
import com.outreachagent.domain.delivery.service.OutreachTransport;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.Message;
import com.outreachagent.domain.lead.repository.LeadRepository;
import com.outreachagent.infrastructure.pacing.RateLimiter;
import com.outreachagent.infrastructure.pacing.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Pacing plus bounded retry around the per-lead send.
 * <p>
 * Live mode waits for the rate limiter once before a lead's first attempt.
 * Each lead gets up to {@code maxRetries + 1} attempts with 1s, 2s, 4s, ...
 * backoff between them. Dry-run keeps the attempt and status bookkeeping but
 * replaces the transport with an audit entry and skips pacing entirely.
 * </p>
 * Only the pipeline worker calls this, so the limiter's last-send stamp has a single writer.
 * {@link #beginBatch()} clears it at the start of every deliver stage.
 */
@Slf4j
@Component
public class DeliveryGuard {

    static final String STAGE = "deliver";

    private final OutreachTransport transport;
    private final DirectMessageChannel directMessageChannel;
    private final LeadRepository leadRepository;
    private final RunRecorder runRecorder;
    private final Sleeper sleeper;
    private final RateLimiter rateLimiter;
    private final int maxRetries;
    private final String subject;

    public DeliveryGuard(OutreachTransport transport,
                         DirectMessageChannel directMessageChannel,
                         LeadRepository leadRepository,
                         RunRecorder runRecorder,
                         Clock clock,
                         Sleeper sleeper,
                         @Value("${outreach.delivery.rate-limit-per-minute:10}") int rateLimitPerMinute,
                         @Value("${outreach.delivery.max-retries:2}") int maxRetries,
                         @Value("${outreach.delivery.subject:Quick idea for your team}") String subject) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("outreach.delivery.max-retries must not be negative");
        }
        this.transport = transport;
        this.directMessageChannel = directMessageChannel;
        this.leadRepository = leadRepository;
        this.runRecorder = runRecorder;
        this.sleeper = sleeper;
        this.rateLimiter = new RateLimiter(rateLimitPerMinute, clock, sleeper);
        this.maxRetries = maxRetries;
        this.subject = subject;
        log.info("[Delivery] Rate limit {}/min (interval {} ms), max retries {}",
                rateLimitPerMinute, rateLimiter.interval().toMillis(), maxRetries);
    }

    /**
     * Delivers one composed lead and records the final status on it.
     *
     * @param message latest composed message, or null to skip the lead
     * @throws DeliveryConfigurationException when delivery is misconfigured; not retried
     */
    public DeliveryResult deliver(Lead lead, Message message, boolean dryRun, Long runId) {
        if (message == null) {
            log.warn("[Delivery] No message found for lead {}, skipping", lead.getId());
            runRecorder.logEvent(STAGE, RunRecorder.LEVEL_WARNING, "No composed message; skipped", runId, lead.getId());
            return new DeliveryResult(lead.getId(), DeliveryResult.Status.SKIPPED, 0, "No composed message");
        }

        if (!dryRun) {
            pace();
        }

        int attempt = 0;
        boolean sent = false;
        String lastError = null;
        while (!sent && attempt <= maxRetries) {
            try {
                attemptDelivery(lead, message, dryRun, runId);
                attempt++;
                sent = true;
            } catch (DeliveryConfigurationException e) {
                runRecorder.logEvent(STAGE, RunRecorder.LEVEL_ERROR, e.getMessage(), runId, lead.getId());
                throw e;
            } catch (RuntimeException e) {
                lastError = describe(e);
                attempt++;
                if (attempt <= maxRetries) {
                    Duration backoff = backoffFor(attempt);
                    log.warn("[Delivery] Send attempt {} failed for {}, retrying in {}s: {}",
                            attempt, lead.getEmail(), backoff.toSeconds(), lastError);
                    sleep(backoff);
                }
                runRecorder.logEvent(STAGE, RunRecorder.LEVEL_ERROR,
                        "Attempt " + attempt + ": " + lastError, runId, lead.getId());
            }
        }

        // Only the send is retried; a store failure after this point propagates.
        return sent ? markDelivered(lead, attempt, runId) : markFailed(lead, attempt, lastError, runId);
    }

    /**
     * Starts a fresh pacing window for a new delivery batch.
     */
    public void beginBatch() {
        rateLimiter.reset();
    }

    /**
     * {@code 2^(attempt-1)} seconds: 1s after the first failure, then 2s, 4s, ...
     */
    static Duration backoffFor(int failedAttempt) {
        return Duration.ofSeconds(1L << (failedAttempt - 1));
    }

    private void attemptDelivery(Lead lead, Message message, boolean dryRun, Long runId) {
        if (dryRun) {
            log.info("[Delivery] Dry-run send to {} (email: {})", lead.getFullName(), lead.getEmail());
            runRecorder.logEvent(STAGE, RunRecorder.LEVEL_INFO, "Dry-run send to " + lead.getEmail(), runId, lead.getId());
            return;
        }
        transport.send(subject, nullToEmpty(message.getEmailA()), lead.getEmail());
        directMessageChannel.send(nullToEmpty(message.getDmA()), lead.getLinkedin());
    }

    private DeliveryResult markDelivered(Lead lead, int attempts, Long runId) {
        lead.markDelivered();
        leadRepository.save(lead);
        runRecorder.logEvent(STAGE, RunRecorder.LEVEL_INFO, "Send succeeded", runId, lead.getId());
        return new DeliveryResult(lead.getId(), DeliveryResult.Status.DELIVERED, attempts, null);
    }

    private DeliveryResult markFailed(Lead lead, int attempts, String lastError, Long runId) {
        String error = lastError != null ? lastError : "Send failed after all retries";
        lead.markFailed(error);
        leadRepository.save(lead);
        runRecorder.logEvent(STAGE, RunRecorder.LEVEL_ERROR, error, runId, lead.getId());
        return new DeliveryResult(lead.getId(), DeliveryResult.Status.FAILED, attempts, error);
    }

    private void pace() {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the send rate limit", e);
        }
    }

    private void sleep(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during delivery backoff", e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
