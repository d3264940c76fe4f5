package com.outreachagent.infrastructure.delivery;

import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.delivery.service.DirectMessageChannel;
import com.outreachagent.domain.delivery.service.OutreachTransport;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.LeadStatus;
import com.outreachagent.domain.lead.repository.LeadRepository;
import com.outreachagent.support.ManualClock;
import com.outreachagent.support.TestLeads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeliveryGuardTest {

    private static final String SUBJECT = "Quick idea for your team";
    private static final Long RUN_ID = 7L;

    @Mock
    private OutreachTransport transport;

    @Mock
    private DirectMessageChannel directMessageChannel;

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private RunRecorder runRecorder;

    private ManualClock clock;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
    }

    private DeliveryGuard guard(int ratePerMinute, int maxRetries) {
        return new DeliveryGuard(transport, directMessageChannel, leadRepository, runRecorder,
                clock, clock.sleeper(), ratePerMinute, maxRetries, SUBJECT);
    }

    @Test
    @DisplayName("Backoff doubles from one second")
    void backoff_doubles() {
        assertThat(DeliveryGuard.backoffFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(DeliveryGuard.backoffFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(DeliveryGuard.backoffFor(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("Negative max retries is rejected at construction")
    void negativeRetries_rejected() {
        assertThatThrownBy(() -> guard(10, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Live mode")
    class Live {

        @Test
        @DisplayName("Success sends email then DM and marks the lead DELIVERED")
        void success_marksDelivered() {
            Lead lead = TestLeads.inStatus(1L, LeadStatus.COMPOSED);

            DeliveryResult result = guard(10, 2).deliver(lead, TestLeads.message(1L), false, RUN_ID);

            assertThat(result.status()).isEqualTo(DeliveryResult.Status.DELIVERED);
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(lead.getStatus()).isEqualTo(LeadStatus.DELIVERED);
            verify(transport).send(SUBJECT, "Hi Mary, email A", lead.getEmail());
            verify(directMessageChannel).send("Hi Mary, dm A", lead.getLinkedin());
            verify(leadRepository).save(lead);
        }

        @Test
        @DisplayName("Two failures then success: three attempts with 1s and 2s backoff")
        void transientFailures_retriedWithBackoff() {
            Lead lead = TestLeads.inStatus(1L, LeadStatus.COMPOSED);
            doThrow(new TransientDeliveryException("timeout"))
                    .doThrow(new TransientDeliveryException("timeout"))
                    .doNothing()
                    .when(transport).send(anyString(), anyString(), anyString());

            DeliveryResult result = guard(0, 2).deliver(lead, TestLeads.message(1L), false, RUN_ID);

            assertThat(result.status()).isEqualTo(DeliveryResult.Status.DELIVERED);
            assertThat(result.attempts()).isEqualTo(3);
            assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
            assertThat(lead.getStatus()).isEqualTo(LeadStatus.DELIVERED);
            assertThat(lead.getLastError()).isNull();
            verify(runRecorder).logEvent(eq("deliver"), eq(RunRecorder.LEVEL_ERROR),
                    eq("Attempt 1: timeout"), eq(RUN_ID), eq(1L));
            verify(runRecorder).logEvent(eq("deliver"), eq(RunRecorder.LEVEL_ERROR),
                    eq("Attempt 2: timeout"), eq(RUN_ID), eq(1L));
        }

        @Test
        @DisplayName("Exhausted retries mark the lead FAILED with the last error")
        void exhausted_marksFailed() {
            Lead lead = TestLeads.inStatus(1L, LeadStatus.COMPOSED);
            doThrow(new TransientDeliveryException("mailbox unavailable"))
                    .when(transport).send(anyString(), anyString(), anyString());

            DeliveryResult result = guard(0, 2).deliver(lead, TestLeads.message(1L), false, RUN_ID);

            assertThat(result.status()).isEqualTo(DeliveryResult.Status.FAILED);
            assertThat(result.attempts()).isEqualTo(3);
            assertThat(lead.getStatus()).isEqualTo(LeadStatus.FAILED);
            assertThat(lead.getLastError()).isEqualTo("mailbox unavailable");
            verify(transport, times(3)).send(anyString(), anyString(), anyString());
            // no sleep after the final attempt
            assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        }

        @Test
        @DisplayName("Configuration errors are not retried and propagate")
        void configurationError_notRetried() {
            Lead lead = TestLeads.inStatus(1L, LeadStatus.COMPOSED);
            doThrow(new DeliveryConfigurationException("Sender address is not configured"))
                    .when(transport).send(anyString(), anyString(), anyString());

            DeliveryGuard guard = guard(0, 2);

            assertThatThrownBy(() -> guard.deliver(lead, TestLeads.message(1L), false, RUN_ID))
                    .isInstanceOf(DeliveryConfigurationException.class);
            verify(transport, times(1)).send(anyString(), anyString(), anyString());
            assertThat(lead.getStatus()).isEqualTo(LeadStatus.COMPOSED);
            assertThat(clock.sleeps()).isEmpty();
        }

        @Test
        @DisplayName("A store failure after a successful send is not retried as a send failure")
        void storeFailureAfterSend_sendsOnce() {
            Lead lead = TestLeads.inStatus(1L, LeadStatus.COMPOSED);
            when(leadRepository.save(lead)).thenThrow(new IllegalStateException("db down"));

            DeliveryGuard guard = guard(0, 2);

            assertThatThrownBy(() -> guard.deliver(lead, TestLeads.message(1L), false, RUN_ID))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("db down");
            verify(transport, times(1)).send(anyString(), anyString(), anyString());
            verify(directMessageChannel, times(1)).send(anyString(), anyString());
            assertThat(clock.sleeps()).isEmpty();
        }

        @Test
        @DisplayName("A new batch is not held back by the previous batch's last send")
        void beginBatch_resetsPacing() {
            DeliveryGuard guard = guard(10, 0);

            guard.deliver(TestLeads.inStatus(1L, LeadStatus.COMPOSED), TestLeads.message(1L), false, RUN_ID);
            guard.beginBatch();
            guard.deliver(TestLeads.inStatus(2L, LeadStatus.COMPOSED), TestLeads.message(2L), false, RUN_ID);

            assertThat(clock.sleeps()).isEmpty();
        }

        @Test
        @DisplayName("Consecutive leads are paced by the rate limit")
        void consecutiveLeads_paced() {
            DeliveryGuard guard = guard(10, 0);

            guard.deliver(TestLeads.inStatus(1L, LeadStatus.COMPOSED), TestLeads.message(1L), false, RUN_ID);
            guard.deliver(TestLeads.inStatus(2L, LeadStatus.COMPOSED), TestLeads.message(2L), false, RUN_ID);

            assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(6));
        }
    }

    @Nested
    @DisplayName("Dry-run mode")
    class DryRun {

        @Test
        @DisplayName("No transport calls and no pacing, but the lead is DELIVERED")
        void dryRun_auditsOnly() {
            DeliveryGuard guard = guard(10, 2);
            Lead first = TestLeads.inStatus(1L, LeadStatus.COMPOSED);
            Lead second = TestLeads.inStatus(2L, LeadStatus.COMPOSED);

            guard.deliver(first, TestLeads.message(1L), true, RUN_ID);
            guard.deliver(second, TestLeads.message(2L), true, RUN_ID);

            verifyNoInteractions(transport, directMessageChannel);
            assertThat(clock.sleeps()).isEmpty();
            assertThat(first.getStatus()).isEqualTo(LeadStatus.DELIVERED);
            assertThat(second.getStatus()).isEqualTo(LeadStatus.DELIVERED);
            verify(runRecorder).logEvent(eq("deliver"), eq(RunRecorder.LEVEL_INFO),
                    contains("Dry-run send to " + first.getEmail()), eq(RUN_ID), eq(1L));
        }
    }

    @Test
    @DisplayName("A lead without a composed message is skipped untouched")
    void missingMessage_skipped() {
        Lead lead = TestLeads.inStatus(1L, LeadStatus.COMPOSED);

        DeliveryResult result = guard(10, 2).deliver(lead, null, false, RUN_ID);

        assertThat(result.status()).isEqualTo(DeliveryResult.Status.SKIPPED);
        assertThat(result.attempts()).isZero();
        assertThat(lead.getStatus()).isEqualTo(LeadStatus.COMPOSED);
        verify(leadRepository, never()).save(any());
        verifyNoInteractions(transport);
    }
}
