package io.github.samzhu.tokenmeter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.dto.EnforcementResult;
import io.github.samzhu.tokenmeter.dto.MeteredRequest;
import io.github.samzhu.tokenmeter.dto.UsageLimit;
import io.github.samzhu.tokenmeter.dto.UsageRecord;
import io.github.samzhu.tokenmeter.exception.MeteredOperationException;
import io.github.samzhu.tokenmeter.exception.UsageLimitExceededException;
import io.github.samzhu.tokenmeter.service.MeteredOperationService.MeteredResponse;
import io.github.samzhu.tokenmeter.service.MeteredOperationService.Preflight;

class MeteredOperationServiceTest {

    private static final BillingContext CONTEXT = new BillingContext("user-1", "org-1", null);
    private static final Instant NOW = Instant.parse("2025-05-01T00:00:00Z");

    private UsageEnforcementService enforcementService;
    private UsageRecorderService recorderService;
    private MeteredOperationService service;

    @BeforeEach
    void setUp() {
        enforcementService = mock(UsageEnforcementService.class);
        recorderService = mock(UsageRecorderService.class);
        service = new MeteredOperationService(
            new TokenEstimationService(MeteringProperties.defaults()), enforcementService, recorderService);
    }

    @Test
    void shouldRecordReportedTokensOnSuccess() {
        // Given: refine, 1000 字元 → (50 + 200) * 1.5 = 375
        allow();
        MeteredRequest request = new MeteredRequest("refine", "/api/refine", "refine", null, 1000, "req-1");

        // When
        String body = service.execute(request, CONTEXT, model -> MeteredResponse.of("refined:" + model, 412));

        // Then
        assertThat(body).isEqualTo("refined:gemini-2.5-flash-lite");
        verify(enforcementService).enforce(375L, CONTEXT);

        ArgumentCaptor<UsageRecord> captor = ArgumentCaptor.forClass(UsageRecord.class);
        verify(recorderService).record(captor.capture(), eq(CONTEXT));
        assertThat(captor.getValue().tokensUsed()).isEqualTo(412);
        assertThat(captor.getValue().featureUsed()).isEqualTo("refine");
        assertThat(captor.getValue().requestId()).isEqualTo("req-1");
    }

    @Test
    void shouldRecordEstimateWhenProviderDoesNotReportTokens() {
        allow();
        MeteredRequest request = new MeteredRequest("chat", "/api/chat", "chat", null, 0, null);

        service.execute(request, CONTEXT, model -> MeteredResponse.unreported("ok"));

        ArgumentCaptor<UsageRecord> captor = ArgumentCaptor.forClass(UsageRecord.class);
        verify(recorderService).record(captor.capture(), eq(CONTEXT));
        assertThat(captor.getValue().tokensUsed()).isEqualTo(50);
    }

    @Test
    void shouldNotInvokeOperationWhenDenied() {
        // Given
        UsageLimit usage = new UsageLimit(9_800, 10_000, 0, NOW, NOW, "Free", "active");
        when(enforcementService.enforce(anyLong(), any(BillingContext.class)))
            .thenReturn(EnforcementResult.deny(usage, "over", 300));
        AtomicBoolean invoked = new AtomicBoolean();

        // When / Then
        assertThatThrownBy(() -> service.execute(
                new MeteredRequest("chat", "/api/chat", "chat", null, 1250, null), CONTEXT,
                model -> {
                    invoked.set(true);
                    return MeteredResponse.unreported("never");
                }))
            .isInstanceOfSatisfying(UsageLimitExceededException.class,
                ex -> assertThat(ex.getResult().usage().currentUsage()).isEqualTo(9_800));

        assertThat(invoked).isFalse();
        verify(recorderService, never()).record(any(), any());
        verify(recorderService, never()).recordFailure(any(), any(), any(), any(), any());
    }

    @Test
    void shouldRecordFailureTaxWhenOperationFails() {
        allow();
        MeteredRequest request = new MeteredRequest("assess", "/api/assess", "assess", "gemini-2.5-flash", 800,
            "req-2");

        assertThatThrownBy(() -> service.execute(request, CONTEXT, model -> {
                throw new IOException("upstream 503");
            }))
            .isInstanceOf(MeteredOperationException.class)
            .hasCauseInstanceOf(IOException.class);

        verify(recorderService).recordFailure("/api/assess", "gemini-2.5-flash", "assess", "req-2", CONTEXT);
        verify(recorderService, never()).record(any(), any());
    }

    @Test
    void shouldRestoreInterruptFlagWhenCallInterrupted() {
        allow();
        MeteredRequest request = new MeteredRequest("chat", "/api/chat", "chat", null, 10, "req-3");

        try {
            assertThatThrownBy(() -> service.execute(request, CONTEXT, model -> {
                    throw new InterruptedException("shutdown");
                }))
                .isInstanceOf(MeteredOperationException.class)
                .hasCauseInstanceOf(InterruptedException.class);

            // Then: 中斷狀態保留給呼叫端，仍記錄失敗 Token
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            verify(recorderService).recordFailure(eq("/api/chat"), any(), eq("chat"), eq("req-3"), eq(CONTEXT));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldPreflightWithResolvedModelAndDisplayCost() {
        allow();

        // (100 + 100 * 0.4) * 1.0 = 140, cost 140 * 6.25 = 875
        Preflight preflight = service.preflight("chat", 100, "gemini-2.5-flash", CONTEXT);

        assertThat(preflight.model()).isEqualTo("gemini-2.5-flash");
        assertThat(preflight.estimatedTokens()).isEqualTo(140);
        assertThat(preflight.displayCost()).isEqualTo(875);
        assertThat(preflight.result().allowed()).isTrue();
    }

    private void allow() {
        when(enforcementService.enforce(anyLong(), any(BillingContext.class)))
            .thenAnswer(inv -> EnforcementResult.allow(null, inv.getArgument(0)));
    }
}
