package io.github.samzhu.keeper.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.TierLimits;
import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.GpuSessionFixtures;
import io.github.samzhu.keeper.document.SessionStatus;
import io.github.samzhu.keeper.dto.api.QuotaDecision;
import io.github.samzhu.keeper.dto.api.UsageSummaryResponse;
import io.github.samzhu.keeper.exception.DependencyUnavailableException;
import io.github.samzhu.keeper.repository.CreditTransactionRepository;
import io.github.samzhu.keeper.repository.SessionStore;
import io.github.samzhu.keeper.repository.UserAccountRepository;

class QuotaServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");
    private static final Instant MONTH_START = Instant.parse("2025-06-01T00:00:00Z");

    private SessionStore sessionStore;
    private QuotaService quotaService;

    @BeforeEach
    void setUp() {
        sessionStore = mock(SessionStore.class);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        BillingService billingService = new BillingService(mock(CreditTransactionRepository.class),
            mock(UserAccountRepository.class), mock(AutoTopUpService.class), clock);
        quotaService = new QuotaService(sessionStore, billingService, KeeperProperties.defaults(), clock);
    }

    @Test
    void shouldDenyWhenConcurrentLimitReached() {
        // Given: free 等級已有 1 個佔用中的 Session
        when(sessionStore.countOccupying("user-1")).thenReturn(1L);

        // When
        QuotaDecision decision = quotaService.checkSessionAllowed("user-1", "free");

        // Then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.violation()).isEqualTo(QuotaDecision.MAX_CONCURRENT_SESSIONS);
        assertThat(decision.reason()).isEqualTo("Max 1 concurrent sessions on free tier");
        verify(sessionStore, never()).findCreatedSince(anyString(), any());
    }

    @Test
    void shouldAllowWhenNoUsage() {
        // Given
        when(sessionStore.countOccupying("user-1")).thenReturn(0L);
        when(sessionStore.findCreatedSince("user-1", MONTH_START)).thenReturn(List.of());

        // When
        QuotaDecision decision = quotaService.checkSessionAllowed("user-1", "free");

        // Then
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.violation()).isNull();
    }

    @Test
    void shouldDenyWhenDailyMinutesExhausted() {
        // Given: 今日已結算 60 分鐘（free 每日上限 60）
        when(sessionStore.countOccupying("user-1")).thenReturn(0L);
        when(sessionStore.findCreatedSince("user-1", MONTH_START)).thenReturn(List.of(
            GpuSessionFixtures.terminated("s-1", "user-1", NOW.minusSeconds(3 * 3600), NOW.minusSeconds(7200), 60, 60)));

        // When
        QuotaDecision decision = quotaService.checkSessionAllowed("user-1", "free");

        // Then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.violation()).isEqualTo(QuotaDecision.DAILY_MINUTES);
        assertThat(decision.reason()).isEqualTo("Daily 60-minute limit reached on free tier");
    }

    @Test
    void shouldDenyWhenMonthlyMinutesExhausted() {
        // Given: 本月稍早使用 300 分鐘，今日 0
        Instant earlier = Instant.parse("2025-06-03T08:00:00Z");
        when(sessionStore.countOccupying("user-1")).thenReturn(0L);
        when(sessionStore.findCreatedSince("user-1", MONTH_START)).thenReturn(List.of(
            GpuSessionFixtures.terminated("s-1", "user-1", earlier, earlier.plusSeconds(18_000), 300, 300)));

        // When
        QuotaDecision decision = quotaService.checkSessionAllowed("user-1", "free");

        // Then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.violation()).isEqualTo(QuotaDecision.MONTHLY_MINUTES);
    }

    @Test
    void shouldCountLiveMinutesOfRunningSessions() {
        // Given: starter 等級，進行中的 Session 已跑 240 分鐘
        GpuSession running = GpuSessionFixtures.running("s-1", "user-1", GpuSession.TYPE_BURST,
            SessionStatus.ACTIVE, NOW.minusSeconds(240 * 60), NOW, 1);
        when(sessionStore.countOccupying("user-1")).thenReturn(1L);
        when(sessionStore.findCreatedSince("user-1", MONTH_START)).thenReturn(List.of(running));

        // When
        QuotaDecision decision = quotaService.checkSessionAllowed("user-1", "starter");

        // Then: 每日上限 240
        assertThat(decision.violation()).isEqualTo(QuotaDecision.DAILY_MINUTES);
    }

    @Test
    void shouldSkipMinuteChecksForUnlimitedTier() {
        // Given
        when(sessionStore.countOccupying("user-1")).thenReturn(3L);

        // When
        QuotaDecision decision = quotaService.checkSessionAllowed("user-1", "enterprise");

        // Then
        assertThat(decision.allowed()).isTrue();
        verify(sessionStore, never()).findCreatedSince(anyString(), any());
    }

    @Test
    void shouldDenyWhenStoreUnavailable() {
        // Given
        when(sessionStore.countOccupying("user-1"))
            .thenThrow(new DataAccessResourceFailureException("Timed out waiting for server"));

        // When
        QuotaDecision decision = quotaService.checkSessionAllowed("user-1", "pro");

        // Then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.violation()).isEqualTo(QuotaDecision.STORE_UNAVAILABLE);
    }

    @Test
    void usageSummaryShouldReportStoreFailureAsDependencyUnavailable() {
        // Given
        when(sessionStore.countOccupying("user-1")).thenReturn(0L);
        when(sessionStore.findCreatedSince("user-1", MONTH_START))
            .thenThrow(new DataAccessResourceFailureException("Timed out waiting for server"));

        // When / Then
        assertThatThrownBy(() -> quotaService.getUsageSummary("user-1", "free"))
            .isInstanceOf(DependencyUnavailableException.class)
            .hasCauseInstanceOf(DataAccessResourceFailureException.class)
            .extracting(e -> ((DependencyUnavailableException) e).getDependency())
            .isEqualTo("usage-store");
    }

    @Test
    void shouldFallBackToFreeForUnknownTier() {
        // When
        TierLimits limits = quotaService.getLimits("platinum");
        TierLimits nullTier = quotaService.getLimits(null);

        // Then
        assertThat(limits).isEqualTo(TierLimits.defaultTable().get("free"));
        assertThat(nullTier).isEqualTo(limits);
    }

    @Test
    void shouldSummarizeUsageWithPercentages() {
        // Given: 今日 30 分鐘，本月另有 120 分鐘
        Instant earlier = Instant.parse("2025-06-03T08:00:00Z");
        when(sessionStore.countOccupying("user-1")).thenReturn(0L);
        when(sessionStore.findCreatedSince("user-1", MONTH_START)).thenReturn(List.of(
            GpuSessionFixtures.terminated("s-1", "user-1", NOW.minusSeconds(3600), NOW.minusSeconds(1800), 30, 30),
            GpuSessionFixtures.terminated("s-2", "user-1", earlier, earlier.plusSeconds(7200), 120, 120)));

        // When
        UsageSummaryResponse summary = quotaService.getUsageSummary("user-1", "free");

        // Then
        assertThat(summary.tier()).isEqualTo("free");
        assertThat(summary.usage().todayMinutes()).isEqualTo(30);
        assertThat(summary.usage().monthMinutes()).isEqualTo(150);
        assertThat(summary.percentages().daily()).isEqualTo(50);
        assertThat(summary.percentages().monthly()).isEqualTo(50);
        assertThat(summary.percentages().sessions()).isZero();
    }
}
