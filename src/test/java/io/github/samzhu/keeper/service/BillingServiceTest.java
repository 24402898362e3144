package io.github.samzhu.keeper.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;

import io.github.samzhu.keeper.document.CreditTransaction;
import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.GpuSessionFixtures;
import io.github.samzhu.keeper.document.SessionStatus;
import io.github.samzhu.keeper.dto.SessionMetrics;
import io.github.samzhu.keeper.repository.CreditTransactionRepository;
import io.github.samzhu.keeper.repository.UserAccountRepository;

class BillingServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private CreditTransactionRepository transactionRepository;
    private UserAccountRepository accountRepository;
    private AutoTopUpService autoTopUpService;
    private BillingService billingService;

    @BeforeEach
    void setUp() {
        transactionRepository = mock(CreditTransactionRepository.class);
        accountRepository = mock(UserAccountRepository.class);
        autoTopUpService = mock(AutoTopUpService.class);
        billingService = new BillingService(transactionRepository, accountRepository, autoTopUpService,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRoundPartialMinuteUp() {
        // Given: 90 秒，每分鐘 100 美分
        Instant start = NOW.minusSeconds(90);

        // When
        long minutes = billingService.calculateMinutes(start, NOW, 0);
        long cost = billingService.calculateCost(minutes, 100);

        // Then: 2 分鐘，200 美分
        assertThat(minutes).isEqualTo(2);
        assertThat(cost).isEqualTo(200);
    }

    @Test
    void shouldBillExactMinutesWithoutRounding() {
        assertThat(billingService.calculateMinutes(NOW.minusSeconds(120), NOW, 0)).isEqualTo(2);
        assertThat(billingService.calculateMinutes(NOW.minusMillis(120_001), NOW, 0)).isEqualTo(3);
    }

    @Test
    void shouldReturnZeroForNonPositiveDuration() {
        assertThat(billingService.calculateMinutes(NOW, NOW, 0)).isZero();
        assertThat(billingService.calculateMinutes(NOW.plusSeconds(30), NOW, 0)).isZero();
        // 暫停秒數大於總時長
        assertThat(billingService.calculateMinutes(NOW.minusSeconds(60), NOW, 120)).isZero();
    }

    @Test
    void shouldExcludePausedTimeFromSettlement() {
        // Given: 開機 10 分鐘，已暫停 3 分鐘，目前又暫停了 2 分鐘
        GpuSession session = GpuSessionFixtures.paused("s-1", "user-1",
            NOW.minusSeconds(600), NOW.minusSeconds(120), 180, 3);

        // When
        BillingService.Settlement settlement = billingService.computeSettlement(session, NOW);

        // Then: 600 - 180 - 120 = 300 秒 = 5 分鐘
        assertThat(settlement.pausedSeconds()).isEqualTo(300);
        assertThat(settlement.minutes()).isEqualTo(5);
        assertThat(settlement.costCents()).isEqualTo(15);
    }

    @Test
    void shouldBillFromCreatedAtWhenNeverStarted() {
        // Given
        GpuSession session = GpuSessionFixtures.pending("s-2", "user-1", NOW.minusSeconds(61), 7);

        // When
        BillingService.Settlement settlement = billingService.computeSettlement(session, NOW);

        // Then
        assertThat(settlement.minutes()).isEqualTo(2);
        assertThat(settlement.costCents()).isEqualTo(14);
    }

    @Test
    void shouldComputeLiveMetrics() {
        // Given
        GpuSession session = GpuSessionFixtures.running("s-3", "user-1", GpuSession.TYPE_BURST,
            SessionStatus.ACTIVE, NOW.minusSeconds(300), NOW, 12);

        // When
        SessionMetrics metrics = billingService.liveMetrics(session, 87.5, 20480L, 71.0);

        // Then
        assertThat(metrics.elapsedMinutes()).isEqualTo(5);
        assertThat(metrics.currentCostCents()).isEqualTo(60);
        assertThat(metrics.gpuUtilization()).isEqualTo(87.5);
        assertThat(metrics.memoryUsedMb()).isEqualTo(20480L);
    }

    @Test
    void shouldSettleTerminatedSessionOnce() {
        // Given
        GpuSession session = GpuSessionFixtures.terminated("s-4", "user-1",
            NOW.minusSeconds(90), NOW, 2, 200);

        // When
        boolean settled = billingService.settleBilling(session);

        // Then: 寫入負數交易、扣除餘額、觸發自動儲值檢查
        assertThat(settled).isTrue();
        ArgumentCaptor<CreditTransaction> captor = ArgumentCaptor.forClass(CreditTransaction.class);
        verify(transactionRepository).insert(captor.capture());
        CreditTransaction tx = captor.getValue();
        assertThat(tx.id()).isEqualTo("settle_s-4");
        assertThat(tx.type()).isEqualTo(CreditTransaction.TYPE_SESSION_CHARGE);
        assertThat(tx.amountCents()).isEqualTo(-200);
        assertThat(tx.sessionId()).isEqualTo("s-4");
        verify(accountRepository).incrementBalanceByUserId("user-1", -200L, NOW);
        verify(autoTopUpService).triggerAsync("user-1");
    }

    @Test
    void shouldNotDebitTwiceWhenAlreadySettled() {
        // Given: 第一次成功，第二次 duplicate key
        GpuSession session = GpuSessionFixtures.terminated("s-5", "user-1",
            NOW.minusSeconds(90), NOW, 2, 200);
        when(transactionRepository.insert(any(CreditTransaction.class)))
            .thenReturn(null)
            .thenThrow(new DuplicateKeyException("E11000 duplicate key"));

        // When
        boolean first = billingService.settleBilling(session);
        boolean second = billingService.settleBilling(session);

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        verify(accountRepository, times(1)).incrementBalanceByUserId(eq("user-1"), anyLong(), any());
        verify(autoTopUpService, times(1)).triggerAsync("user-1");
    }

    @Test
    void shouldSkipZeroCostAndNonTerminatedSessions() {
        // Given
        GpuSession free = GpuSessionFixtures.terminated("s-6", "user-1", NOW, NOW, 0, 0);
        GpuSession active = GpuSessionFixtures.running("s-7", "user-1", GpuSession.TYPE_BURST,
            SessionStatus.ACTIVE, NOW.minusSeconds(60), NOW, 5);

        // When / Then
        assertThat(billingService.settleBilling(free)).isFalse();
        assertThat(billingService.settleBilling(active)).isFalse();
        verify(transactionRepository, never()).insert(any(CreditTransaction.class));
        verify(accountRepository, never()).incrementBalanceByUserId(anyString(), anyLong(), any());
    }
}
