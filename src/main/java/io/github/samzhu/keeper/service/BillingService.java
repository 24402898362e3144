package io.github.samzhu.keeper.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import io.github.samzhu.keeper.document.CreditTransaction;
import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.SessionStatus;
import io.github.samzhu.keeper.dto.SessionMetrics;
import io.github.samzhu.keeper.repository.CreditTransactionRepository;
import io.github.samzhu.keeper.repository.UserAccountRepository;

/**
 * Session 計費與結算服務。
 *
 * <p>計費公式：
 * <pre>
 * 計費秒數 = (結束時間 - 計費起點) - 暫停秒數
 * 分鐘數   = ceil(max(0, 計費秒數) / 60)
 * 費用     = 分鐘數 × 每分鐘價格 (美分)
 * </pre>
 *
 * <p>結算以確定性 ID {@code settle_{sessionId}} 寫入交易，
 * 同一 Session 只會扣款一次。
 */
@Service
public class BillingService {

    private static final Logger log = LoggerFactory.getLogger(BillingService.class);

    private final CreditTransactionRepository creditTransactionRepository;
    private final UserAccountRepository userAccountRepository;
    private final AutoTopUpService autoTopUpService;
    private final Clock clock;

    public BillingService(
            CreditTransactionRepository creditTransactionRepository,
            UserAccountRepository userAccountRepository,
            AutoTopUpService autoTopUpService,
            Clock clock) {
        this.creditTransactionRepository = creditTransactionRepository;
        this.userAccountRepository = userAccountRepository;
        this.autoTopUpService = autoTopUpService;
        this.clock = clock;
    }

    /**
     * 計算計費分鐘數，不足一分鐘以一分鐘計。
     *
     * @param startedAt 計費起點
     * @param endedAt 結束時間
     * @param pausedSeconds 暫停秒數
     * @return 分鐘數，不為負
     */
    public long calculateMinutes(Instant startedAt, Instant endedAt, long pausedSeconds) {
        long billableMillis = Duration.between(startedAt, endedAt).toMillis() - pausedSeconds * 1000L;
        if (billableMillis <= 0) {
            return 0;
        }
        return (billableMillis + 59_999) / 60_000;
    }

    /**
     * 計算費用。
     *
     * @param minutes 分鐘數
     * @param pricePerMinuteCents 每分鐘價格 (美分)
     * @return 費用 (美分)
     */
    public long calculateCost(long minutes, long pricePerMinuteCents) {
        return minutes * pricePerMinuteCents;
    }

    /**
     * 計算 Session 截至指定時間的結算值。
     *
     * @param session Session
     * @param endedAt 結束時間
     * @return 結算值
     */
    public Settlement computeSettlement(GpuSession session, Instant endedAt) {
        long pausedSeconds = session.pausedSecondsAt(endedAt);
        long minutes = calculateMinutes(session.billingStart(), endedAt, pausedSeconds);
        return new Settlement(minutes, calculateCost(minutes, session.pricePerMinuteCents()), pausedSeconds);
    }

    /**
     * 執行中 Session 的即時指標。
     */
    public SessionMetrics liveMetrics(GpuSession session, Double gpuUtilization, Long memoryUsedMb, Double temperature) {
        Settlement live = computeSettlement(session, clock.instant());
        return new SessionMetrics(live.minutes(), live.costCents(), gpuUtilization, memoryUsedMb, temperature);
    }

    /**
     * 結算已終止的 Session：寫入扣款交易並扣除餘額，之後檢查自動儲值。
     *
     * @param session 已終止的 Session
     * @return true 表示本次完成扣款；false 表示無需扣款或已結算過
     */
    public boolean settleBilling(GpuSession session) {
        if (session.statusValue() != SessionStatus.TERMINATED) {
            log.debug("Skip settlement for non-terminated session: id={}, status={}", session.id(), session.status());
            return false;
        }
        long cost = session.totalCostCents() != null ? session.totalCostCents() : 0L;
        if (cost <= 0) {
            log.debug("Skip settlement with zero cost: id={}", session.id());
            return false;
        }

        Instant now = clock.instant();
        try {
            creditTransactionRepository.insert(CreditTransaction.sessionCharge(session, now));
        } catch (DuplicateKeyException e) {
            log.info("Session already settled: id={}", session.id());
            return false;
        }

        userAccountRepository.incrementBalanceByUserId(session.userId(), -cost, now);
        log.info("Session settled: id={}, userId={}, minutes={}, cost={}",
            session.id(), session.userId(), session.totalMinutes(), cost);

        autoTopUpService.triggerAsync(session.userId());
        return true;
    }

    /**
     * 結算值。
     *
     * @param minutes 計費分鐘數
     * @param costCents 費用 (美分)
     * @param pausedSeconds 累計暫停秒數
     */
    public record Settlement(long minutes, long costCents, long pausedSeconds) {
    }
}
