package io.github.samzhu.keeper.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.TierLimits;
import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.SessionStatus;
import io.github.samzhu.keeper.dto.api.QuotaDecision;
import io.github.samzhu.keeper.dto.api.UsageSummaryResponse;
import io.github.samzhu.keeper.exception.DependencyUnavailableException;
import io.github.samzhu.keeper.repository.SessionStore;
import io.github.samzhu.keeper.util.PeriodUtils;

/**
 * 訂閱等級配額檢查服務。
 *
 * <p>建立 Session 前依序檢查（任一不符即拒絕）：
 * <ol>
 *   <li>佔用中的 Session 數 ≥ maxConcurrentSessions</li>
 *   <li>今日 (UTC) 已使用分鐘 ≥ dailyMinutes（-1 略過）</li>
 *   <li>本月 (UTC) 已使用分鐘 ≥ monthlyMinutes（-1 略過）</li>
 * </ol>
 *
 * <p>用量每次即時從資料庫讀取，不快取。資料庫不可用時拒絕 ({@code STORE_UNAVAILABLE})。
 */
@Service
public class QuotaService {

    private static final Logger log = LoggerFactory.getLogger(QuotaService.class);

    private static final String FALLBACK_TIER = "free";
    private static final String USAGE_STORE = "usage-store";

    private final SessionStore sessionStore;
    private final BillingService billingService;
    private final Map<String, TierLimits> tiers;
    private final Clock clock;

    public QuotaService(
            SessionStore sessionStore,
            BillingService billingService,
            KeeperProperties properties,
            Clock clock) {
        this.sessionStore = sessionStore;
        this.billingService = billingService;
        this.tiers = properties.tiers();
        this.clock = clock;
    }

    /**
     * 取得等級配額，未知等級使用 free。
     *
     * @param tier 訂閱等級
     * @return 配額
     */
    public TierLimits getLimits(String tier) {
        return tiers.get(resolveTier(tier));
    }

    private String resolveTier(String tier) {
        return tier != null && tiers.containsKey(tier) ? tier : FALLBACK_TIER;
    }

    /**
     * 檢查是否允許建立新 Session。
     *
     * @param userId 用戶 ID
     * @param tier 訂閱等級
     * @return 檢查結果
     */
    public QuotaDecision checkSessionAllowed(String userId, String tier) {
        TierLimits limits = getLimits(tier);
        String tierName = resolveTier(tier);

        try {
            long active = sessionStore.countOccupying(userId);
            if (active >= limits.maxConcurrentSessions()) {
                return deny(userId, QuotaDecision.MAX_CONCURRENT_SESSIONS, String.format(
                    "Max %d concurrent sessions on %s tier", limits.maxConcurrentSessions(), tierName));
            }

            if (!limits.hasDailyCap() && !limits.hasMonthlyCap()) {
                return QuotaDecision.permit();
            }

            Usage usage = loadUsage(userId);
            if (limits.hasDailyCap() && usage.todayMinutes() >= limits.dailyMinutes()) {
                return deny(userId, QuotaDecision.DAILY_MINUTES, String.format(
                    "Daily %d-minute limit reached on %s tier", limits.dailyMinutes(), tierName));
            }
            if (limits.hasMonthlyCap() && usage.monthMinutes() >= limits.monthlyMinutes()) {
                return deny(userId, QuotaDecision.MONTHLY_MINUTES, String.format(
                    "Monthly %d-minute limit reached on %s tier", limits.monthlyMinutes(), tierName));
            }
            return QuotaDecision.permit();
        } catch (DataAccessException e) {
            log.error("Quota check failed, denying session: userId={}, error={}", userId, e.getMessage(), e);
            return QuotaDecision.deny(QuotaDecision.STORE_UNAVAILABLE,
                "Usage data is temporarily unavailable, please retry later");
        }
    }

    /**
     * 取得用量摘要，與 {@link #checkSessionAllowed} 使用相同的統計方式。
     *
     * @param userId 用戶 ID
     * @param tier 訂閱等級
     * @return 用量摘要
     * @throws DependencyUnavailableException 資料庫不可用
     */
    public UsageSummaryResponse getUsageSummary(String userId, String tier) {
        TierLimits limits = getLimits(tier);
        long active;
        Usage usage;
        try {
            active = sessionStore.countOccupying(userId);
            usage = loadUsage(userId);
        } catch (DataAccessException e) {
            log.error("Usage summary failed: userId={}, error={}", userId, e.getMessage(), e);
            throw new DependencyUnavailableException(USAGE_STORE, e);
        }

        return new UsageSummaryResponse(
            userId,
            resolveTier(tier),
            limits,
            new UsageSummaryResponse.Usage(active, usage.todayMinutes(), usage.monthMinutes()),
            new UsageSummaryResponse.Percentages(
                PeriodUtils.percentOf(usage.todayMinutes(), limits.dailyMinutes()),
                PeriodUtils.percentOf(usage.monthMinutes(), limits.monthlyMinutes()),
                PeriodUtils.percentOf(active, limits.maxConcurrentSessions())
            )
        );
    }

    /**
     * 統計今日與本月分鐘數。
     *
     * <p>已終止的 Session 使用結算分鐘數；尚在計費的 Session 以目前時間估算。
     */
    private Usage loadUsage(String userId) {
        Instant now = clock.instant();
        Instant dayStart = PeriodUtils.startOfDay(now);
        Instant monthStart = PeriodUtils.startOfMonth(now);

        // 月初一定早於或等於當日開始
        List<GpuSession> sessions = sessionStore.findCreatedSince(userId, monthStart);

        long today = 0;
        long month = 0;
        for (GpuSession session : sessions) {
            long minutes = minutesOf(session, now);
            month += minutes;
            if (!session.createdAt().isBefore(dayStart)) {
                today += minutes;
            }
        }
        return new Usage(today, month);
    }

    private long minutesOf(GpuSession session, Instant now) {
        if (session.totalMinutes() != null) {
            return session.totalMinutes();
        }
        SessionStatus status = session.statusValue();
        if (status == SessionStatus.READY || status == SessionStatus.ACTIVE || status == SessionStatus.PAUSED) {
            return billingService.computeSettlement(session, now).minutes();
        }
        return 0;
    }

    private QuotaDecision deny(String userId, String violation, String reason) {
        log.info("Session denied by quota: userId={}, violation={}", userId, violation);
        return QuotaDecision.deny(violation, reason);
    }

    private record Usage(long todayMinutes, long monthMinutes) {
    }
}
