package io.github.samzhu.keeper.dto.api;

import io.github.samzhu.keeper.config.KeeperProperties.TierLimits;

/**
 * 用戶配額使用摘要。
 *
 * @param userId 用戶 ID
 * @param tier 訂閱等級
 * @param limits 該等級的配額
 * @param usage 目前用量
 * @param percentages 使用率（四捨五入，無限制為 0）
 */
public record UsageSummaryResponse(
    String userId,
    String tier,
    TierLimits limits,
    Usage usage,
    Percentages percentages
) {

    public record Usage(
        long activeSessions,
        long todayMinutes,
        long monthMinutes
    ) {
    }

    public record Percentages(
        int daily,
        int monthly,
        int sessions
    ) {
    }
}
