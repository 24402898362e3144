package io.github.samzhu.keeper.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * 配額週期工具類。
 *
 * <p>所有時間計算均使用 UTC 時區。
 */
public final class PeriodUtils {

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 取得當日開始時間。
     *
     * @param now 目前時間
     * @return 當日 00:00:00 UTC
     */
    public static Instant startOfDay(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC)
            .atStartOfDay(ZoneOffset.UTC)
            .toInstant();
    }

    /**
     * 取得當月開始時間。
     *
     * @param now 目前時間
     * @return 當月 1 號 00:00:00 UTC
     */
    public static Instant startOfMonth(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC)
            .withDayOfMonth(1)
            .atStartOfDay(ZoneOffset.UTC)
            .toInstant();
    }

    /**
     * 計算百分比並四捨五入，上限未設定（≤ 0）時為 0。
     *
     * @param used 已使用量
     * @param limit 上限
     * @return 0 以上的整數百分比
     */
    public static int percentOf(long used, long limit) {
        if (limit <= 0) {
            return 0;
        }
        return (int) Math.round(used * 100.0 / limit);
    }
}
