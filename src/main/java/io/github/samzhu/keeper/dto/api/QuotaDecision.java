package io.github.samzhu.keeper.dto.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 配額檢查結果。
 *
 * @param allowed 是否允許建立 Session
 * @param violation 違反的項目，允許時為 null
 * @param reason 給使用者看的說明，允許時為 null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuotaDecision(
    boolean allowed,
    String violation,
    String reason
) {

    public static final String MAX_CONCURRENT_SESSIONS = "MAX_CONCURRENT_SESSIONS";
    public static final String DAILY_MINUTES = "DAILY_MINUTES";
    public static final String MONTHLY_MINUTES = "MONTHLY_MINUTES";
    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";

    public static QuotaDecision permit() {
        return new QuotaDecision(true, null, null);
    }

    public static QuotaDecision deny(String violation, String reason) {
        return new QuotaDecision(false, violation, reason);
    }
}
