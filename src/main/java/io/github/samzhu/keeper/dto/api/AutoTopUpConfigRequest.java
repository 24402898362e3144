package io.github.samzhu.keeper.dto.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * 自動儲值設定請求。
 *
 * @param enabled 是否啟用
 * @param thresholdCents 觸發門檻 (美分)，未指定使用預設
 * @param amountCents 儲值金額 (美分)，未指定使用預設
 */
public record AutoTopUpConfigRequest(
    @NotNull(message = "enabled is required")
    Boolean enabled,

    @Min(value = 100, message = "thresholdCents must be at least 100")
    Long thresholdCents,

    @Min(value = 500, message = "amountCents must be at least 500")
    Long amountCents
) {
}
