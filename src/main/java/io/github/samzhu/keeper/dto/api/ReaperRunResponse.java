package io.github.samzhu.keeper.dto.api;

/**
 * 手動觸發殭屍回收的結果。
 *
 * @param candidates 符合條件的 Session 數
 * @param terminated 成功終止數
 * @param failed 處理失敗數
 * @param durationMs 執行時間
 */
public record ReaperRunResponse(
    int candidates,
    int terminated,
    int failed,
    long durationMs
) {
}
