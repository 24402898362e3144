package io.github.samzhu.keeper.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * GPU 租用 Session 文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>避免自定義類型：狀態、類型、終止原因皆以小寫字串儲存，規則由 {@link SessionStatus} 管理</li>
 *   <li>金額以美分 (long) 儲存，不使用浮點數</li>
 *   <li>狀態轉移一律透過條件式更新 (status 為條件)，避免併發覆寫</li>
 *   <li>{@code totalMinutes}、{@code totalCostCents} 只在終止時寫入一次</li>
 * </ul>
 *
 * <p>計費時間 = (terminatedAt - startedAt) - pausedSeconds，
 * 若從未進入 ready 則以 createdAt 起算，向上取整至分鐘。
 */
@Document(collection = "gpu_sessions")
@CompoundIndexes({
    @CompoundIndex(name = "user_status_idx", def = "{'userId': 1, 'status': 1}"),
    @CompoundIndex(name = "user_created_idx", def = "{'userId': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "status_updated_idx", def = "{'status': 1, 'updatedAt': 1}")
})
public record GpuSession(
    @Id String id,

    // ========== 基本識別 ==========
    /** 擁有者用戶 ID */
    String userId,
    /** Session 類型：burst (隨用隨停) 或 vpn (可暫停的常駐) */
    String type,

    // ========== 規格 ==========
    /** GPU 運算等級：starter, pro, beast, ultra */
    String tier,
    /** GPU 型號，例如 RTX 4090 */
    String gpuType,
    /** GPU 數量 */
    int gpuCount,
    /** 預載模型 ID，可為 null */
    String modelId,

    // ========== 供應商 ==========
    /** 實際開機的供應商名稱，開機前為 null */
    String provider,
    /** 供應商端的實例 ID，開機前為 null */
    String providerInstanceId,
    /** 連線位址 */
    String accessUrl,

    // ========== 狀態 ==========
    /** 目前狀態（小寫字串） */
    String status,
    /** 終止原因：user, admin, zombie_cleanup, provider_failure */
    String terminationReason,
    /** 錯誤訊息（狀態為 error 時） */
    String errorMessage,

    // ========== 時間戳記 ==========
    Instant createdAt,
    /** 進入 ready 的時間，計費起點 */
    Instant startedAt,
    /** 最後一次觀察到活動或狀態改變的時間 */
    Instant updatedAt,
    /** 最近一次暫停的時間，恢復後清除 */
    Instant pausedAt,
    /** 累計暫停秒數，不計費 */
    long pausedSeconds,
    Instant terminatedAt,

    // ========== 計費 ==========
    /** 建立時鎖定的每分鐘價格 (美分) */
    long pricePerMinuteCents,
    /** 終止時結算的分鐘數 */
    Long totalMinutes,
    /** 終止時結算的費用 (美分) */
    Long totalCostCents
) {

    public static final String TYPE_BURST = "burst";
    public static final String TYPE_VPN = "vpn";

    /**
     * 建立 pending 狀態的新 Session。
     *
     * @param userId 用戶 ID
     * @param type burst 或 vpn
     * @param tier GPU 等級
     * @param gpuType GPU 型號
     * @param gpuCount GPU 數量
     * @param modelId 預載模型 ID
     * @param pricePerMinuteCents 每分鐘價格 (美分)
     * @param now 建立時間
     * @return GpuSession
     */
    public static GpuSession create(
            String userId,
            String type,
            String tier,
            String gpuType,
            int gpuCount,
            String modelId,
            long pricePerMinuteCents,
            Instant now) {

        return new GpuSession(
            null, // ID 自動產生
            userId,
            type,
            tier,
            gpuType,
            gpuCount,
            modelId,
            null,
            null,
            null,
            SessionStatus.PENDING.code(),
            null,
            null,
            now,
            null,
            now,
            null,
            0L,
            null,
            pricePerMinuteCents,
            null,
            null
        );
    }

    public SessionStatus statusValue() {
        return SessionStatus.of(status);
    }

    public boolean isVpn() {
        return TYPE_VPN.equals(type);
    }

    /**
     * 計費起點：startedAt，若從未 ready 則為 createdAt。
     */
    public Instant billingStart() {
        return startedAt != null ? startedAt : createdAt;
    }

    /**
     * 截至指定時間的暫停秒數，包含尚未恢復的暫停區間。
     */
    public long pausedSecondsAt(Instant at) {
        long paused = pausedSeconds;
        if (pausedAt != null && at.isAfter(pausedAt)) {
            paused += at.getEpochSecond() - pausedAt.getEpochSecond();
        }
        return paused;
    }
}
