package io.github.samzhu.keeper.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 點數交易帳本文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>只增不改：更正以新的反向交易表示</li>
 *   <li>金額有正負號：扣款為負數 (美分)</li>
 *   <li>結算交易使用確定性 ID {@code settle_{sessionId}}，重複寫入會觸發 duplicate key，視為已結算</li>
 * </ul>
 */
@Document(collection = "credit_transactions")
@CompoundIndex(name = "user_created_idx", def = "{'userId': 1, 'createdAt': -1}")
public record CreditTransaction(
    @Id String id,

    // ========== 基本識別 ==========
    String userId,
    /** 關聯的 Session，非 Session 交易為 null */
    String sessionId,

    // ========== 交易內容 ==========
    /** 交易類型：session_charge, auto_topup */
    String type,
    /** 金額 (美分)，扣款為負數 */
    long amountCents,
    String description,
    /** 金流參考編號，例如 PaymentIntent ID */
    String paymentReference,

    Instant createdAt
) {

    public static final String TYPE_SESSION_CHARGE = "session_charge";
    public static final String TYPE_AUTO_TOPUP = "auto_topup";

    /**
     * Session 結算交易的確定性 ID。
     */
    public static String settlementId(String sessionId) {
        return "settle_" + sessionId;
    }

    /**
     * 建立 Session 扣款交易。
     *
     * @param session 已終止的 Session
     * @param now 建立時間
     * @return 金額為負數的 CreditTransaction
     */
    public static CreditTransaction sessionCharge(GpuSession session, Instant now) {
        long minutes = session.totalMinutes() != null ? session.totalMinutes() : 0L;
        long cost = session.totalCostCents() != null ? session.totalCostCents() : 0L;
        return new CreditTransaction(
            settlementId(session.id()),
            session.userId(),
            session.id(),
            TYPE_SESSION_CHARGE,
            -cost,
            String.format("GPU session %s: %d min %s", session.tier(), minutes, session.gpuType()),
            null,
            now
        );
    }

    /**
     * 建立自動儲值交易。
     *
     * @param userId 用戶 ID
     * @param amountCents 儲值金額 (美分)
     * @param paymentReference 金流參考編號
     * @param now 建立時間
     * @return CreditTransaction
     */
    public static CreditTransaction autoTopUp(String userId, long amountCents, String paymentReference, Instant now) {
        return new CreditTransaction(
            null, // ID 自動產生
            userId,
            null,
            TYPE_AUTO_TOPUP,
            amountCents,
            String.format("Auto top-up: $%d.%02d", amountCents / 100, amountCents % 100),
            paymentReference,
            now
        );
    }
}
