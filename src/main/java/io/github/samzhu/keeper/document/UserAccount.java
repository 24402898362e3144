package io.github.samzhu.keeper.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 用戶帳戶文件，包含訂閱等級、點數餘額與自動儲值設定。
 *
 * <p>餘額一律以 {@code $inc} 原子更新，不做讀取後覆寫。
 */
@Document(collection = "user_accounts")
public record UserAccount(
    @Id String id,

    // ========== 基本識別 ==========
    @Indexed(unique = true) String userId,
    /** 訂閱等級：free, starter, pro, enterprise */
    String tier,

    // ========== 餘額 ==========
    /** 點數餘額 (美分)，可能因結算而為負數 */
    long creditBalanceCents,
    /** 金流客戶參考編號 (Stripe customer ID)，未綁定為 null */
    String paymentCustomerRef,

    // ========== 自動儲值 ==========
    boolean autoTopUpEnabled,
    /** 餘額低於此值時觸發 (美分)，0 表示使用預設值 */
    long autoTopUpThresholdCents,
    /** 每次儲值金額 (美分)，0 表示使用預設值 */
    long autoTopUpAmountCents,

    // ========== 時間戳記 ==========
    Instant createdAt,
    Instant lastUpdatedAt
) {

    public static final String DEFAULT_TIER = "free";

    /**
     * 建立新帳戶。
     *
     * @param userId 用戶 ID
     * @param tier 訂閱等級
     * @param now 建立時間
     * @return UserAccount
     */
    public static UserAccount create(String userId, String tier, Instant now) {
        return new UserAccount(
            null, // ID 自動產生
            userId,
            tier != null ? tier : DEFAULT_TIER,
            0L,
            null,
            false,
            0L,
            0L,
            now,
            now
        );
    }

    public boolean hasPaymentMethod() {
        return paymentCustomerRef != null && !paymentCustomerRef.isBlank();
    }
}
