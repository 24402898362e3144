package io.github.samzhu.keeper.repository;

import java.time.Instant;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.keeper.document.UserAccount;

/**
 * 用戶帳戶資料存取介面。
 *
 * <p>餘額變動使用 {@code @Query + @Update} 的 {@code $inc} 原子操作。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/modifying-methods.html">Modifying Methods</a>
 */
public interface UserAccountRepository extends MongoRepository<UserAccount, String> {

    // ========== 基本查詢 ==========

    Optional<UserAccount> findByUserId(String userId);

    // ========== 更新操作 (@Query + @Update) ==========

    /**
     * 原子增減點數餘額。
     *
     * @param userId 用戶 ID
     * @param deltaCents 增減金額 (美分)，扣款為負數
     * @param now 當前時間
     * @return 更新的文件數
     */
    @Query("{ 'userId': ?0 }")
    @Update("{ '$inc': { 'creditBalanceCents': ?1 }, '$set': { 'lastUpdatedAt': ?2 } }")
    long incrementBalanceByUserId(String userId, long deltaCents, Instant now);

    /**
     * 更新自動儲值設定。
     *
     * @param userId 用戶 ID
     * @param enabled 是否啟用
     * @param thresholdCents 觸發門檻 (美分)
     * @param amountCents 儲值金額 (美分)
     * @param now 當前時間
     * @return 更新的文件數
     */
    @Query("{ 'userId': ?0 }")
    @Update("{ '$set': { 'autoTopUpEnabled': ?1, 'autoTopUpThresholdCents': ?2, 'autoTopUpAmountCents': ?3, 'lastUpdatedAt': ?4 } }")
    long updateAutoTopUpByUserId(String userId, boolean enabled, long thresholdCents, long amountCents, Instant now);
}
