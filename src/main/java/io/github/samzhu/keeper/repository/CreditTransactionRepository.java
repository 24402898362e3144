package io.github.samzhu.keeper.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.keeper.document.CreditTransaction;

/**
 * 點數交易帳本資料存取介面。
 *
 * <p>只新增不修改；結算交易以 {@code insert} 寫入，重複 ID 會拋出
 * {@link org.springframework.dao.DuplicateKeyException}。
 */
public interface CreditTransactionRepository extends MongoRepository<CreditTransaction, String> {

    /**
     * 分頁查詢用戶交易，新的在前。
     *
     * @param userId 用戶 ID
     * @param pageable 分頁參數
     * @return 分頁結果
     */
    Page<CreditTransaction> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
}
