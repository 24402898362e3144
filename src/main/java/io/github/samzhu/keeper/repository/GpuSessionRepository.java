package io.github.samzhu.keeper.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.keeper.document.GpuSession;

/**
 * GPU Session 資料存取介面。
 *
 * <p>提供對 {@code gpu_sessions} 集合的查詢；
 * 狀態轉移等條件式更新由 {@link SessionStore} 負責。
 */
public interface GpuSessionRepository extends MongoRepository<GpuSession, String> {

    /**
     * 分頁查詢用戶的 Session，新的在前。
     *
     * @param userId 用戶 ID
     * @param pageable 分頁參數
     * @return 分頁結果
     */
    Page<GpuSession> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
}
