package io.github.samzhu.keeper.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.SessionStatus;
import io.github.samzhu.keeper.document.TerminationReason;

/**
 * Session 條件式更新與查詢。
 *
 * <p>所有狀態轉移都使用 {@code findAndModify}，以目前狀態作為查詢條件：
 * <ul>
 *   <li>條件不符（已被其他執行緒改變）時回傳 {@link Optional#empty()}</li>
 *   <li>成功時回傳更新後的文件</li>
 *   <li>每次轉移都會更新 {@code updatedAt}</li>
 * </ul>
 *
 * <p>使用者終止與殭屍回收同時發生時，只有一方的條件式更新會成功。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/template-crud-operations.html">MongoTemplate CRUD Operations</a>
 */
@Repository
public class SessionStore {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    public SessionStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    // ========== 狀態轉移 ==========

    /**
     * 單純的狀態轉移，不附帶其他欄位。
     *
     * @param sessionId Session ID
     * @param from 允許的來源狀態
     * @param to 目標狀態
     * @param now 目前時間
     * @return 更新後的 Session，條件不符時為 empty
     */
    public Optional<GpuSession> transition(String sessionId, Set<SessionStatus> from, SessionStatus to, Instant now) {
        return modify(sessionId, from, statusUpdate(to, now));
    }

    /**
     * provisioning → ready，寫入供應商資訊並設定計費起點。
     */
    public Optional<GpuSession> markReady(String sessionId, String provider, String instanceId,
            String accessUrl, Instant now) {
        Update update = statusUpdate(SessionStatus.READY, now)
            .set("provider", provider)
            .set("providerInstanceId", instanceId)
            .set("accessUrl", accessUrl)
            .set("startedAt", now);
        return modify(sessionId, Set.of(SessionStatus.PROVISIONING), update);
    }

    /**
     * active → paused。
     */
    public Optional<GpuSession> markPaused(String sessionId, Instant now) {
        Update update = statusUpdate(SessionStatus.PAUSED, now).set("pausedAt", now);
        return modify(sessionId, Set.of(SessionStatus.ACTIVE), update);
    }

    /**
     * paused → active，累加暫停秒數。
     *
     * @param pausedSeconds 本次暫停的秒數
     */
    public Optional<GpuSession> markResumed(String sessionId, long pausedSeconds, Instant now) {
        Update update = statusUpdate(SessionStatus.ACTIVE, now)
            .inc("pausedSeconds", pausedSeconds)
            .unset("pausedAt");
        return modify(sessionId, Set.of(SessionStatus.PAUSED), update);
    }

    /**
     * 轉為 error（不計費的終止狀態）。
     */
    public Optional<GpuSession> markError(String sessionId, Set<SessionStatus> from,
            TerminationReason reason, String message, Instant now) {
        Update update = statusUpdate(SessionStatus.ERROR, now)
            .set("terminationReason", reason.code())
            .set("errorMessage", message)
            .set("terminatedAt", now);
        return modify(sessionId, from, update);
    }

    /**
     * 轉為 terminated 並一次寫入結算欄位。
     *
     * <p>以讀取時的狀態為條件，確保結算依據的暫停時間沒有在中途改變。
     *
     * @param expected 讀取時的狀態
     * @param pausedSeconds 最終累計暫停秒數
     * @param totalMinutes 計費分鐘數
     * @param totalCostCents 費用 (美分)
     */
    public Optional<GpuSession> markTerminated(String sessionId, SessionStatus expected, TerminationReason reason,
            long pausedSeconds, long totalMinutes, long totalCostCents, Instant now) {
        Update update = terminatedUpdate(reason, pausedSeconds, totalMinutes, totalCostCents, now);
        return modify(sessionId, Set.of(expected), update);
    }

    /**
     * 與 {@link #markTerminated} 相同，但額外要求最後活動早於 {@code staleBefore}。
     *
     * <p>殭屍回收使用：選出候選後若收到新的心跳，更新不會成功。
     */
    public Optional<GpuSession> markTerminatedIfStale(String sessionId, SessionStatus expected, Instant staleBefore,
            TerminationReason reason, long pausedSeconds, long totalMinutes, long totalCostCents, Instant now) {
        Query query = Query.query(Criteria.where("_id").is(sessionId)
            .and("status").is(expected.code())
            .and("updatedAt").lt(staleBefore));
        Update update = terminatedUpdate(reason, pausedSeconds, totalMinutes, totalCostCents, now);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, GpuSession.class));
    }

    /**
     * 記錄活動（心跳），只作用於非終止狀態的 Session。
     *
     * @return true 表示有更新
     */
    public boolean touch(String sessionId, Instant now) {
        Query query = Query.query(Criteria.where("_id").is(sessionId)
            .and("status").in(SessionStatus.codes(SessionStatus.OCCUPYING)));
        return mongoTemplate.updateFirst(query, Update.update("updatedAt", now), GpuSession.class)
            .getModifiedCount() > 0;
    }

    // ========== 查詢 ==========

    /**
     * 查詢殭屍候選：狀態為 provisioning/ready/active 且最後活動早於 cutoff。
     *
     * @param cutoff 無活動門檻時間
     * @return 候選 Session，最久未活動的在前
     */
    public List<GpuSession> findZombieCandidates(Instant cutoff) {
        Query query = Query.query(Criteria.where("status").in(SessionStatus.codes(SessionStatus.ZOMBIE_CANDIDATES))
                .and("updatedAt").lt(cutoff))
            .with(Sort.by(Sort.Direction.ASC, "updatedAt"));
        return mongoTemplate.find(query, GpuSession.class);
    }

    /**
     * 計算用戶佔用配額的 Session 數量。
     */
    public long countOccupying(String userId) {
        Query query = Query.query(Criteria.where("userId").is(userId)
            .and("status").in(SessionStatus.codes(SessionStatus.OCCUPYING)));
        return mongoTemplate.count(query, GpuSession.class);
    }

    /**
     * 查詢用戶在指定時間之後建立的 Session（配額用量計算）。
     */
    public List<GpuSession> findCreatedSince(String userId, Instant since) {
        Query query = Query.query(Criteria.where("userId").is(userId).and("createdAt").gte(since));
        return mongoTemplate.find(query, GpuSession.class);
    }

    private Optional<GpuSession> modify(String sessionId, Set<SessionStatus> from, Update update) {
        Query query = Query.query(Criteria.where("_id").is(sessionId)
            .and("status").in(SessionStatus.codes(from)));
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, GpuSession.class));
    }

    private static Update terminatedUpdate(TerminationReason reason, long pausedSeconds,
            long totalMinutes, long totalCostCents, Instant now) {
        return statusUpdate(SessionStatus.TERMINATED, now)
            .set("terminationReason", reason.code())
            .set("terminatedAt", now)
            .set("pausedSeconds", pausedSeconds)
            .set("totalMinutes", totalMinutes)
            .set("totalCostCents", totalCostCents)
            .unset("pausedAt");
    }

    private static Update statusUpdate(SessionStatus to, Instant now) {
        return Update.update("status", to.code()).set("updatedAt", now);
    }
}
