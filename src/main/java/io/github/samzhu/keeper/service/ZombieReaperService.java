package io.github.samzhu.keeper.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.ReaperConfig;
import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.dto.api.ReaperRunResponse;
import io.github.samzhu.keeper.repository.SessionStore;

/**
 * 殭屍 Session 回收服務。
 *
 * <p>定時（預設每 5 分鐘）執行，處理流程：
 * <ol>
 *   <li>查詢狀態為 provisioning/ready/active 且超過門檻（預設 30 分鐘）無活動的 Session</li>
 *   <li>逐一以條件式更新終止 (reason = zombie_cleanup)，並依目前時間重新計算費用</li>
 *   <li>寫入扣款交易、背景停止供應商實例、推播狀態</li>
 * </ol>
 *
 * <p>單一 Session 失敗不影響其他 Session；資料庫不可用時略過本次執行。
 * 已終止的 Session 不會再被選出，重複執行是安全的。
 *
 * @see SessionLifecycleService#terminateIfStale(GpuSession, Instant)
 */
@Service
public class ZombieReaperService {

    private static final Logger log = LoggerFactory.getLogger(ZombieReaperService.class);

    private final SessionStore sessionStore;
    private final SessionLifecycleService lifecycleService;
    private final ReaperConfig config;
    private final Clock clock;

    public ZombieReaperService(
            SessionStore sessionStore,
            SessionLifecycleService lifecycleService,
            KeeperProperties properties,
            Clock clock) {
        this.sessionStore = sessionStore;
        this.lifecycleService = lifecycleService;
        this.config = properties.reaper();
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (config.runOnStartup()) {
            reapZombies();
        }
    }

    /**
     * 定時回收任務。
     */
    @Scheduled(cron = "${keeper.reaper.scan-cron:0 0/5 * * * *}")
    public void reapZombies() {
        runOnce();
    }

    /**
     * 執行一次回收（排程、啟動與管理介面共用）。
     *
     * @return 執行結果
     */
    public ReaperRunResponse runOnce() {
        long startTime = System.currentTimeMillis();
        Duration threshold = config.inactivityThreshold();
        Instant cutoff = clock.instant().minus(threshold);

        List<GpuSession> candidates;
        try {
            candidates = sessionStore.findZombieCandidates(cutoff);
        } catch (DataAccessException e) {
            log.error("Zombie scan skipped, session store unavailable: {}", e.getMessage(), e);
            return new ReaperRunResponse(0, 0, 0, System.currentTimeMillis() - startTime);
        }

        if (candidates.isEmpty()) {
            log.debug("No zombie sessions found (threshold {})", threshold);
            return new ReaperRunResponse(0, 0, 0, System.currentTimeMillis() - startTime);
        }

        log.warn("Found {} zombie sessions inactive for more than {}", candidates.size(), threshold);

        int terminatedCount = 0;
        int failCount = 0;

        for (GpuSession session : candidates) {
            try {
                if (lifecycleService.terminateIfStale(session, cutoff).isPresent()) {
                    terminatedCount++;
                    log.warn("Zombie session terminated: id={}, userId={}, status={}, lastActivity={}",
                        session.id(), session.userId(), session.status(), session.updatedAt());
                } else {
                    log.debug("Zombie candidate changed before cleanup: id={}", session.id());
                }
            } catch (Exception e) {
                failCount++;
                log.error("Failed to clean up zombie session {}: {}", session.id(), e.getMessage(), e);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Zombie cleanup completed: {} of {} sessions terminated in {}ms, failed: {}",
            terminatedCount, candidates.size(), duration, failCount);
        return new ReaperRunResponse(candidates.size(), terminatedCount, failCount, duration);
    }
}
