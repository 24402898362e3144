package io.github.samzhu.keeper.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.GpuTierConfig;
import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.SessionStatus;
import io.github.samzhu.keeper.document.TerminationReason;
import io.github.samzhu.keeper.document.UserAccount;
import io.github.samzhu.keeper.dto.api.CreateSessionRequest;
import io.github.samzhu.keeper.dto.api.QuotaDecision;
import io.github.samzhu.keeper.exception.AccountNotFoundException;
import io.github.samzhu.keeper.exception.DependencyUnavailableException;
import io.github.samzhu.keeper.exception.InvalidSessionRequestException;
import io.github.samzhu.keeper.exception.InvalidSessionTransitionException;
import io.github.samzhu.keeper.exception.NoCapacityException;
import io.github.samzhu.keeper.exception.QuotaExceededException;
import io.github.samzhu.keeper.exception.SessionNotFoundException;
import io.github.samzhu.keeper.provider.GpuProvider;
import io.github.samzhu.keeper.provider.ProviderHealthMonitor;
import io.github.samzhu.keeper.provider.ProviderHealthRecord;
import io.github.samzhu.keeper.provider.ProviderRegistry;
import io.github.samzhu.keeper.provider.ProvisionRequest;
import io.github.samzhu.keeper.provider.ProvisionedInstance;
import io.github.samzhu.keeper.repository.GpuSessionRepository;
import io.github.samzhu.keeper.repository.SessionStore;
import io.github.samzhu.keeper.repository.UserAccountRepository;
import io.github.samzhu.keeper.resilience.CircuitBreakerRegistry;
import io.github.samzhu.keeper.service.BillingService.Settlement;

/**
 * GPU Session 生命週期服務。
 *
 * <p>建立流程：
 * <pre>
 * 配額檢查 → pending → provisioning → 依健康排序逐一嘗試供應商 (經斷路器)
 *                                      ├─ 成功 → ready (startedAt = now)
 *                                      └─ 全部失敗 → error (provider_failure)
 * </pre>
 *
 * <p>終止流程：
 * <ol>
 *   <li>以讀取時的狀態為條件寫入 terminated 與結算值（已終止則直接回傳）</li>
 *   <li>寫入扣款交易並扣除餘額</li>
 *   <li>背景停止供應商實例，失敗只記錄日誌</li>
 *   <li>推播狀態改變</li>
 * </ol>
 *
 * <p>所有推播都在資料庫更新成功之後。
 */
@Service
public class SessionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);

    private static final int MAX_TERMINATE_ATTEMPTS = 5;

    private final GpuSessionRepository sessionRepository;
    private final SessionStore sessionStore;
    private final UserAccountRepository userAccountRepository;
    private final QuotaService quotaService;
    private final BillingService billingService;
    private final ProviderHealthMonitor healthMonitor;
    private final ProviderRegistry providerRegistry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final SessionEventBroadcaster broadcaster;
    private final Map<String, GpuTierConfig> gpuTiers;
    private final Clock clock;
    private final Executor executor;

    public SessionLifecycleService(
            GpuSessionRepository sessionRepository,
            SessionStore sessionStore,
            UserAccountRepository userAccountRepository,
            QuotaService quotaService,
            BillingService billingService,
            ProviderHealthMonitor healthMonitor,
            ProviderRegistry providerRegistry,
            CircuitBreakerRegistry circuitBreakers,
            SessionEventBroadcaster broadcaster,
            KeeperProperties properties,
            Clock clock,
            @Qualifier("backgroundExecutor") Executor executor) {
        this.sessionRepository = sessionRepository;
        this.sessionStore = sessionStore;
        this.userAccountRepository = userAccountRepository;
        this.quotaService = quotaService;
        this.billingService = billingService;
        this.healthMonitor = healthMonitor;
        this.providerRegistry = providerRegistry;
        this.circuitBreakers = circuitBreakers;
        this.broadcaster = broadcaster;
        this.gpuTiers = properties.gpuTiers();
        this.clock = clock;
        this.executor = executor;
    }

    // ========== 建立與開機 ==========

    /**
     * 建立 Session 並立即開機。
     *
     * @param userId 用戶 ID
     * @param request 建立請求
     * @return ready 狀態的 Session
     * @throws AccountNotFoundException 帳戶不存在
     * @throws QuotaExceededException 配額不足
     * @throws InvalidSessionRequestException 未知的 GPU 等級或型號
     * @throws NoCapacityException 所有供應商都無法開機
     */
    public GpuSession createSession(String userId, CreateSessionRequest request) {
        UserAccount account = userAccountRepository.findByUserId(userId)
            .orElseThrow(() -> new AccountNotFoundException(userId));

        QuotaDecision decision = quotaService.checkSessionAllowed(userId, account.tier());
        if (!decision.allowed()) {
            throw new QuotaExceededException(userId, decision.violation(), decision.reason());
        }

        GpuTierConfig gpuTier = gpuTiers.get(request.tier());
        if (gpuTier == null) {
            throw new InvalidSessionRequestException("tier", "Unknown GPU tier: " + request.tier());
        }
        String gpuType = request.gpuType() != null ? request.gpuType() : gpuTier.defaultGpuType();
        if (gpuTier.gpuOptions() != null && !gpuTier.gpuOptions().contains(gpuType)) {
            throw new InvalidSessionRequestException("gpuType",
                String.format("GPU type '%s' is not offered on %s tier", gpuType, request.tier()));
        }

        GpuSession session = sessionRepository.save(GpuSession.create(
            userId,
            request.type() != null ? request.type() : GpuSession.TYPE_BURST,
            request.tier(),
            gpuType,
            request.gpuCount() != null ? request.gpuCount() : 1,
            request.modelId(),
            gpuTier.pricePerMinuteCents(),
            clock.instant()
        ));
        log.info("Session created: id={}, userId={}, tier={}, gpu={}, price={}/min",
            session.id(), userId, request.tier(), gpuType, gpuTier.pricePerMinuteCents());

        return provisionSession(session.id());
    }

    /**
     * pending → provisioning → ready，依健康排序逐一嘗試供應商。
     *
     * @param sessionId Session ID
     * @return ready 狀態的 Session
     * @throws NoCapacityException 沒有可用供應商或全部失敗，Session 已轉為 error
     */
    public GpuSession provisionSession(String sessionId) {
        GpuSession session = sessionStore.transition(
                sessionId, Set.of(SessionStatus.PENDING), SessionStatus.PROVISIONING, clock.instant())
            .orElseThrow(() -> rejectedTransition(sessionId, SessionStatus.PROVISIONING));
        broadcaster.broadcastStatusChange(sessionId, session.status(), null, "Provisioning GPU instance");

        ProvisionRequest request = new ProvisionRequest(
            sessionId, session.tier(), session.gpuType(), session.gpuCount(), session.modelId());
        List<String> attempted = new ArrayList<>();

        for (ProviderHealthRecord candidate : healthMonitor.getRankedProviders()) {
            Optional<GpuProvider> provider = providerRegistry.get(candidate.provider());
            if (provider.isEmpty()) {
                continue;
            }
            attempted.add(candidate.provider());

            ProvisionedInstance instance;
            try {
                instance = circuitBreakers.get(candidate.provider())
                    .execute(() -> provider.get().provision(request));
            } catch (DependencyUnavailableException e) {
                log.warn("Provisioning failed, trying next provider: sessionId={}, provider={}, rejected={}, error={}",
                    sessionId, candidate.provider(), e.isRejected(), e.getMessage());
                continue;
            }

            Optional<GpuSession> ready = sessionStore.markReady(
                sessionId, instance.provider(), instance.instanceId(), instance.accessUrl(), clock.instant());
            if (ready.isEmpty()) {
                // 開機期間已被終止
                log.warn("Session left provisioning during boot, stopping instance: sessionId={}, instanceId={}",
                    sessionId, instance.instanceId());
                stopInstanceAsync(sessionId, instance.provider(), instance.instanceId());
                return getSession(sessionId);
            }

            log.info("Session ready: id={}, provider={}, instanceId={}",
                sessionId, instance.provider(), instance.instanceId());
            broadcaster.broadcastStatusChange(sessionId, ready.get().status(), null, "GPU instance is ready");
            return ready.get();
        }

        String message = attempted.isEmpty()
            ? "No healthy GPU provider available"
            : "All providers failed: " + String.join(", ", attempted);
        sessionStore.markError(sessionId, Set.of(SessionStatus.PROVISIONING),
                TerminationReason.PROVIDER_FAILURE, message, clock.instant())
            .ifPresent(failed -> broadcaster.broadcastStatusChange(
                sessionId, failed.status(), TerminationReason.PROVIDER_FAILURE.code(), message));
        log.error("Session provisioning failed: id={}, attempted={}", sessionId, attempted);
        throw new NoCapacityException(sessionId, attempted);
    }

    // ========== 執行中狀態 ==========

    /**
     * ready|paused → active。從 paused 恢復時累加暫停時間。
     */
    public GpuSession startSession(String sessionId) {
        GpuSession session = getSession(sessionId);
        Instant now = clock.instant();

        Optional<GpuSession> started = switch (session.statusValue()) {
            case READY -> sessionStore.transition(sessionId, Set.of(SessionStatus.READY), SessionStatus.ACTIVE, now);
            case PAUSED -> sessionStore.markResumed(sessionId, session.pausedSecondsAt(now) - session.pausedSeconds(), now);
            default -> throw new InvalidSessionTransitionException(
                sessionId, session.status(), SessionStatus.ACTIVE.code());
        };

        GpuSession active = started.orElseThrow(() -> rejectedTransition(sessionId, SessionStatus.ACTIVE));
        log.info("Session active: id={}", sessionId);
        broadcaster.broadcastStatusChange(sessionId, active.status(), null, null);
        return active;
    }

    /**
     * active → paused，只允許 vpn Session。
     */
    public GpuSession pauseSession(String sessionId) {
        GpuSession session = getSession(sessionId);
        if (!session.isVpn()) {
            throw new InvalidSessionTransitionException(sessionId, session.status(),
                SessionStatus.PAUSED.code(), "only vpn sessions can be paused");
        }

        GpuSession paused = sessionStore.markPaused(sessionId, clock.instant())
            .orElseThrow(() -> rejectedTransition(sessionId, SessionStatus.PAUSED));
        log.info("Session paused: id={}", sessionId);
        broadcaster.broadcastStatusChange(sessionId, paused.status(), null, null);
        return paused;
    }

    /**
     * 記錄活動（心跳），終止狀態的 Session 忽略。
     *
     * @return true 表示有更新
     */
    public boolean recordActivity(String sessionId) {
        boolean touched = sessionStore.touch(sessionId, clock.instant());
        if (!touched) {
            log.debug("Activity ignored for missing or terminal session: id={}", sessionId);
        }
        return touched;
    }

    // ========== 終止 ==========

    /**
     * 終止 Session 並結算。已終止的 Session 直接回傳，不重複結算。
     *
     * @param sessionId Session ID
     * @param reason 終止原因
     * @return terminated 狀態的 Session
     * @throws InvalidSessionTransitionException Session 為 error 狀態
     */
    public GpuSession terminateSession(String sessionId, TerminationReason reason) {
        for (int attempt = 0; attempt < MAX_TERMINATE_ATTEMPTS; attempt++) {
            GpuSession session = getSession(sessionId);
            SessionStatus status = session.statusValue();
            if (status == SessionStatus.TERMINATED) {
                log.debug("Session already terminated: id={}", sessionId);
                return session;
            }
            if (!status.canTransitionTo(SessionStatus.TERMINATED)) {
                throw new InvalidSessionTransitionException(sessionId, session.status(), SessionStatus.TERMINATED.code());
            }

            Instant now = clock.instant();
            Settlement settlement = billingService.computeSettlement(session, now);
            Optional<GpuSession> terminated = sessionStore.markTerminated(sessionId, status, reason,
                settlement.pausedSeconds(), settlement.minutes(), settlement.costCents(), now);
            if (terminated.isPresent()) {
                log.info("Session terminated: id={}, reason={}, minutes={}, cost={}",
                    sessionId, reason.code(), settlement.minutes(), settlement.costCents());
                afterTermination(terminated.get());
                return terminated.get();
            }
            log.debug("Session changed during termination, retrying: id={}, attempt={}", sessionId, attempt + 1);
        }
        throw new InvalidSessionTransitionException(sessionId, getSession(sessionId).status(),
            SessionStatus.TERMINATED.code(), "concurrent updates");
    }

    /**
     * 殭屍回收：僅在 Session 狀態未變且仍無活動時終止。
     *
     * @param candidate 選出的候選 Session
     * @param staleBefore 無活動門檻時間
     * @return 終止後的 Session；期間有狀態改變或新活動時為 empty
     */
    public Optional<GpuSession> terminateIfStale(GpuSession candidate, Instant staleBefore) {
        Instant now = clock.instant();
        Settlement settlement = billingService.computeSettlement(candidate, now);
        Optional<GpuSession> terminated = sessionStore.markTerminatedIfStale(candidate.id(), candidate.statusValue(),
            staleBefore, TerminationReason.ZOMBIE_CLEANUP, settlement.pausedSeconds(), settlement.minutes(),
            settlement.costCents(), now);
        terminated.ifPresent(this::afterTermination);
        return terminated;
    }

    /**
     * 分頁列出用戶的 Session，新的在前。
     */
    public Page<GpuSession> listSessions(String userId, Pageable pageable) {
        return sessionRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable);
    }

    public GpuSession getSession(String sessionId) {
        return sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * 終止後續處理，任何失敗都不會往上拋。
     */
    private void afterTermination(GpuSession session) {
        try {
            billingService.settleBilling(session);
        } catch (Exception e) {
            log.error("Settlement failed after termination: id={}, userId={}, cost={}",
                session.id(), session.userId(), session.totalCostCents(), e);
        }

        stopInstanceAsync(session.id(), session.provider(), session.providerInstanceId());
        broadcaster.broadcastStatusChange(session.id(), session.status(), session.terminationReason(),
            "Session terminated");
    }

    /**
     * 在背景經斷路器停止供應商實例，失敗只記錄日誌。
     */
    private void stopInstanceAsync(String sessionId, String providerName, String instanceId) {
        if (providerName == null || instanceId == null) {
            return;
        }
        Optional<GpuProvider> provider = providerRegistry.get(providerName);
        if (provider.isEmpty()) {
            log.error("Cannot stop instance, provider not configured: sessionId={}, provider={}, instanceId={}",
                sessionId, providerName, instanceId);
            return;
        }

        try {
            executor.execute(() -> {
                try {
                    circuitBreakers.get(providerName).run(() -> provider.get().terminate(instanceId));
                    log.info("Provider instance stopped: sessionId={}, provider={}, instanceId={}",
                        sessionId, providerName, instanceId);
                } catch (Exception e) {
                    log.error("Provider stop failed, instance may still be running: sessionId={}, provider={}, instanceId={}",
                        sessionId, providerName, instanceId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Provider stop rejected by executor: sessionId={}, provider={}, instanceId={}",
                sessionId, providerName, instanceId, e);
        }
    }

    private InvalidSessionTransitionException rejectedTransition(String sessionId, SessionStatus target) {
        return new InvalidSessionTransitionException(sessionId, getSession(sessionId).status(), target.code());
    }
}
