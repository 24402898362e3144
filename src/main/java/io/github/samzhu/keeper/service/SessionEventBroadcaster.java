package io.github.samzhu.keeper.service;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.dto.SessionMetrics;

/**
 * Session 即時事件推播 (Server-Sent Events)。
 *
 * <p>事件類型：
 * <ul>
 *   <li>{@code connected} - 訂閱成功時立即送出</li>
 *   <li>{@code status} - 狀態改變 {sessionId, status, reason?, message?, timestamp}</li>
 *   <li>{@code metrics} - 執行中指標 {sessionId, elapsedMinutes, currentCost, ..., timestamp}</li>
 *   <li>{@code : heartbeat} - 註解行，維持連線不被代理中斷</li>
 * </ul>
 *
 * <p>沒有訂閱者時不做任何事；寫入失敗的連線會被移除，不影響其他連線。
 * 不緩衝也不重播，斷線期間的事件會遺失。
 *
 * @see <a href="https://docs.spring.io/spring-framework/reference/web/webmvc/mvc-ann-async.html#mvc-ann-async-sse">Spring MVC SSE</a>
 */
@Service
public class SessionEventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SessionEventBroadcaster.class);

    private final Map<String, Set<SseEmitter>> connections = new ConcurrentHashMap<>();
    private final long emitterTimeoutMs;
    private final Clock clock;

    public SessionEventBroadcaster(KeeperProperties properties, Clock clock) {
        this.emitterTimeoutMs = properties.stream().emitterTimeoutMs();
        this.clock = clock;
    }

    /**
     * 訂閱指定 Session 的事件。
     *
     * @param sessionId Session ID
     * @return 已註冊的 SseEmitter
     */
    public SseEmitter subscribe(String sessionId) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        emitter.onCompletion(() -> unsubscribe(sessionId, emitter));
        emitter.onTimeout(() -> unsubscribe(sessionId, emitter));
        emitter.onError(e -> unsubscribe(sessionId, emitter));
        register(sessionId, emitter);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        payload.put("message", "Connected to session stream");
        send(sessionId, emitter, SseEmitter.event().name("connected").data(payload, MediaType.APPLICATION_JSON));
        return emitter;
    }

    void register(String sessionId, SseEmitter emitter) {
        Set<SseEmitter> set = connections.computeIfAbsent(sessionId, key -> ConcurrentHashMap.newKeySet());
        set.add(emitter);
        log.debug("SSE client subscribed: sessionId={}, connections={}", sessionId, set.size());
    }

    void unsubscribe(String sessionId, SseEmitter emitter) {
        connections.computeIfPresent(sessionId, (key, set) -> {
            set.remove(emitter);
            return set.isEmpty() ? null : set;
        });
    }

    /**
     * 推播狀態改變。
     *
     * @param sessionId Session ID
     * @param status 新狀態
     * @param reason 原因，可為 null
     * @param message 說明，可為 null
     */
    public void broadcastStatusChange(String sessionId, String status, String reason, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        payload.put("status", status);
        if (reason != null) {
            payload.put("reason", reason);
        }
        if (message != null) {
            payload.put("message", message);
        }
        payload.put("timestamp", clock.instant().toString());
        broadcast(sessionId, "status", payload);
    }

    /**
     * 推播執行中指標。
     *
     * @param sessionId Session ID
     * @param metrics 指標
     */
    public void broadcastMetrics(String sessionId, SessionMetrics metrics) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        payload.put("elapsedMinutes", metrics.elapsedMinutes());
        payload.put("currentCost", metrics.currentCostCents());
        if (metrics.gpuUtilization() != null) {
            payload.put("gpuUtilization", metrics.gpuUtilization());
        }
        if (metrics.memoryUsedMb() != null) {
            payload.put("memoryUsed", metrics.memoryUsedMb());
        }
        if (metrics.temperature() != null) {
            payload.put("temperature", metrics.temperature());
        }
        payload.put("timestamp", clock.instant().toString());
        broadcast(sessionId, "metrics", payload);
    }

    /**
     * 對所有連線送出心跳註解。
     */
    @Scheduled(fixedRateString = "${keeper.stream.heartbeat-interval-ms:30000}",
        initialDelayString = "${keeper.stream.heartbeat-interval-ms:30000}")
    public void sendHeartbeats() {
        connections.forEach((sessionId, set) -> {
            for (SseEmitter emitter : set) {
                send(sessionId, emitter, SseEmitter.event().comment("heartbeat"));
            }
        });
    }

    /**
     * 目前所有 Session 的連線總數。
     */
    public int getConnectionCount() {
        return connections.values().stream().mapToInt(Set::size).sum();
    }

    private void broadcast(String sessionId, String event, Map<String, Object> payload) {
        Set<SseEmitter> set = connections.get(sessionId);
        if (set == null || set.isEmpty()) {
            return;
        }
        for (SseEmitter emitter : set) {
            send(sessionId, emitter, SseEmitter.event().name(event).data(payload, MediaType.APPLICATION_JSON));
        }
    }

    private void send(String sessionId, SseEmitter emitter, SseEmitter.SseEventBuilder event) {
        try {
            emitter.send(event);
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE client dropped: sessionId={}, error={}", sessionId, e.getMessage());
            unsubscribe(sessionId, emitter);
        }
    }
}
