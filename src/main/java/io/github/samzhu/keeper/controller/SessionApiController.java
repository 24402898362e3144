package io.github.samzhu.keeper.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.TerminationReason;
import io.github.samzhu.keeper.dto.api.CreateSessionRequest;
import io.github.samzhu.keeper.dto.api.SessionResponse;
import io.github.samzhu.keeper.exception.InvalidSessionRequestException;
import io.github.samzhu.keeper.service.SessionLifecycleService;

/**
 * Session 生命週期 API 控制器。
 *
 * <p>身分驗證由上游閘道處理，用戶 ID 以 {@code X-User-Id} header 傳入。
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionApiController {

    private static final Logger log = LoggerFactory.getLogger(SessionApiController.class);

    private final SessionLifecycleService lifecycleService;

    public SessionApiController(SessionLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    /**
     * 建立並開機 Session。
     *
     * @param userId 用戶 ID
     * @param request 建立請求
     * @return ready 狀態的 Session (201)
     */
    @PostMapping
    public ResponseEntity<SessionResponse> createSession(
            @RequestHeader("X-User-Id") String userId,
            @RequestBody @Validated CreateSessionRequest request) {

        log.info("Creating session: userId={}, type={}, tier={}", userId, request.type(), request.tier());

        GpuSession session = lifecycleService.createSession(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
    }

    /**
     * 分頁查詢用戶的 Session，新的在前。
     *
     * @param userId 用戶 ID
     * @param page 頁碼（從 0 開始）
     * @param size 每頁數量（最多 100）
     * @return Session 列表
     */
    @GetMapping
    public ResponseEntity<Page<SessionResponse>> listSessions(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        log.debug("Listing sessions: userId={}, page={}, size={}", userId, page, size);

        int effectiveSize = Math.min(Math.max(size, 1), 100);
        Page<SessionResponse> sessions = lifecycleService
            .listSessions(userId, PageRequest.of(Math.max(page, 0), effectiveSize))
            .map(SessionResponse::from);
        return ResponseEntity.ok(sessions);
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.from(lifecycleService.getSession(id)));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<SessionResponse> startSession(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.from(lifecycleService.startSession(id)));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<SessionResponse> pauseSession(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.from(lifecycleService.pauseSession(id)));
    }

    /**
     * 用戶端心跳，維持 Session 不被殭屍回收。
     *
     * @param id Session ID
     * @return accepted=false 表示 Session 不存在或已終止
     */
    @PostMapping("/{id}/heartbeat")
    public ResponseEntity<HeartbeatResult> heartbeat(@PathVariable String id) {
        return ResponseEntity.ok(new HeartbeatResult(id, lifecycleService.recordActivity(id)));
    }

    /**
     * 終止 Session。重複呼叫會回傳同一份結算結果。
     *
     * @param id Session ID
     * @param reason user 或 admin
     * @return terminated 狀態的 Session
     */
    @PostMapping("/{id}/terminate")
    public ResponseEntity<SessionResponse> terminateSession(
            @PathVariable String id,
            @RequestParam(defaultValue = "user") String reason) {

        TerminationReason terminationReason = switch (reason) {
            case "user" -> TerminationReason.USER;
            case "admin" -> TerminationReason.ADMIN;
            default -> throw new InvalidSessionRequestException("reason", "reason must be user or admin");
        };

        log.info("Terminating session: id={}, reason={}", id, reason);
        return ResponseEntity.ok(SessionResponse.from(lifecycleService.terminateSession(id, terminationReason)));
    }

    public record HeartbeatResult(String sessionId, boolean accepted) {}
}
