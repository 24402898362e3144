package io.github.samzhu.keeper.controller;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import io.github.samzhu.keeper.service.SessionEventBroadcaster;
import io.github.samzhu.keeper.service.SessionLifecycleService;

/**
 * Session 即時事件串流 (SSE)。
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionStreamController {

    private final SessionLifecycleService lifecycleService;
    private final SessionEventBroadcaster broadcaster;

    public SessionStreamController(SessionLifecycleService lifecycleService, SessionEventBroadcaster broadcaster) {
        this.lifecycleService = lifecycleService;
        this.broadcaster = broadcaster;
    }

    /**
     * 訂閱 Session 事件，Session 不存在時回傳 404。
     *
     * @param id Session ID
     * @return SseEmitter
     */
    @GetMapping(path = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String id) {
        lifecycleService.getSession(id);
        return broadcaster.subscribe(id);
    }
}
