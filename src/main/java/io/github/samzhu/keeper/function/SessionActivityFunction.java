package io.github.samzhu.keeper.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.SessionStatus;
import io.github.samzhu.keeper.dto.SessionActivityData;
import io.github.samzhu.keeper.service.BillingService;
import io.github.samzhu.keeper.service.SessionEventBroadcaster;
import io.github.samzhu.keeper.service.SessionLifecycleService;

/**
 * GPU 實例活動事件消費者配置。
 *
 * <p>GPU 實例上的 agent 以 CloudEvents (Structured Mode) 定期回報使用率，
 * 事件的 {@code subject} 為 Session ID。每筆事件：
 * <ol>
 *   <li>更新 Session 的 {@code updatedAt}（心跳，避免被殭屍回收）</li>
 *   <li>計費中的 Session 推播 {@code metrics} 事件（已計費分鐘、目前費用、GPU 指標）</li>
 * </ol>
 *
 * <p>錯誤處理：不重新拋出例外，避免訊息重複投遞迴圈。
 *
 * <p>Binding name: {@code sessionActivityConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class SessionActivityFunction {

    private static final Logger log = LoggerFactory.getLogger(SessionActivityFunction.class);

    private final SessionLifecycleService lifecycleService;
    private final BillingService billingService;
    private final SessionEventBroadcaster broadcaster;

    public SessionActivityFunction(
            SessionLifecycleService lifecycleService,
            BillingService billingService,
            SessionEventBroadcaster broadcaster) {
        this.lifecycleService = lifecycleService;
        this.billingService = billingService;
        this.broadcaster = broadcaster;
    }

    /**
     * CloudEvents 活動事件消費者 Bean。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<SessionActivityData>> sessionActivityConsumer() {
        return message -> {
            try {
                SessionActivityData data = message.getPayload();
                String sessionId = data.sessionId() != null
                    ? data.sessionId()
                    : CloudEventMessageUtils.getSubject(message);

                log.debug("CloudEvent received: id={}, type={}, source={}, sessionId={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    CloudEventMessageUtils.getSource(message),
                    sessionId);

                if (sessionId == null) {
                    log.warn("Activity event without session id ignored: id={}", CloudEventMessageUtils.getId(message));
                    return;
                }

                if (!lifecycleService.recordActivity(sessionId)) {
                    return;
                }

                GpuSession session = lifecycleService.getSession(sessionId);
                SessionStatus status = session.statusValue();
                if (status == SessionStatus.READY || status == SessionStatus.ACTIVE) {
                    broadcaster.broadcastMetrics(sessionId, billingService.liveMetrics(
                        session, data.gpuUtilization(), data.memoryUsedMb(), data.temperature()));
                }
            } catch (Exception e) {
                log.error("Failed to process CloudEvent: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
                // 不重新拋出例外，避免訊息重複投遞
            }
        };
    }
}
