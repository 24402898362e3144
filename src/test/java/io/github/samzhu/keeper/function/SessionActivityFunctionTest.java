package io.github.samzhu.keeper.function;

import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.cloud.stream.binder.test.InputDestination;
import org.springframework.cloud.stream.binder.test.TestChannelBinderConfiguration;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.util.MimeTypeUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.GpuSessionFixtures;
import io.github.samzhu.keeper.document.SessionStatus;
import io.github.samzhu.keeper.dto.SessionActivityData;
import io.github.samzhu.keeper.dto.SessionMetrics;
import io.github.samzhu.keeper.service.BillingService;
import io.github.samzhu.keeper.service.SessionEventBroadcaster;
import io.github.samzhu.keeper.service.SessionLifecycleService;

/**
 * SessionActivityFunction 整合測試，使用 Spring Cloud Stream Test Binder。
 *
 * <p>發送端以 Structured Mode (application/cloudevents+json) 送出，
 * Spring Cloud Stream 解析後將 CloudEvent 屬性放在 header，data 放在 payload。
 * 此測試直接模擬解析後的訊息格式。
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/spring_integration_test_binder.html">Test Binder</a>
 */
class SessionActivityFunctionTest {

    private static ConfigurableApplicationContext context;
    private static InputDestination inputDestination;
    private static SessionLifecycleService mockLifecycleService;
    private static BillingService mockBillingService;
    private static SessionEventBroadcaster mockBroadcaster;
    private static ObjectMapper objectMapper;

    @BeforeAll
    static void setupContext() {
        mockLifecycleService = mock(SessionLifecycleService.class);
        mockBillingService = mock(BillingService.class);
        mockBroadcaster = mock(SessionEventBroadcaster.class);

        context = new SpringApplicationBuilder(
            TestChannelBinderConfiguration.getCompleteConfiguration(TestConfig.class))
            .web(WebApplicationType.NONE)
            .run(
                "--spring.cloud.function.definition=sessionActivityConsumer",
                "--spring.cloud.stream.default-binder=integration",
                "--spring.jmx.enabled=false"
            );

        inputDestination = context.getBean(InputDestination.class);
        objectMapper = context.getBean(ObjectMapper.class);
    }

    @AfterAll
    static void closeContext() {
        if (context != null) {
            context.close();
        }
    }

    @BeforeEach
    void resetMocks() {
        reset(mockLifecycleService, mockBillingService, mockBroadcaster);
    }

    @Test
    void shouldRecordActivityAndBroadcastMetrics() throws Exception {
        // Given: 執行中的 Session 回報 GPU 指標
        String sessionId = "session-" + UUID.randomUUID();
        GpuSession active = GpuSessionFixtures.running(sessionId, "user-1", GpuSession.TYPE_BURST,
            SessionStatus.ACTIVE, Instant.now().minusSeconds(300), Instant.now(), 1);
        SessionMetrics metrics = new SessionMetrics(5, 5, 87.5, 20480L, 71.0);
        when(mockLifecycleService.recordActivity(sessionId)).thenReturn(true);
        when(mockLifecycleService.getSession(sessionId)).thenReturn(active);
        when(mockBillingService.liveMetrics(active, 87.5, 20480L, 71.0)).thenReturn(metrics);

        SessionActivityData data = new SessionActivityData(sessionId, 87.5, 20480L, 71.0);

        // When
        inputDestination.send(cloudEvent(data, null));

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockBroadcaster).broadcastMetrics(sessionId, metrics));
        verify(mockLifecycleService).recordActivity(sessionId);
    }

    @Test
    void shouldFallBackToSubjectForSessionId() throws Exception {
        // Given: payload 未帶 sessionId
        String sessionId = "session-" + UUID.randomUUID();
        when(mockLifecycleService.recordActivity(sessionId)).thenReturn(false);

        SessionActivityData data = new SessionActivityData(null, 10.0, null, null);

        // When
        inputDestination.send(cloudEvent(data, sessionId));

        // Then: 以 subject 記錄活動；Session 不在計費中，不推播
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockLifecycleService).recordActivity(sessionId));
        verify(mockLifecycleService, never()).getSession(anyString());
        verify(mockBroadcaster, never()).broadcastMetrics(anyString(), any());
    }

    @Test
    void shouldNotBroadcastForPausedSession() throws Exception {
        // Given
        String sessionId = "session-" + UUID.randomUUID();
        GpuSession paused = GpuSessionFixtures.paused(sessionId, "user-1",
            Instant.now().minusSeconds(600), Instant.now().minusSeconds(60), 0, 1);
        when(mockLifecycleService.recordActivity(sessionId)).thenReturn(true);
        when(mockLifecycleService.getSession(sessionId)).thenReturn(paused);

        // When
        inputDestination.send(cloudEvent(new SessionActivityData(sessionId, 0.0, 0L, 40.0), null));

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockLifecycleService).getSession(sessionId));
        verify(mockBroadcaster, never()).broadcastMetrics(anyString(), any());
    }

    @Test
    void shouldSwallowProcessingErrors() throws Exception {
        // Given: 資料庫錯誤
        String failing = "session-" + UUID.randomUUID();
        when(mockLifecycleService.recordActivity(failing))
            .thenThrow(new IllegalStateException("store unavailable"));

        // When
        inputDestination.send(cloudEvent(new SessionActivityData(failing, 50.0, null, null), null));

        // Then: 後續訊息仍正常處理
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockLifecycleService).recordActivity(failing));

        String next = "session-" + UUID.randomUUID();
        inputDestination.send(cloudEvent(new SessionActivityData(next, 50.0, null, null), null));
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockLifecycleService).recordActivity(next));
    }

    private Message<byte[]> cloudEvent(SessionActivityData data, String subject) throws Exception {
        MessageBuilder<byte[]> builder = MessageBuilder.withPayload(objectMapper.writeValueAsBytes(data))
            .setHeader(MessageHeaders.CONTENT_TYPE, MimeTypeUtils.APPLICATION_JSON)
            .setHeader(CloudEventMessageUtils.ID, UUID.randomUUID().toString())
            .setHeader(CloudEventMessageUtils.SOURCE, URI.create("https://agent.example.com/gpu"))
            .setHeader(CloudEventMessageUtils.TYPE, "io.github.samzhu.keeper.activity.v1")
            .setHeader(CloudEventMessageUtils.TIME, OffsetDateTime.now())
            .setHeader(CloudEventMessageUtils.SPECVERSION, "1.0");
        if (subject != null) {
            builder.setHeader(CloudEventMessageUtils.SUBJECT, subject);
        }
        return builder.build();
    }

    @Configuration
    @EnableAutoConfiguration(exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class,
        MongoRepositoriesAutoConfiguration.class,
        RabbitAutoConfiguration.class
    })
    @Import(SessionActivityFunction.class)
    static class TestConfig {

        @Bean
        public SessionLifecycleService sessionLifecycleService() {
            return mockLifecycleService;
        }

        @Bean
        public BillingService billingService() {
            return mockBillingService;
        }

        @Bean
        public SessionEventBroadcaster sessionEventBroadcaster() {
            return mockBroadcaster;
        }
    }
}
