package io.github.samzhu.tokenmeter.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
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

import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.dto.TokenUsageMessage;
import io.github.samzhu.tokenmeter.dto.UsageRecord;
import io.github.samzhu.tokenmeter.service.BillingContextService;
import io.github.samzhu.tokenmeter.service.UsageRecorderService;

/**
 * 以 Spring Cloud Stream Test Binder 驗證用量事件消費者。
 *
 * <p>發布端使用 Structured Mode，Spring Cloud Stream 解析後 CloudEvent attributes 放在 headers，
 * data 放在 payload。此測試直接模擬解析後的訊息格式。
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/spring_integration_test_binder.html">Test Binder</a>
 */
class UsageEventFunctionTest {

    private static ConfigurableApplicationContext context;
    private static InputDestination inputDestination;
    private static BillingContextService mockContextService;
    private static UsageRecorderService mockRecorderService;
    private static ObjectMapper objectMapper;

    @BeforeAll
    static void setupContext() {
        mockContextService = mock(BillingContextService.class);
        mockRecorderService = mock(UsageRecorderService.class);

        context = new SpringApplicationBuilder(
            TestChannelBinderConfiguration.getCompleteConfiguration(TestConfig.class))
            .web(WebApplicationType.NONE)
            .run(
                "--spring.cloud.function.definition=tokenUsageConsumer",
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
        reset(mockContextService, mockRecorderService);
        when(mockContextService.resolve(anyString()))
            .thenAnswer(inv -> new BillingContext(inv.getArgument(0), "org-1", "team-1"));
    }

    @Test
    void shouldRecordSuccessfulUsage() throws Exception {
        // Given
        TokenUsageMessage data = new TokenUsageMessage(
            "user-abc-123", "/api/refine", 842, "gemini-2.5-flash", "refine", "req-123", "success");

        // When
        inputDestination.send(cloudEvent(data));

        // Then
        ArgumentCaptor<UsageRecord> recordCaptor = ArgumentCaptor.forClass(UsageRecord.class);
        ArgumentCaptor<BillingContext> contextCaptor = ArgumentCaptor.forClass(BillingContext.class);

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockRecorderService, atLeastOnce()).record(recordCaptor.capture(), contextCaptor.capture());
        });

        UsageRecord captured = recordCaptor.getValue();
        assertThat(captured.endpoint()).isEqualTo("/api/refine");
        assertThat(captured.tokensUsed()).isEqualTo(842);
        assertThat(captured.modelUsed()).isEqualTo("gemini-2.5-flash");
        assertThat(captured.featureUsed()).isEqualTo("refine");
        assertThat(captured.requestId()).isEqualTo("req-123");
        assertThat(contextCaptor.getValue().organizationId()).isEqualTo("org-1");
        assertThat(contextCaptor.getValue().teamId()).isEqualTo("team-1");
    }

    @Test
    void shouldTreatMissingStatusAsSuccess() throws Exception {
        TokenUsageMessage data = new TokenUsageMessage(
            "user-no-status", "/api/chat", 120, null, "chat", null, null);

        inputDestination.send(cloudEvent(data));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockRecorderService, atLeastOnce()).record(any(UsageRecord.class), any(BillingContext.class));
        });
        verify(mockRecorderService, never()).recordFailure(any(), any(), any(), any(), any());
    }

    @Test
    void shouldRecordFailureForErrorStatus() throws Exception {
        // Given: AI 呼叫失敗
        TokenUsageMessage data = new TokenUsageMessage(
            "error-user", "/api/assess", 0, "gemini-2.5-flash-lite", "assess", "req-err", "error");

        // When
        inputDestination.send(cloudEvent(data));

        // Then: 改記固定失敗 Token
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockRecorderService, atLeastOnce()).recordFailure(
                eq("/api/assess"), eq("gemini-2.5-flash-lite"), eq("assess"), eq("req-err"),
                any(BillingContext.class));
        });
        verify(mockRecorderService, never()).record(any(), any());
    }

    @Test
    void shouldDropEventWithoutUser() throws Exception {
        // Given: 先送出沒有 user_id 的事件，再送出正常事件
        inputDestination.send(cloudEvent(new TokenUsageMessage(
            " ", "/api/chat", 10, null, "chat", "req-anon", "success")));
        inputDestination.send(cloudEvent(new TokenUsageMessage(
            "user-after", "/api/chat", 10, null, "chat", "req-after", "success")));

        // Then: 只有正常事件被記錄
        ArgumentCaptor<UsageRecord> recordCaptor = ArgumentCaptor.forClass(UsageRecord.class);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockRecorderService, times(1)).record(recordCaptor.capture(), any(BillingContext.class));
        });
        assertThat(recordCaptor.getValue().requestId()).isEqualTo("req-after");
        verify(mockContextService, never()).resolve(" ");
    }

    @Test
    void shouldKeepConsumingAfterRecorderFailure() throws Exception {
        // Given: 第一筆記錄時拋出例外
        when(mockRecorderService.record(any(UsageRecord.class), any(BillingContext.class)))
            .thenThrow(new IllegalStateException("unexpected"))
            .thenReturn(Optional.empty());

        // When
        inputDestination.send(cloudEvent(new TokenUsageMessage(
            "user-1", "/api/chat", 10, null, "chat", "req-boom", "success")));
        inputDestination.send(cloudEvent(new TokenUsageMessage(
            "user-1", "/api/chat", 20, null, "chat", "req-ok", "success")));

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockRecorderService, times(2)).record(any(UsageRecord.class), any(BillingContext.class));
        });
    }

    private Message<byte[]> cloudEvent(TokenUsageMessage data) throws Exception {
        return MessageBuilder.withPayload(objectMapper.writeValueAsBytes(data))
            .setHeader(MessageHeaders.CONTENT_TYPE, MimeTypeUtils.APPLICATION_JSON)
            .setHeader(CloudEventMessageUtils.ID, UUID.randomUUID().toString())
            .setHeader(CloudEventMessageUtils.SOURCE, URI.create("https://ticket-ai.example.com/api"))
            .setHeader(CloudEventMessageUtils.TYPE, "io.github.samzhu.tokenmeter.usage.v1")
            .setHeader(CloudEventMessageUtils.SUBJECT, data.userId())
            .setHeader(CloudEventMessageUtils.TIME, OffsetDateTime.now())
            .setHeader(CloudEventMessageUtils.SPECVERSION, "1.0")
            .build();
    }

    @Configuration
    @EnableAutoConfiguration(exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class
    })
    @Import(UsageEventFunction.class)
    static class TestConfig {

        @Bean
        public BillingContextService billingContextService() {
            return mockContextService;
        }

        @Bean
        public UsageRecorderService usageRecorderService() {
            return mockRecorderService;
        }
    }
}
