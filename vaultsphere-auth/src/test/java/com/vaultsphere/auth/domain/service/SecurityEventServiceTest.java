package com.vaultsphere.auth.domain.service;

import com.vaultsphere.auth.domain.model.SecurityEventType;
import com.vaultsphere.auth.infrastructure.entity.SecurityEventEntity;
import com.vaultsphere.auth.infrastructure.repository.SecurityEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static com.vaultsphere.auth.domain.constants.AuthConstants.SECURITY_EVENTS_TOPIC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecurityEventServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private SecurityEventRepository securityEventRepository;

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private SecurityEventService securityEventService;

    @BeforeEach
    void setUp() {
        securityEventService = new SecurityEventService(securityEventRepository, kafkaTemplate,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void record_persistsAndPublishes() {
        UUID accountId = UUID.randomUUID();
        when(kafkaTemplate.send(eq(SECURITY_EVENTS_TOPIC), eq(accountId.toString()), any()))
                .thenReturn(new CompletableFuture<>());

        securityEventService.record(SecurityEventType.LOGIN_SUCCESS, accountId, "alice@example.com",
                "203.0.113.7", "JUnit", true, "Login successful");

        ArgumentCaptor<SecurityEventEntity> entity = ArgumentCaptor.forClass(SecurityEventEntity.class);
        verify(securityEventRepository).save(entity.capture());
        assertThat(entity.getValue().getEventType()).isEqualTo(SecurityEventType.LOGIN_SUCCESS);
        assertThat(entity.getValue().getAccountId()).isEqualTo(accountId);
        assertThat(entity.getValue().getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(entity.getValue().isSuccess()).isTrue();
        assertThat(entity.getValue().getCreatedAt()).isEqualTo(NOW);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(SECURITY_EVENTS_TOPIC), eq(accountId.toString()), payload.capture());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) payload.getValue();
        assertThat(data).containsEntry("eventType", "LOGIN_SUCCESS")
                .containsEntry("email", "alice@example.com")
                .containsEntry("timestamp", NOW.toEpochMilli());
    }

    @Test
    void record_withoutAccount_keysByEmail() {
        when(kafkaTemplate.send(eq(SECURITY_EVENTS_TOPIC), eq("nobody@example.com"), any()))
                .thenReturn(new CompletableFuture<>());

        securityEventService.record(SecurityEventType.LOGIN_FAILED_UNKNOWN_EMAIL, null, "nobody@example.com",
                "203.0.113.7", "JUnit", false, "Unknown email");

        verify(kafkaTemplate).send(eq(SECURITY_EVENTS_TOPIC), eq("nobody@example.com"), any());
    }

    @Test
    void record_swallowsDatabaseFailureAndStillPublishes() {
        when(securityEventRepository.save(any(SecurityEventEntity.class)))
                .thenThrow(new DataAccessResourceFailureException("db down"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        assertThatCode(() -> securityEventService.record(SecurityEventType.LOGIN_SUCCESS, UUID.randomUUID(),
                "alice@example.com", "203.0.113.7", "JUnit", true, "Login successful"))
                .doesNotThrowAnyException();

        verify(kafkaTemplate).send(anyString(), anyString(), any());
    }

    @Test
    void record_swallowsSynchronousKafkaFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new KafkaException("metadata timeout"));

        assertThatCode(() -> securityEventService.record(SecurityEventType.ACCOUNT_LOCKED, UUID.randomUUID(),
                "alice@example.com", "203.0.113.7", "JUnit", false, "Locked"))
                .doesNotThrowAnyException();
    }

    @Test
    void record_toleratesAsynchronousKafkaFailure() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new KafkaException("broker gone"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(failed);

        assertThatCode(() -> securityEventService.record(SecurityEventType.LOGIN_SUCCESS, UUID.randomUUID(),
                "alice@example.com", "203.0.113.7", "JUnit", true, "Login successful"))
                .doesNotThrowAnyException();
    }
}
