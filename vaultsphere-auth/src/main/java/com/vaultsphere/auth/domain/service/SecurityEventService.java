package com.vaultsphere.auth.domain.service;

import com.vaultsphere.auth.domain.model.SecurityEventType;
import com.vaultsphere.auth.infrastructure.entity.SecurityEventEntity;
import com.vaultsphere.auth.infrastructure.repository.SecurityEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static com.vaultsphere.auth.domain.constants.AuthConstants.SECURITY_EVENTS_TOPIC;

/**
 * Security Event Service - audit trail of authentication outcomes
 * Persists each event to security_events and forwards it to Kafka.
 * <p>
 * Note: Never fails the calling operation - every sink error is logged and dropped
 */
@Service
@Slf4j
public class SecurityEventService {

    private final SecurityEventRepository securityEventRepository;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public SecurityEventService(SecurityEventRepository securityEventRepository,
                                KafkaTemplate<String, Object> kafkaTemplate,
                                Clock clock) {
        this.securityEventRepository = securityEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.clock = clock;
    }

    public void record(SecurityEventType type, UUID accountId, String email,
                       String ipAddress, String userAgent, boolean success, String description) {
        Instant now = clock.instant();

        log.info("[SECURITY_EVENT] {} | accountId={} | email={} | ip={} | success={}",
                type, accountId, email, ipAddress, success);

        persist(type, accountId, email, ipAddress, userAgent, success, description, now);
        publish(type, accountId, email, ipAddress, success, description, now);
    }

    private void persist(SecurityEventType type, UUID accountId, String email, String ipAddress,
                         String userAgent, boolean success, String description, Instant now) {
        try {
            SecurityEventEntity entity = new SecurityEventEntity();
            entity.setEventType(type);
            entity.setAccountId(accountId);
            entity.setEmail(email);
            entity.setIpAddress(ipAddress);
            entity.setUserAgent(truncate(userAgent, 512));
            entity.setSuccess(success);
            entity.setDescription(truncate(description, 255));
            entity.setCreatedAt(now);
            securityEventRepository.save(entity);
        } catch (RuntimeException e) {
            log.error("[SECURITY_EVENT_PERSIST_FAILED] Failed to store security event | type={} | accountId={} | error={}",
                    type, accountId, e.getMessage());
        }
    }

    private void publish(SecurityEventType type, UUID accountId, String email, String ipAddress,
                         boolean success, String description, Instant now) {
        Map<String, Object> eventData = new HashMap<>();
        eventData.put("eventType", type.toString());
        eventData.put("accountId", accountId != null ? accountId.toString() : null);
        eventData.put("email", email);
        eventData.put("ipAddress", ipAddress);
        eventData.put("success", success);
        eventData.put("description", description);
        eventData.put("timestamp", now.toEpochMilli());

        String key = accountId != null ? accountId.toString() : email;

        try {
            kafkaTemplate.send(SECURITY_EVENTS_TOPIC, key, eventData)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            log.debug("[EVENT_PUBLISHED] Security event published | type={} | partition={} | offset={}",
                                    type, result.getRecordMetadata().partition(),
                                    result.getRecordMetadata().offset());
                        } else {
                            log.warn("[EVENT_PUBLISH_FAILED] Failed to publish security event | type={} | topic={} | error={}",
                                    type, SECURITY_EVENTS_TOPIC, ex.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            // send() throws synchronously when broker metadata cannot be fetched in time
            log.warn("[EVENT_PUBLISH_FAILED] Failed to publish security event | type={} | topic={} | error={}",
                    type, SECURITY_EVENTS_TOPIC, e.getMessage());
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
