package com.growthpilot.platform.scheduler.service.audit;

import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Fire-and-forget publication of scheduler events. A broker outage is logged and never reaches the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final SchedulerProperties properties;
    private final Clock clock;

    public void publish(AuditEventType type, UUID userId, UUID subjectId, Object status, String detail) {
        publish(AuditEvent.builder()
                .type(type)
                .userId(userId)
                .subjectId(subjectId)
                .status(status != null ? status.toString() : null)
                .detail(detail)
                .occurredAt(OffsetDateTime.now(clock))
                .build());
    }

    public void publish(AuditEvent event) {
        if (!properties.getAudit().isEnabled()) {
            log.debug("Audit disabled, dropping {} for {}", event.getType(), event.getSubjectId());
            return;
        }
        try {
            rabbitTemplate.convertAndSend(properties.getAudit().getExchange(), event.getType().routingKey(), event);
        } catch (AmqpException e) {
            log.warn("Failed to publish audit event {} for {}: {}", event.getType(), event.getSubjectId(), e.getMessage());
        }
    }
}
