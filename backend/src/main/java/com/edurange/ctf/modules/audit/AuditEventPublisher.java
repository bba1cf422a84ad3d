package com.edurange.ctf.modules.audit;

import com.edurange.ctf.config.RabbitMQConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

/**
 * Fans stored audit events out to the audit exchange for downstream collectors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditEventPublisher {

    private final RabbitTemplate rabbitTemplate;

    public void publish(AuditEventDto event) {
        rabbitTemplate.convertAndSend(RabbitMQConfig.AUDIT_EXCHANGE, event.getEventType().routingKey(), event);
        log.debug("Published audit event {} for subject {}", event.getEventType(), event.getSubjectId());
    }
}
