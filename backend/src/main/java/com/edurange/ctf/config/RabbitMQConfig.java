package com.edurange.ctf.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

@Configuration
public class RabbitMQConfig {

    public static final String AUDIT_EXCHANGE = "audit.exchange";

    // Collector queue: receives every audit event
    public static final String AUDIT_EVENTS_QUEUE = "audit.events";
    public static final String AUDIT_ROUTING_PATTERN = "audit.#";

    // Dead-letter infrastructure for audit.events
    public static final String AUDIT_DLX_NAME = "audit.dlx";
    public static final String AUDIT_EVENTS_DLQ = "audit.events.dlq";

    @Bean
    public TopicExchange auditExchange() {
        return ExchangeBuilder.topicExchange(AUDIT_EXCHANGE).durable(true).build();
    }

    @Bean
    public Queue auditEventsQueue() {
        return QueueBuilder.durable(AUDIT_EVENTS_QUEUE)
                .withArgument("x-dead-letter-exchange", AUDIT_DLX_NAME)
                .withArgument("x-dead-letter-routing-key", AUDIT_EVENTS_QUEUE)
                .build();
    }

    @Bean
    public DirectExchange auditDeadLetterExchange() {
        return ExchangeBuilder.directExchange(AUDIT_DLX_NAME).durable(true).build();
    }

    @Bean
    public Queue auditEventsDlq() {
        return QueueBuilder.durable(AUDIT_EVENTS_DLQ).build();
    }

    @Bean
    public Binding auditEventsDlqBinding() {
        return BindingBuilder.bind(auditEventsDlq())
                .to(auditDeadLetterExchange())
                .with(AUDIT_EVENTS_QUEUE);
    }

    @Bean
    public Binding auditEventsBinding() {
        return BindingBuilder.bind(auditEventsQueue()).to(auditExchange()).with(AUDIT_ROUTING_PATTERN);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        // Boot's mapper writes Instant as ISO-8601
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(jsonMessageConverter);
        return template;
    }
}
