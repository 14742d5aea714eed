package com.comma.counseling.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;

/**
 * Notifications go out on a topic exchange, routed by {@code notification.<kind>}.
 * Consumers own their queues and bindings.
 */
@Configuration
@Slf4j
public class RabbitConfig {

    @Bean
    public TopicExchange notificationExchange(
            @Value("${counseling.notifications.exchange:counseling.notifications}") String exchangeName) {
        return new TopicExchange(exchangeName, true, false);
    }

    @Bean
    public Jackson2JsonMessageConverter jackson2JsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory,
                                         Jackson2JsonMessageConverter converter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(converter);

        template.setMandatory(true);
        template.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.error("Notification publish not confirmed: {}", cause);
            }
        });
        template.setReturnsCallback(returned -> log.warn("Unroutable notification {}: {}",
                returned.getRoutingKey(), new String(returned.getMessage().getBody(), StandardCharsets.UTF_8)));

        return template;
    }
}
