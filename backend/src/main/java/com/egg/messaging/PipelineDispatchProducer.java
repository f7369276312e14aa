package com.egg.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Producer for pipeline commands.
 *
 * Publishing decouples AI work from the HTTP request: the request only stores the event
 * and enqueues a command. Messages are JSON (Jackson2JsonMessageConverter).
 *
 * @see PipelineDispatchConsumer
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineDispatchProducer {

    private final RabbitTemplate rabbitTemplate;

    @Value("${app.rabbitmq.exchange.pipeline:egg.pipeline.exchange}")
    private String pipelineExchange;

    @Value("${app.rabbitmq.routing-key.pipeline:egg.pipeline.run}")
    private String pipelineRoutingKey;

    /**
     * Publish a command.
     *
     * @param command the command to publish
     * @throws IllegalArgumentException if the command or its user is null
     * @throws org.springframework.amqp.AmqpException if the broker is unreachable
     */
    public void send(PipelineCommand command) {
        if (command == null || command.userId() == null) {
            log.error("Attempted to send an incomplete pipeline command: command={}", command);
            throw new IllegalArgumentException("Pipeline command must carry a user ID");
        }

        log.debug("Sending pipeline command: type={}, userId={}, eventId={}, exchange={}, routingKey={}",
                command.type(), command.userId(), command.eventId(), pipelineExchange, pipelineRoutingKey);

        try {
            rabbitTemplate.convertAndSend(pipelineExchange, pipelineRoutingKey, command);
            log.info("Pipeline command queued: type={}, userId={}, eventId={}",
                    command.type(), command.userId(), command.eventId());
        } catch (Exception e) {
            log.error("Failed to send pipeline command: type={}, userId={}, error={}",
                    command.type(), command.userId(), e.getMessage(), e);
            throw e;
        }
    }

    public String getExchange() {
        return pipelineExchange;
    }

    public String getRoutingKey() {
        return pipelineRoutingKey;
    }
}
