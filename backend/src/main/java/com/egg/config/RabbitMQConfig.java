package com.egg.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ configuration for pipeline dispatch.
 *
 * HTTP requests only save events and publish a {@link com.egg.messaging.PipelineCommand};
 * transcription and inference run on listener threads, detached from the request.
 *
 * Architecture:
 * - Exchange: egg.pipeline.exchange (direct)
 * - Main Queue: egg.pipeline.queue, routing key egg.pipeline.run
 * - DLQ: egg.pipeline.dlq, receives commands whose handler threw
 *
 * Dead-lettered commands are safe to drop: the periodic sweep re-dispatches every user
 * that still has pending work.
 *
 * @see com.egg.messaging.PipelineDispatchProducer
 * @see com.egg.messaging.PipelineDispatchConsumer
 */
@Configuration
@Slf4j
public class RabbitMQConfig {

    @Value("${app.rabbitmq.exchange.pipeline:egg.pipeline.exchange}")
    private String pipelineExchange;

    @Value("${app.rabbitmq.queue.pipeline:egg.pipeline.queue}")
    private String pipelineQueue;

    @Value("${app.rabbitmq.queue.dlq:egg.pipeline.dlq}")
    private String pipelineDLQ;

    @Value("${app.rabbitmq.routing-key.pipeline:egg.pipeline.run}")
    private String pipelineRoutingKey;

    @Value("${app.rabbitmq.routing-key.dlq:egg.pipeline.dlq}")
    private String dlqRoutingKey;

    @Value("${app.rabbitmq.queue.ttl:86400000}") // 24 hours in milliseconds
    private long queueTTL;

    /**
     * JSON message converter. Spring Boot also hands this bean to the listener container factory.
     */
    @Bean
    public MessageConverter jsonMessageConverter() {
        log.debug("Configuring Jackson2JsonMessageConverter for RabbitMQ");
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);
        rabbitTemplate.setMandatory(true);

        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (ack) {
                log.debug("Message published successfully to RabbitMQ");
            } else {
                log.error("Failed to publish message to RabbitMQ: {}", cause);
            }
        });

        rabbitTemplate.setReturnsCallback(returned ->
                log.error("Message returned from RabbitMQ - Exchange: {}, RoutingKey: {}, ReplyText: {}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyText()));

        log.info("RabbitTemplate configured with JSON message converter and publisher confirms");
        return rabbitTemplate;
    }

    @Bean
    public Queue pipelineDLQ() {
        log.info("Configuring DLQ: {} (durable=true)", pipelineDLQ);
        return QueueBuilder.durable(pipelineDLQ).build();
    }

    /**
     * Main pipeline queue. Rejected messages go to the DLQ through the exchange.
     */
    @Bean
    public Queue pipelineQueue() {
        log.info("Configuring queue: {} (durable=true, ttl={})", pipelineQueue, queueTTL);

        return QueueBuilder.durable(pipelineQueue)
                .withArgument("x-message-ttl", queueTTL)
                .withArgument("x-dead-letter-exchange", pipelineExchange)
                .withArgument("x-dead-letter-routing-key", dlqRoutingKey)
                .build();
    }

    @Bean
    public DirectExchange pipelineExchange() {
        log.info("Configuring direct exchange: {} (durable=true)", pipelineExchange);
        return new DirectExchange(pipelineExchange, true, false);
    }

    @Bean
    public Binding dlqBinding() {
        log.debug("Binding DLQ {} to exchange {} with routing key {}",
                pipelineDLQ, pipelineExchange, dlqRoutingKey);

        return BindingBuilder
                .bind(pipelineDLQ())
                .to(pipelineExchange())
                .with(dlqRoutingKey);
    }

    @Bean
    public Binding pipelineBinding() {
        log.debug("Binding queue {} to exchange {} with routing key {}",
                pipelineQueue, pipelineExchange, pipelineRoutingKey);

        return BindingBuilder
                .bind(pipelineQueue())
                .to(pipelineExchange())
                .with(pipelineRoutingKey);
    }

    @Bean
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        log.info("Configuring AmqpAdmin for automatic queue/exchange declaration");
        return new RabbitAdmin(connectionFactory);
    }
}
