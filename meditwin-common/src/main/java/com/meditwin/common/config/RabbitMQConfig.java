package com.meditwin.common.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableRabbit
public class RabbitMQConfig {

    // Queue names
    public static final String DOCUMENT_INGESTION_QUEUE = "meditwin.document.ingestion";
    public static final String DOCUMENT_INGESTION_DLQ = "meditwin.document.ingestion.dlq";

    // Exchange names
    public static final String MEDITWIN_EXCHANGE = "meditwin.exchange";
    public static final String MEDITWIN_DLX = "meditwin.dlx";

    // Routing keys
    public static final String DOCUMENT_INGEST_KEY = "document.ingest";

    @Bean
    public DirectExchange meditwinExchange() {
        return new DirectExchange(MEDITWIN_EXCHANGE, true, false);
    }

    @Bean
    public FanoutExchange meditwinDeadLetterExchange() {
        return new FanoutExchange(MEDITWIN_DLX, true, false);
    }

    /**
     * Background ingestion queue. Rejected messages go to the dead-letter exchange.
     */
    @Bean
    public Queue documentIngestionQueue() {
        return QueueBuilder.durable(DOCUMENT_INGESTION_QUEUE)
                .withArgument("x-dead-letter-exchange", MEDITWIN_DLX)
                .build();
    }

    @Bean
    public Queue documentIngestionDeadLetterQueue() {
        return QueueBuilder.durable(DOCUMENT_INGESTION_DLQ).build();
    }

    @Bean
    public Binding documentIngestionBinding() {
        return BindingBuilder
                .bind(documentIngestionQueue())
                .to(meditwinExchange())
                .with(DOCUMENT_INGEST_KEY);
    }

    @Bean
    public Binding documentIngestionDeadLetterBinding() {
        return BindingBuilder
                .bind(documentIngestionDeadLetterQueue())
                .to(meditwinDeadLetterExchange());
    }

    /**
     * JSON message converter
     */
    @Bean
    public Jackson2JsonMessageConverter messageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    /**
     * RabbitTemplate with JSON converter
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(messageConverter());
        return template;
    }
}
