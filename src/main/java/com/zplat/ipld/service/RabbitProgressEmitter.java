package com.zplat.ipld.service;

import com.zplat.ipld.configuration.RabbitMQConfig;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class RabbitProgressEmitter implements ProgressEmitter {

    RabbitTemplate rabbitTemplate;

    @Override
    public void emit(String event, Object payload) {
        try {
            rabbitTemplate.convertAndSend(RabbitMQConfig.EXCHANGE, event, payload);
            log.debug("Published {}: {}", event, payload);
        } catch (AmqpException e) {
            // progress is best effort; the run itself must not fail on a broker outage
            log.error("Failed to publish {} event: {}", event, e.getMessage());
        }
    }
}
