package com.talent.match.async;

import com.talent.match.async.consumers.BaseKafkaConsumer;
import com.talent.match.dto.KafkaListenerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;


@Slf4j
@Component
public class MatchEngineConsumer extends BaseKafkaConsumer {

    private final KafkaListenerConfig changeEventsConfig;

    public MatchEngineConsumer(MatchEngineProducer dlqProducer, MeterRegistry meterRegistry,
                               @Qualifier("changeEventsConfig") KafkaListenerConfig changeEventsConfig) {
        super(dlqProducer, meterRegistry);
        this.changeEventsConfig = changeEventsConfig;
    }

    @KafkaListener(
            topicPattern = "#{@changeEventsConfig.topicPattern}",
            groupId = "#{@changeEventsConfig.groupId}",
            concurrency = "#{@changeEventsConfig.concurrency}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeChangeEvent(ConsumerRecord<String, String> consumerRecord) {
        consume(consumerRecord, changeEventsConfig);
    }
}
