package com.talent.match.async.consumers;

import com.talent.match.async.MatchEngineProducer;
import com.talent.match.dto.KafkaListenerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.util.concurrent.TimeUnit;


/**
 * Shared record handling: blank payloads and processing failures go to the listener's dead-letter topic.
 * Processing runs on the listener thread so offsets are committed only after invalidation finished.
 */
@Slf4j
public abstract class BaseKafkaConsumer {

    private static final long PROCESSING_TIMEOUT_SECONDS = 120;

    private final MatchEngineProducer dlqProducer;
    private final MeterRegistry meterRegistry;

    protected BaseKafkaConsumer(MatchEngineProducer dlqProducer, MeterRegistry meterRegistry) {
        this.dlqProducer = dlqProducer;
        this.meterRegistry = meterRegistry;
    }

    public void consume(ConsumerRecord<String, String> consumerRecord, KafkaListenerConfig config) {
        String payload = consumerRecord.value();
        String topic = consumerRecord.topic();
        String key = consumerRecord.key();
        String groupId = config.getGroupId();

        if (payload == null || payload.isBlank()) {
            log.warn("Empty or null payload for key={} on topic={}. Sending to DLQ.", key, topic);
            sendToDlq(config, consumerRecord);
            meterRegistry.counter("kafka_dlq_messages", "topic", topic, "groupId", groupId).increment();
            return;
        }

        long startTime = System.currentTimeMillis();
        try {
            config.getPayloadProcessor().process(payload)
                    .orTimeout(PROCESSING_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .join();
            long duration = System.currentTimeMillis() - startTime;
            meterRegistry.timer("kafka_processing_time", "topic", topic, "groupId", groupId)
                    .record(duration, TimeUnit.MILLISECONDS);
        } catch (Exception ex) {
            log.error("Processing failed for key={} on topic={}", key, topic, ex);
            sendToDlq(config, consumerRecord);
            meterRegistry.counter("kafka_processing_errors", "topic", topic, "groupId", groupId).increment();
        }
    }

    private void sendToDlq(KafkaListenerConfig config, ConsumerRecord<String, String> record) {
        dlqProducer.sendMessage(config.getDlqTopic(), record.key(), record.value());
    }
}
