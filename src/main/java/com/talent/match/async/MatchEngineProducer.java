package com.talent.match.async;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class MatchEngineProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final Executor kafkaCallbackExecutor;

    public MatchEngineProducer(KafkaTemplate<String, String> kafkaTemplate, MeterRegistry meterRegistry,
                               @Qualifier("kafkaCallbackExecutor") Executor kafkaCallbackExecutor) {
        this.kafkaTemplate = kafkaTemplate;
        this.meterRegistry = meterRegistry;
        this.kafkaCallbackExecutor = kafkaCallbackExecutor;
    }

    public void sendMessage(String topic, String key, String value) {
        long startTime = System.nanoTime();

        kafkaTemplate.send(topic, key, value)
                .whenCompleteAsync((result, ex) -> {
                    long durationMs = (System.nanoTime() - startTime) / 1_000_000;

                    if (ex == null) {
                        log.info("Sent message to {}: key={}, duration={} ms", topic, key, durationMs);
                        meterRegistry.timer("kafka_send_duration", "topic", topic)
                                .record(durationMs, TimeUnit.MILLISECONDS);
                    } else {
                        log.error("Failed to send to {}: key={}, error={}", topic, key, ex.getMessage(), ex);
                        meterRegistry.counter("kafka_send_failures", "topic", topic).increment();
                    }
                }, kafkaCallbackExecutor);
    }
}
