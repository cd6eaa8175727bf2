package com.talent.match.config;

import com.talent.match.dto.KafkaListenerConfig;
import com.talent.match.processors.MatchEnginePayloadProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KafkaListenerConfiguration {
        private final MatchEnginePayloadProcessor payloadProcessor;

        public KafkaListenerConfiguration(MatchEnginePayloadProcessor payloadProcessor) {
            this.payloadProcessor = payloadProcessor;
        }

        @Bean
        public KafkaListenerConfig changeEventsConfig(@Value("${match.events.topic-pattern:marketplace-.*-events}") String topicPattern,
                                                      @Value("${match.events.group-id:match-engine-events}") String groupId,
                                                      @Value("${match.events.concurrency:2}") int concurrency,
                                                      @Value("${match.events.dlq-topic:match-engine-events-dlq}") String dlqTopic) {
            KafkaListenerConfig config = new KafkaListenerConfig();
            config.setTopicPattern(topicPattern);
            config.setGroupId(groupId);
            config.setConcurrency(concurrency);
            config.setDlqTopic(dlqTopic);
            config.setPayloadProcessor(payloadProcessor::processChangeEvent);
            return config;
        }
}
