package com.talent.match.dto;

import com.talent.match.processors.PayloadProcessor;
import lombok.Data;

@Data
public class KafkaListenerConfig {
    private String topicPattern;
    private String groupId;
    private int concurrency;
    private String dlqTopic;
    private PayloadProcessor payloadProcessor;
}
