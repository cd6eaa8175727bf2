package com.talent.match.processors;

import com.talent.match.dto.ChangeEvent;
import com.talent.match.dto.InvalidationResult;
import com.talent.match.exceptions.BadRequestException;
import com.talent.match.service.InvalidationService;
import com.talent.match.utils.basic.BasicUtility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;


@Slf4j
@Component
@RequiredArgsConstructor
public class MatchEnginePayloadProcessor {
    private final InvalidationService invalidationService;

    /**
     * Parses a marketplace change event and runs the invalidation. Unparseable or incomplete payloads
     * are dropped with a warning; storage failures complete the future exceptionally so the consumer
     * can route the record to the dead-letter topic.
     */
    public CompletableFuture<Void> processChangeEvent(String payload) {
        if (payload == null || payload.isBlank()) {
            log.warn("Skipping processing: Blank payload");
            return CompletableFuture.completedFuture(null);
        }

        ChangeEvent event = BasicUtility.safeParse(payload, ChangeEvent.class);
        if (event == null || event.getType() == null) {
            log.warn("Failed to parse change event payload: {}", payload);
            return CompletableFuture.completedFuture(null);
        }

        try {
            InvalidationResult result = invalidationService.handle(event);
            log.debug("Processed {} event: version={}, enqueued={}", result.getType(), result.getEventVersion(),
                    result.getPairsEnqueued());
            return CompletableFuture.completedFuture(null);
        } catch (BadRequestException e) {
            log.warn("Dropping invalid {} event: {}", event.getType(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
