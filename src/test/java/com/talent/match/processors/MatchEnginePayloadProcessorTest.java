package com.talent.match.processors;

import com.talent.match.dto.ChangeEvent;
import com.talent.match.dto.InvalidationResult;
import com.talent.match.dto.enums.ChangeEventType;
import com.talent.match.exceptions.BadRequestException;
import com.talent.match.service.InvalidationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchEnginePayloadProcessorTest {

    @Mock
    private InvalidationService invalidationService;

    @InjectMocks
    private MatchEnginePayloadProcessor processor;

    @Test
    void validEventIsHandled() {
        UUID listingId = UUID.randomUUID();
        when(invalidationService.handle(any())).thenReturn(InvalidationResult.builder()
                .type(ChangeEventType.LISTING_CHANGED).eventVersion(3L).build());

        CompletableFuture<Void> future = processor.processChangeEvent(
                "{\"type\":\"LISTING_CHANGED\",\"listingId\":\"" + listingId + "\"}");

        assertThat(future).isCompleted();
        ArgumentCaptor<ChangeEvent> event = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(invalidationService).handle(event.capture());
        assertThat(event.getValue().getListingId()).isEqualTo(listingId);
    }

    @Test
    void malformedPayloadIsDropped() {
        CompletableFuture<Void> future = processor.processChangeEvent("not json");

        assertThat(future).isCompleted();
        verifyNoInteractions(invalidationService);
    }

    @Test
    void invalidEventIsDroppedWithoutFailing() {
        when(invalidationService.handle(any())).thenThrow(new BadRequestException("listingId is required"));

        CompletableFuture<Void> future = processor.processChangeEvent("{\"type\":\"LISTING_CHANGED\"}");

        assertThat(future).isCompletedWithValue(null);
    }

    @Test
    void storageFailureFailsTheFuture() {
        when(invalidationService.handle(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        CompletableFuture<Void> future = processor.processChangeEvent(
                "{\"type\":\"PROFILE_SKILLS_CHANGED\",\"studentId\":\"" + UUID.randomUUID() + "\"}");

        assertThat(future).isCompletedExceptionally();
    }
}
