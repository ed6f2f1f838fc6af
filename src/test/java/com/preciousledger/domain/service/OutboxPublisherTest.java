package com.preciousledger.domain.service;

import com.preciousledger.infrastructure.persistence.entity.OutboxEventEntity;
import com.preciousledger.infrastructure.persistence.repository.OutboxEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "allocation-events";

    @Mock private OutboxEventRepository outboxEventRepository;
    @Mock private KafkaTemplate<String, String> kafkaTemplate;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxEventRepository, kafkaTemplate);
        ReflectionTestUtils.setField(publisher, "allocationEventsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "maxAttempts", 2);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    @Test
    void publishPendingEvents_sendsKeyedByAggregate_andMarksPublished() {
        OutboxEventEntity event = pendingEvent();
        when(outboxEventRepository.findOldestByStatus(eq(OutboxEventEntity.EventStatus.PENDING), any(Pageable.class)))
                .thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId(), event.getPayload()))
                .thenReturn(CompletableFuture.completedFuture((SendResult<String, String>) null));

        int published = publisher.publishPendingEvents();

        assertEquals(1, published);
        assertEquals(OutboxEventEntity.EventStatus.PUBLISHED, event.getStatus());
        assertNotNull(event.getPublishedAt());
        verify(outboxEventRepository).save(event);
    }

    @Test
    void publishPendingEvents_failure_keepsPendingUntilMaxAttempts() {
        OutboxEventEntity event = pendingEvent();
        when(outboxEventRepository.findOldestByStatus(eq(OutboxEventEntity.EventStatus.PENDING), any(Pageable.class)))
                .thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        assertEquals(0, publisher.publishPendingEvents());
        assertEquals(OutboxEventEntity.EventStatus.PENDING, event.getStatus());
        assertEquals(1, event.getAttempts());
        assertTrue(event.getLastError().contains("broker unavailable"));

        assertEquals(0, publisher.publishPendingEvents());
        assertEquals(OutboxEventEntity.EventStatus.FAILED, event.getStatus());
        verify(outboxEventRepository, times(2)).save(event);
    }

    @Test
    void publishPendingEvents_nothingPending_doesNotTouchKafka() {
        when(outboxEventRepository.findOldestByStatus(eq(OutboxEventEntity.EventStatus.PENDING), any(Pageable.class)))
                .thenReturn(List.of());

        assertEquals(0, publisher.publishPendingEvents());
        verifyNoInteractions(kafkaTemplate);
    }

    private OutboxEventEntity pendingEvent() {
        return OutboxEventEntity.builder()
                .eventId(UUID.randomUUID())
                .eventType(ContributionCommitService.EVENT_COMMITTED)
                .aggregateType("SUBMISSION")
                .aggregateId(UUID.randomUUID().toString())
                .payload("{\"status\":\"ACCEPTED\"}")
                .build();
    }
}
