package com.preciousledger.domain.service;

import com.preciousledger.infrastructure.persistence.entity.OutboxEventEntity;
import com.preciousledger.infrastructure.persistence.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains the allocation outbox to Kafka.
 *
 * Events are sent oldest first and keyed by their aggregate id, so all events
 * of one submission land on the same partition in order. An event that fails
 * to publish stays PENDING and is retried on the next poll until
 * {@code app.outbox.max-attempts} is reached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${app.kafka.topics.allocation-events}")
    private String allocationEventsTopic;

    @Value("${app.outbox.batch-size:10}")
    private int batchSize;

    @Value("${app.outbox.max-attempts:5}")
    private int maxAttempts;

    @Value("${app.outbox.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${app.outbox.polling-interval-ms:200}")
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEventEntity> pending = outboxEventRepository
                .findOldestByStatus(OutboxEventEntity.EventStatus.PENDING, PageRequest.of(0, batchSize));
        if (pending.isEmpty()) {
            return 0;
        }

        log.debug("Publishing {} pending outbox events", pending.size());
        int published = 0;
        for (OutboxEventEntity event : pending) {
            if (publish(event)) {
                published++;
            }
            outboxEventRepository.save(event);
        }
        return published;
    }

    private boolean publish(OutboxEventEntity event) {
        try {
            kafkaTemplate.send(allocationEventsTopic, event.getAggregateId(), event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            event.markPublished();
            log.debug("Published outbox event {} ({}) to {}", event.getEventId(), event.getEventType(),
                    allocationEventsTopic);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            event.markFailed("interrupted", maxAttempts);
            log.warn("Interrupted while publishing outbox event {}", event.getEventId());
        } catch (ExecutionException | TimeoutException e) {
            event.markFailed(e.getMessage(), maxAttempts);
            log.error("Failed to publish outbox event {} (attempt {}): {}",
                    event.getEventId(), event.getAttempts(), e.getMessage());
        }
        return false;
    }
}
