package com.preciousledger.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.preciousledger.domain.model.ContributionCommitResult;
import com.preciousledger.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.preciousledger.infrastructure.persistence.repository.IdempotencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Duplicate detection for contribution submissions.
 *
 * Accepted submissions are recorded under their idempotency key together with
 * the result returned to the caller. A redelivered submission (Kafka is
 * at-least-once, HTTP clients retry) gets that result back instead of
 * allocating the same units twice.
 *
 * The record is written in the commit's own transaction, so it exists exactly
 * when the contributions do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final IdempotencyRecordRepository idempotencyRepository;
    private final ObjectMapper objectMapper;

    @Value("${app.allocation.idempotency-window-hours:24}")
    private int idempotencyWindowHours;

    /**
     * @return the cached result when the key was already accepted and has not expired
     */
    @Transactional(readOnly = true)
    public Optional<ContributionCommitResult> findAccepted(String idempotencyKey) {
        Optional<IdempotencyRecordEntity> record = idempotencyRepository.findByIdempotencyKey(idempotencyKey);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        IdempotencyRecordEntity entity = record.get();
        if (entity.isExpiredAt(Instant.now())) {
            log.debug("Idempotency record expired for key: {}", idempotencyKey);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(entity.getResponse(), ContributionCommitResult.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable cached result for idempotency key " + idempotencyKey, e);
        }
    }

    /**
     * Stores the accepted result. An expired record under the same key is
     * reused, since the key column is unique.
     *
     * @throws DuplicateKeyException when a live record already holds the key
     */
    @Transactional
    public void recordAccepted(String idempotencyKey, ContributionCommitResult result) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize commit result " + result.getSubmissionId(), e);
        }

        Instant now = Instant.now();
        Optional<IdempotencyRecordEntity> existing = idempotencyRepository.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent() && !existing.get().isExpiredAt(now)) {
            throw new DuplicateKeyException("Submission already accepted under idempotency key " + idempotencyKey);
        }
        IdempotencyRecordEntity record = existing
                .orElseGet(() -> IdempotencyRecordEntity.builder().idempotencyKey(idempotencyKey).build());
        record.setSubmissionId(result.getSubmissionId());
        record.setResponse(json);
        record.setExpiresAt(now.plus(idempotencyWindowHours, ChronoUnit.HOURS));
        idempotencyRepository.save(record);

        log.debug("Stored idempotency record for key: {}", idempotencyKey);
    }
}
