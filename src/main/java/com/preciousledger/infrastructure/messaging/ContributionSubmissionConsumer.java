package com.preciousledger.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.preciousledger.domain.model.ContributionCommitResult;
import com.preciousledger.domain.model.ContributionSubmission;
import com.preciousledger.domain.service.ContributionCommitService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka intake for contribution submissions.
 *
 * Offsets are acknowledged manually once a submission has been committed or
 * rejected. Redelivery is safe because commits are idempotent on the
 * submission's idempotency key. Submissions that fail unexpectedly go to the
 * dead letter topic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContributionSubmissionConsumer {

    private final ContributionCommitService commitService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Value("${app.kafka.topics.dlq}")
    private String dlqTopic;

    @KafkaListener(
            topics = "${app.kafka.topics.contribution-submissions}",
            groupId = "${spring.kafka.consumer.group-id}"
    )
    public void consume(ConsumerRecord<String, ContributionSubmission> record, Acknowledgment acknowledgment) {
        ContributionSubmission submission = record.value();

        if (submission == null || submission.getSubmissionId() == null) {
            log.warn("Skipping malformed submission at partition={}, offset={}", record.partition(), record.offset());
            count("malformed");
            acknowledgment.acknowledge();
            return;
        }

        try {
            log.debug("Consumed contribution submission: partition={}, offset={}, submissionId={}",
                    record.partition(), record.offset(), submission.getSubmissionId());

            ContributionCommitResult result = commitService.commit(submission);
            acknowledgment.acknowledge();

            if (result.getStatus() == ContributionCommitResult.CommitStatus.ACCEPTED) {
                count("accepted");
            } else {
                log.warn("Submission {} rejected: {}", submission.getSubmissionId(), result.getFailureReason());
                count("rejected");
            }

        } catch (Exception e) {
            log.error("Error processing contribution submission {}: {}",
                    submission.getSubmissionId(), e.getMessage(), e);
            count("error");

            sendToDLQ(submission, e.getMessage());
            acknowledgment.acknowledge();
        }
    }

    private void sendToDLQ(ContributionSubmission submission, String errorMessage) {
        try {
            log.warn("Sending submission {} to DLQ: {}", submission.getSubmissionId(), errorMessage);
            kafkaTemplate.send(dlqTopic, submission.getSubmissionId().toString(),
                    objectMapper.writeValueAsString(submission));

            Counter.builder("kafka.dlq.sent")
                    .tag("reason", "processing_failed")
                    .register(meterRegistry)
                    .increment();

        } catch (Exception e) {
            log.error("Failed to send submission {} to DLQ: {}", submission.getSubmissionId(), e.getMessage(), e);
        }
    }

    private void count(String result) {
        Counter.builder("kafka.contribution.submissions.consumed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
