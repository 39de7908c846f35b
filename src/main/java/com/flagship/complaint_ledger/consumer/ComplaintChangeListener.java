package com.flagship.complaint_ledger.consumer;

import com.flagship.complaint_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.listener.ConsumerSeekAware;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Kafka listener for complaint row changes.
 *
 * Phase 4: Change feed.
 *
 * This listener:
 * 1. Assigns a correlation id to the event
 * 2. Parses it into a ChangeEvent
 * 3. Hands it to the dispatcher, which schedules the sync job
 * 4. Acknowledges
 *
 * The container is created stopped (autoStartup=false) and started by
 * ChangeFeedSubscription once the backlog has been reconciled.
 *
 * Acknowledging before the job finishes is safe: a lost job leaves the
 * complaint unminted, and the backlog sweep picks it up.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ComplaintChangeListener implements ConsumerSeekAware {

    public static final String LISTENER_ID = "complaint-changes";

    private final ChangeEventParser parser;
    private final ChangeEventDispatcher dispatcher;
    private final ChangeFeedSubscription subscription;

    @KafkaListener(
        id = LISTENER_ID,
        topics = "${feed.topic:complaints.changes}",
        groupId = "${spring.kafka.consumer.group-id:complaint-ledger-sync}",
        autoStartup = "false"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String correlationId = CorrelationContext.generateCorrelationId();
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);

        try {
            log.debug("Received change event: partition={}, offset={}, key={}",
                    record.partition(), record.offset(), record.key());

            Optional<ChangeEvent> event = parser.parse(record.value());
            if (event.isEmpty()) {
                log.warn("Skipping unparseable change event at offset {}", record.offset());
                ack.acknowledge();
                return;
            }

            dispatcher.dispatch(event.get(), correlationId);
            ack.acknowledge();

        } catch (RuntimeException e) {
            log.error("Error dispatching change event at offset {}: {}", record.offset(), e.getMessage(), e);
            // Not acknowledged; redelivered
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    @Override
    public void onPartitionsAssigned(Map<TopicPartition, Long> assignments, ConsumerSeekCallback callback) {
        subscription.onSubscribed(assignments.size());
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        log.info("Change feed partitions revoked: {}", partitions);
    }
}
