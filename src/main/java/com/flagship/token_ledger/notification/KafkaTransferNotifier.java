package com.flagship.token_ledger.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_ledger.ledger.event.TransferEvent;
import com.flagship.token_ledger.ledger.event.TransferNotifier;
import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes transfer notifications to Kafka as JSON.
 *
 * Uses the sending account as the record key, so one account's transfers stay ordered
 * within a partition. Waits for the broker acknowledgement, at most
 * {@code kafka.producer.send-timeout-ms}.
 *
 * The ledger state is already persisted when this runs. A failed send is logged and
 * counted; it never undoes the transfer.
 */
@Component
@ConditionalOnProperty(name = "ledger.notifications.kafka.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class KafkaTransferNotifier implements TransferNotifier {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics ledgerMetrics;

    @Value("${kafka.topic.transfers:token-transfers}")
    private String transfersTopic;

    @Value("${kafka.producer.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Override
    public void publish(TransferEvent event) {
        try {
            ProducerRecord<String, String> record = new ProducerRecord<>(
                    transfersTopic, event.getFrom().toHex(), serialize(event));
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    CorrelationContext.getCorrelationId().getBytes(StandardCharsets.UTF_8));
            record.headers().add("eventType",
                    TransferEvent.EVENT_TYPE.getBytes(StandardCharsets.UTF_8));

            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published transfer event: eventId={}, topic={}, partition={}, offset={}",
                    event.getEventId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            ledgerMetrics.recordNotificationPublished();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while publishing transfer event: eventId={}", event.getEventId());
            ledgerMetrics.recordNotificationFailed();
        } catch (TimeoutException e) {
            log.error("Timed out publishing transfer event: eventId={}, timeoutMs={}",
                    event.getEventId(), sendTimeoutMs);
            ledgerMetrics.recordNotificationFailed();
        } catch (Exception e) {
            log.error("Failed to publish transfer event: eventId={}, from={}, to={}, value={}, error={}",
                    event.getEventId(), event.getFrom(), event.getTo(), event.getValue(), e.getMessage());
            ledgerMetrics.recordNotificationFailed();
        }
    }

    private String serialize(TransferEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize transfer event", e);
        }
    }
}
