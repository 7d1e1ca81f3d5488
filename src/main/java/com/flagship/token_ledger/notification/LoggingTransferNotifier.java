package com.flagship.token_ledger.notification;

import com.flagship.token_ledger.ledger.event.TransferEvent;
import com.flagship.token_ledger.ledger.event.TransferNotifier;
import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default notification channel when Kafka is disabled: writes each transfer to the log.
 */
@Component
@ConditionalOnProperty(name = "ledger.notifications.kafka.enabled", havingValue = "false", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LoggingTransferNotifier implements TransferNotifier {

    private final LedgerMetrics ledgerMetrics;

    @Override
    public void publish(TransferEvent event) {
        log.info("Transfer: eventId={}, from={}, to={}, value={}, occurredAt={}",
                event.getEventId(), event.getFrom(), event.getTo(), event.getValue(), event.getOccurredAt());
        ledgerMetrics.recordNotificationPublished();
    }
}
