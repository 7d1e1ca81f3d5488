package com.flagship.token_ledger.ledger.event;

import com.flagship.token_ledger.ledger.AccountId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Notification emitted for every successful {@code transfer}.
 *
 * Transfer-from, burn, issue and approve emit nothing.
 */
@Value
public class TransferEvent {
    UUID eventId;
    AccountId from;
    AccountId to;
    BigInteger value;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Transfer";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferEvent of(AccountId from, AccountId to, BigInteger value) {
        return new TransferEvent(UUID.randomUUID(), from, to, value, Instant.now());
    }
}
