package com.flagship.token_ledger.ledger.event;

/**
 * Channel the ledger announces transfers on. Delivery and indexing belong to the implementation.
 */
@FunctionalInterface
public interface TransferNotifier {

    void publish(TransferEvent event);
}
