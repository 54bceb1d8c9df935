package com.dexrouter.backend.service.venue;

/**
 * Builds and settles the swap transaction on the selected venue.
 */
public interface SettlementGateway {

    /**
     * Constructs and pre-validates the transaction. Blocks until done.
     */
    void buildTransaction(SettlementRequest request);

    /**
     * Sends the transaction and waits for the outcome. A decline is reported in the result, not thrown.
     */
    SettlementResult settle(SettlementRequest request);
}
