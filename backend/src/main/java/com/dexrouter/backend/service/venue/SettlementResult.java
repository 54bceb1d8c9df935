package com.dexrouter.backend.service.venue;

public record SettlementResult(boolean success, String reference, double executedPrice, double actualOutput,
                               String error) {

    public static SettlementResult settled(String reference, double executedPrice, double actualOutput) {
        return new SettlementResult(true, reference, executedPrice, actualOutput, null);
    }

    public static SettlementResult declined(String error) {
        return new SettlementResult(false, null, 0.0, 0.0, error);
    }
}
