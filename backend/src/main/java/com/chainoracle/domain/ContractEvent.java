package com.chainoracle.domain;

import java.util.Map;

/**
 * Simulated contract event. {@code data} is the caller's payload, stored and echoed back untouched.
 */
public record ContractEvent(
        String eventName,
        String contractAddress,
        Map<String, Object> data,
        String transactionHash,
        long blockNumber,
        long timestamp
) {
}
