package com.chainoracle.publish;

import com.chainoracle.cache.CacheKeys;
import com.chainoracle.cache.TtlCache;
import com.chainoracle.common.RequestValidationException;
import com.chainoracle.domain.Category;
import com.chainoracle.domain.ContractEvent;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Simulated publish of an event to a smart contract. No transaction is sent: the event gets a generated transaction
 * hash and block number, is kept in the cache under contract_event:{address}:{event}:{timestamp}:{tx}, and is echoed back.
 * The payload is opaque here.
 */
@Slf4j
public class ContractEventPublisher {

    private static final Pattern CONTRACT_ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    private static final long SIMULATED_BLOCK_BASE = 50_000_000L;
    private static final int SIMULATED_BLOCK_SPAN = 1_000_000;

    private final TtlCache cache;
    private final Clock clock;
    private final Random random;

    public ContractEventPublisher(TtlCache cache, Clock clock) {
        this(cache, clock, new SecureRandom());
    }

    ContractEventPublisher(TtlCache cache, Clock clock, Random random) {
        this.cache = cache;
        this.clock = clock;
        this.random = random;
    }

    public ContractEvent publish(String eventName, String contractAddress, Map<String, Object> data) {
        if (eventName == null || eventName.isBlank()) {
            throw new RequestValidationException("eventName is required");
        }
        if (!isValidContractAddress(contractAddress)) {
            throw new RequestValidationException(RequestValidationException.INVALID_ADDRESS,
                    "Invalid contract address: " + contractAddress);
        }
        if (data == null) {
            throw new RequestValidationException("data is required");
        }
        String address = contractAddress.strip().toLowerCase(Locale.ROOT);
        long timestamp = clock.millis();
        ContractEvent event = new ContractEvent(
                eventName.strip(),
                address,
                Collections.unmodifiableMap(new LinkedHashMap<>(data)),
                transactionHash(),
                SIMULATED_BLOCK_BASE + random.nextInt(SIMULATED_BLOCK_SPAN),
                timestamp);
        cache.set(CacheKeys.build(Category.CONTRACT_EVENT.keyPrefix(), address, event.eventName(), timestamp,
                event.transactionHash()), event);
        log.info("Simulated publish of {} to {} (tx {})", event.eventName(), address, event.transactionHash());
        return event;
    }

    /**
     * EVM contract address: 0x followed by 40 hex digits, either case.
     */
    public static boolean isValidContractAddress(String address) {
        return address != null && CONTRACT_ADDRESS.matcher(address.strip()).matches();
    }

    private String transactionHash() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return "0x" + HexFormat.of().formatHex(bytes);
    }
}
