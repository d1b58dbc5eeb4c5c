package com.chainoracle.resolver;

import com.chainoracle.common.RequestValidationException;
import com.chainoracle.common.SymbolRegistry;
import com.chainoracle.domain.Network;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Shared request normalization: ticker case-folding, network lookup with default, strict ISO date parsing.
 */
final class RequestNormalizer {

    static final Network DEFAULT_NETWORK = Network.POLYGON;

    private static final Pattern SYMBOL = Pattern.compile("^[A-Z0-9.\\-]{1,20}$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final DateTimeFormatter STRICT_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private RequestNormalizer() {}

    static String symbol(String raw) {
        String symbol = SymbolRegistry.normalizeSymbol(raw)
                .orElseThrow(() -> new RequestValidationException("symbol is required"));
        if (!SYMBOL.matcher(symbol).matches()) {
            throw new RequestValidationException("Invalid token symbol: " + raw);
        }
        return symbol;
    }

    /**
     * Null or blank means the default network.
     */
    static Network network(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_NETWORK;
        }
        return Network.fromId(raw)
                .orElseThrow(() -> new RequestValidationException(
                        RequestValidationException.INVALID_NETWORK, "Unsupported network: " + raw));
    }

    static LocalDate date(String raw) {
        if (raw == null || !ISO_DATE.matcher(raw.strip()).matches()) {
            throw new RequestValidationException(RequestValidationException.INVALID_DATE,
                    "Date must be in YYYY-MM-DD format: " + raw);
        }
        try {
            return LocalDate.parse(raw.strip(), STRICT_DATE);
        } catch (DateTimeParseException e) {
            throw new RequestValidationException(RequestValidationException.INVALID_DATE, "Invalid date: " + raw);
        }
    }
}
