package com.chainoracle.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Shared GET plumbing for HTTP adapters: one blocking call with a bounded wait, errors mapped to
 * {@link UpstreamException}.
 */
@Slf4j
public abstract class HttpSourceSupport {

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final Duration requestTimeout;

    protected HttpSourceSupport(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, Duration requestTimeout) {
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Provider id attached to every {@link UpstreamException} raised here. Adapters satisfy it through
     * {@link SourceAdapter#providerId()}.
     */
    public abstract String providerId();

    protected String getBody(String url, Map<String, String> headers) {
        try {
            String body = webClient.get()
                    .uri(url)
                    .headers(h -> headers.forEach(h::set))
                    .header(HttpHeaders.ACCEPT, "application/json")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(requestTimeout);
            if (body == null || body.isBlank()) {
                throw new UpstreamException(providerId(), "empty response body");
            }
            return body;
        } catch (WebClientResponseException e) {
            throw new UpstreamException(providerId(), "HTTP " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (UpstreamException e) {
            throw e;
        } catch (Exception e) {
            throw new UpstreamException(providerId(), "request failed: " + e.getMessage(), e);
        }
    }

    protected JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UpstreamException(providerId(), "malformed JSON payload", e);
        }
    }

    /**
     * GET that only checks for a 2xx status. Used by health probes.
     */
    protected boolean probe(String url) {
        try {
            return Boolean.TRUE.equals(webClient.get()
                    .uri(url)
                    .exchangeToMono(response -> response.releaseBody()
                            .thenReturn(response.statusCode().is2xxSuccessful()))
                    .block(requestTimeout));
        } catch (Exception e) {
            log.debug("Health probe {} failed: {}", url, e.getMessage());
            return false;
        }
    }

    /**
     * Numeric field as decimal; accepts JSON numbers and numeric strings, null otherwise.
     */
    protected static BigDecimal decimalOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
