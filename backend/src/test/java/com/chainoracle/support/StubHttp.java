package com.chainoracle.support;

import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * WebClient stub: answers every request with one canned JSON response and records the requests it saw.
 */
public class StubHttp {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private volatile HttpStatus status;
    private volatile String body;

    private StubHttp(HttpStatus status, String body) {
        this.status = status;
        this.body = body;
    }

    public static StubHttp ok(String body) {
        return new StubHttp(HttpStatus.OK, body);
    }

    public static StubHttp status(HttpStatus status) {
        return new StubHttp(status, "");
    }

    public void respond(HttpStatus status, String body) {
        this.status = status;
        this.body = body;
    }

    public WebClient.Builder builder() {
        return WebClient.builder().exchangeFunction(req -> {
            requests.add(req);
            return Mono.just(ClientResponse.create(status)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
        });
    }

    public List<ClientRequest> requests() {
        return requests;
    }

    public ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
