package com.rankfusion.search.service;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * WebClient whose exchanges never leave the JVM: every request is recorded and answered with a
 * canned status and JSON body, or never answered at all.
 */
final class StubBackend {

    private final List<ClientRequest> requests = new ArrayList<>();
    private final HttpStatus status;
    private final String body;
    private final boolean hang;

    private StubBackend(HttpStatus status, String body, boolean hang) {
        this.status = status;
        this.body = body;
        this.hang = hang;
    }

    static StubBackend answering(HttpStatus status, String body) {
        return new StubBackend(status, body, false);
    }

    static StubBackend ok(String body) {
        return answering(HttpStatus.OK, body);
    }

    static StubBackend hanging() {
        return new StubBackend(HttpStatus.OK, "", true);
    }

    WebClient webClient() {
        return WebClient.builder()
                .baseUrl("http://backend.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    if (hang) {
                        return Mono.never();
                    }
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }

    ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    int requestCount() {
        return requests.size();
    }
}
