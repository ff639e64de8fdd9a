package com.rankfusion.search.service;

import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

final class BackendCalls {

    private BackendCalls() {
    }

    static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    // 0 when the failure did not carry an HTTP status.
    static int statusOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof WebClientResponseException response) {
                return response.getStatusCode().value();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return 0;
    }
}
