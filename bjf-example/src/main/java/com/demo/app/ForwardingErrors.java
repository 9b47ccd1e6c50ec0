package com.demo.app;

import com.myorg.bjf.contracts.core.envelope.ErrorInfo;
import com.myorg.bjf.contracts.core.exception.ForwardingException;
import com.myorg.bjf.contracts.core.exception.ForwardingReason;
import com.myorg.bjf.forwarding.exception.UpstreamException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps forwarding failures to HTTP: bad configuration or input 400, lock or job store
 * trouble 503, upstream failures keep the upstream status (502 when there was none).
 */
final class ForwardingErrors {

    private ForwardingErrors() {}

    static ResponseEntity<Object> toResponse(Throwable err) {
        Throwable t = unwrap(err);
        if (!(t instanceof ForwardingException fe)) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorInfo.builder()
                            .code(ForwardingReason.UNKNOWN.code())
                            .message(t.getMessage())
                            .build());
        }

        ErrorInfo.ErrorInfoBuilder body = ErrorInfo.builder()
                .code(fe.getReason().code())
                .message(fe.getMessage());
        if (fe instanceof UpstreamException ue && ue.getStatus() > 0) {
            body.upstreamStatus(ue.getStatus()).detail(ue.getResponseBody());
        }
        return ResponseEntity.status(status(fe)).body(body.build());
    }

    static int status(ForwardingException fe) {
        return switch (fe.getReason()) {
            case CONFIGURATION_INVALID -> 400;
            case LOCK_UNAVAILABLE, DIRECTORY_READ_FAILURE, DIRECTORY_WRITE_FAILURE -> 503;
            case UPSTREAM_APPEND_FAILURE, UPSTREAM_CREATE_FAILURE, UPSTREAM_REQUEST_FAILURE -> {
                int s = fe instanceof UpstreamException ue ? ue.getStatus() : 0;
                yield s >= 400 && s <= 599 ? s : 502;
            }
            default -> 500;
        };
    }

    static Throwable unwrap(Throwable err) {
        Throwable t = err;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
