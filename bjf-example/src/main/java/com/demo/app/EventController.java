package com.demo.app;

import com.myorg.bjf.contracts.events.GroupEvent;
import com.myorg.bjf.contracts.events.IdentifyEvent;
import com.myorg.bjf.contracts.events.TrackEvent;
import com.myorg.bjf.forwarding.EventForwarder;
import com.myorg.bjf.forwarding.ForwardResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP entry points for the three analytics calls. Responses carry the upstream status and
 * body plus how the write was delivered.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class EventController {

    private final EventForwarder forwarder;

    @PostMapping("/identify")
    public CompletableFuture<ResponseEntity<Object>> identify(@RequestBody IdentifyEvent event) {
        return respond(forwarder.identify(event));
    }

    @PostMapping("/track")
    public CompletableFuture<ResponseEntity<Object>> track(@RequestBody TrackEvent event) {
        return respond(forwarder.track(event));
    }

    @PostMapping("/group")
    public CompletableFuture<ResponseEntity<Object>> group(@RequestBody GroupEvent event) {
        return respond(forwarder.group(event));
    }

    private CompletableFuture<ResponseEntity<Object>> respond(CompletableFuture<ForwardResult> f) {
        return f.handle((res, err) -> {
            if (err != null) {
                log.warn("Forwarding failed: {}", ForwardingErrors.unwrap(err).toString());
                return ForwardingErrors.toResponse(err);
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("outcome", res.outcome().tag());
            body.put("jobId", res.jobId());
            body.put("upstream", res.response().body());
            return ResponseEntity.status(res.response().status()).body(body);
        });
    }
}
