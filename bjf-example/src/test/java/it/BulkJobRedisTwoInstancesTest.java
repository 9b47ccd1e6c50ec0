package it;

import com.demo.app.DemoAppApplication;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class BulkJobRedisTwoInstancesTest extends AbstractIntegrationTest {

    @Test
    @SuppressWarnings("rawtypes")
    void concurrentTracksAcrossInstancesShareOneJob() throws Exception {
        String userId = "u-" + UUID.randomUUID();

        try (AppInstance a = new AppInstance(DemoAppApplication.class, "bjf-it-a", "redis", upstream);
             AppInstance b = new AppInstance(DemoAppApplication.class, "bjf-it-b", "redis", upstream)) {

            ExecutorService pool = Executors.newFixedThreadPool(6);
            try {
                List<CompletableFuture<ResponseEntity<Map>>> calls = new ArrayList<>();
                for (int i = 0; i < 6; i++) {
                    int port = (i % 2 == 0 ? a : b).port();
                    Map<String, Object> body = Map.of("userId", userId, "event", "Viewed Page " + i);
                    calls.add(CompletableFuture.supplyAsync(() -> Http.post(rt, port, "/track", body), pool));
                }

                for (CompletableFuture<ResponseEntity<Map>> c : calls) {
                    assertThat(c.get().getStatusCode().value()).isEqualTo(200);
                }
            } finally {
                pool.shutdownNow();
            }

            await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
                assertThat(upstream.ledger().count("create", "/bulk/events")).isEqualTo(1);
                assertThat(upstream.ledger().count("append", "/bulk/events")).isEqualTo(5);
            });

            assertThat(Metrics.total(rt, "bjf.job.created", a, b)).isEqualTo(1);
            assertThat(Metrics.total(rt, "bjf.job.appended", a, b)).isEqualTo(5);
        }
    }

    @Test
    @SuppressWarnings("rawtypes")
    void secondInstanceAppendsToJobOpenedByFirst() {
        String userId = "u-" + UUID.randomUUID();

        try (AppInstance a = new AppInstance(DemoAppApplication.class, "bjf-it-a", "redis", upstream);
             AppInstance b = new AppInstance(DemoAppApplication.class, "bjf-it-b", "redis", upstream)) {

            ResponseEntity<Map> first = Http.post(rt, a.port(), "/track", Map.of("userId", userId, "event", "Signed Up"));
            ResponseEntity<Map> second = Http.post(rt, b.port(), "/track", Map.of("userId", userId, "event", "Logged In"));

            assertThat(first.getBody()).containsEntry("outcome", "created");
            assertThat(second.getBody()).containsEntry("outcome", "appended");
            assertThat(second.getBody().get("jobId")).isEqualTo(first.getBody().get("jobId"));
        }
    }
}
