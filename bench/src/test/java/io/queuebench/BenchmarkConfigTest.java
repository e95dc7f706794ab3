package io.queuebench;

import static org.junit.jupiter.api.Assertions.*;

import io.queuebench.backend.BackendKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

class BenchmarkConfigTest {

    static BenchmarkConfig config(BackendKind backend, int workers, int payloadBytes) {
        return new BenchmarkConfig(BenchmarkConfig.Role.WORKERS, backend, workers, 1000, Duration.ofSeconds(60),
                payloadBytes, Duration.ofMillis(10), Duration.ofMillis(100), 16, "jobs_stream", "workers",
                10, Duration.ofMillis(1000), 10, Duration.ofSeconds(30), 100, Duration.ofSeconds(1),
                Path.of("metrics.jsonl"));
    }

    @Test
    void rowVariantsBackOffByThePollInterval() {
        BenchmarkConfig c = config(BackendKind.SKIP_LOCKED, 10, 1024);
        assertEquals(Duration.ofMillis(100), c.emptyBackoff());
        assertEquals(Duration.ofMillis(100), c.errorBackoff());
    }

    @Test
    void streamVariantWaitsInsideItsBlockingRead() {
        BenchmarkConfig c = config(BackendKind.STREAM_GROUP, 10, 1024);
        assertEquals(Duration.ZERO, c.emptyBackoff());
        assertEquals(Duration.ofMillis(1000), c.errorBackoff());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> config(BackendKind.SKIP_LOCKED, 0, 1024));
        assertThrows(IllegalArgumentException.class, () -> config(BackendKind.SKIP_LOCKED, 10, 99));
        assertDoesNotThrow(() -> config(BackendKind.SKIP_LOCKED, 10, 100));
    }
}
