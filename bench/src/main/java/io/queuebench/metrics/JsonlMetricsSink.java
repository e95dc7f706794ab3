package io.queuebench.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.queuebench.model.MetricsSnapshot;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes each snapshot as one JSON object per line, appending to a file. Blocking; call it off the
 * event loop.
 */
public class JsonlMetricsSink implements MetricsSink {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final Lock appendLock = new ReentrantLock();
    final Path file;

    public JsonlMetricsSink(Path file) {
        this.file = file;
    }

    @Override
    public void write(MetricsSnapshot snapshot) throws IOException {
        final String json;
        try {
            json = om.writeValueAsString(snapshot);
        } catch (Exception e) {
            throw new IOException("serialize failed", e);
        }
        final byte[] data = (json + "\n").getBytes(StandardCharsets.UTF_8);

        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);

        appendLock.lock();
        try (FileChannel ch = FileChannel.open(
                file,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND)) {

            ByteBuffer buf = ByteBuffer.wrap(data);
            while (buf.hasRemaining()) {
                int written = ch.write(buf);
                if (written == 0) {
                    Thread.onSpinWait();
                }
            }
        } finally {
            appendLock.unlock();
        }
    }
}
