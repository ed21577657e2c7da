package io.fairsched.error;

import io.fairsched.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/** Appends one JSON line per failed task. */
public class FileDeadLetterSink implements DeadLetterSink {
    private static final Logger LOG = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;

    public FileDeadLetterSink(Path file) throws IOException {
        this.file = file;
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(String stage, Task task, Throwable e) {
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"taskId\":%d,\"tenant\":%d,\"priority\":%d,\"actualCostNanos\":%d,\"error\":\"%s\"}%n",
                Instant.now(), stage, task.id(), task.tenantId(), task.basePriority(), task.actualCostNanos(),
                safe(String.valueOf(e)));
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            LOG.warn("Could not record failed task {} in {}: {}", task.id(), file, io.toString());
        }
    }

    private static String safe(String s) { return s.replace("\\", "\\\\").replace("\"", "'").replace("\n", " "); }
}
