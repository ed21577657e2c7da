package io.fairsched.sim;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SimulateCommandTest {
    @TempDir
    Path dir;

    @Test
    void runs_load_and_prints_report() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        int code = new CommandLine(new SimulateCommand(out)).execute(
                "--duration-seconds", "1",
                "--drain-seconds", "5",
                "--workers", "2",
                "--seed", "42",
                "--dead-letter-file", dir.resolve("dead.jsonl").toString());
        assertEquals(0, code);
        String report = buf.toString(StandardCharsets.UTF_8);
        assertTrue(report.contains("SCHEDULER REPORT"), report);
        assertTrue(report.contains("Tenant  1: weight=200"), report);
        assertTrue(report.contains("Tenant  3: weight= 50"), report);
        assertTrue(report.contains("Worker 01"), report);
        assertTrue(report.contains("Latency histogram"), report);
    }

    @Test
    void rejects_negative_duration() {
        int code = new CommandLine(new SimulateCommand(new PrintStream(new ByteArrayOutputStream())))
                .execute("--duration-seconds", "-1", "--dead-letter-file", dir.resolve("dead.jsonl").toString());
        assertEquals(2, code);
    }
}
