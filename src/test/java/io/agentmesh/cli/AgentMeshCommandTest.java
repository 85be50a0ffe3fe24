package io.agentmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class AgentMeshCommandTest {

    @Test
    void settingsPrintsResolvedPaths() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-cli-settings-");
        try {
            Files.writeString(root.resolve("agentmesh-settings.json"), "{\"deliveryMode\":\"user_message\"}",
                    StandardCharsets.UTF_8);

            Run run = execute("--root", root.toString(), "settings");

            Assertions.assertEquals(0, run.code());
            JsonNode out = Jsons.readTree(run.stdout());
            Assertions.assertEquals("user_message", out.path("deliveryMode").asText());
            Assertions.assertTrue(out.path("auditFile").asText().endsWith("audit.log"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void simulateRunsTheMeshToItsSummary() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-cli-simulate-");
        try {
            Run run = execute("--root", root.toString(), "simulate", "--agents", "2", "--timeout-ms", "10000");

            Assertions.assertEquals(0, run.code());
            JsonNode out = Jsons.readTree(run.stdout());
            Assertions.assertEquals("inbox", out.path("deliveryMode").asText());
            Assertions.assertTrue(out.path("quiescent").asBoolean());
            Assertions.assertEquals(1, out.path("rootNotes").size());
            Assertions.assertTrue(out.path("rootNotes").get(0).asText().startsWith(Prompts.SUMMARY_HEADER));
            Assertions.assertEquals(3, out.path("archive").size());
            for (JsonNode call : out.path("toolCalls")) {
                Assertions.assertFalse(call.path("error").asBoolean(), call.toString());
            }
            Assertions.assertTrue(Files.size(root.resolve("audit").resolve("audit.log")) > 0L);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownDeliveryModeFails() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-cli-bad-");
        try {
            Run run = execute("--root", root.toString(), "simulate", "--delivery", "fax");
            Assertions.assertNotEquals(0, run.code());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Run execute(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CommandLine commandLine = new CommandLine(new AgentMeshCommand());
        commandLine.setErr(new PrintWriter(new ByteArrayOutputStream(), true));
        int code;
        try {
            System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
            code = commandLine.execute(args);
        } finally {
            System.setOut(original);
        }
        return new Run(code, buffer.toString(StandardCharsets.UTF_8));
    }

    private record Run(int code, String stdout) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
