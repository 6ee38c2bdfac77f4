package ai.mergepilot.cli;

import static org.junit.jupiter.api.Assertions.*;

import ai.mergepilot.testutil.GitFixture;
import ai.mergepilot.testutil.ScriptedStreamingModel;
import ai.mergepilot.util.Json;
import ai.mergepilot.util.MergePilotConfigPaths;
import ai.mergepilot.util.RebaseSettings;
import dev.langchain4j.model.chat.StreamingChatModel;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.eclipse.jgit.lib.RepositoryState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MergePilotCliTest {
    private static final String RESOLVED_REPLY = "```\nline one\nline two merged\nline three\n```";
    private static final String PASSED_REPLY = "```json\n{\"passed\": true, \"issues\": []}\n```";

    @TempDir
    Path tempDir;

    private GitFixture fixture;
    private String originalConfigDir;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws Exception {
        originalConfigDir = System.getProperty(MergePilotConfigPaths.CONFIG_DIR_PROPERTY);
        System.setProperty(MergePilotConfigPaths.CONFIG_DIR_PROPERTY, tempDir.resolve("config").toString());
        fixture = new GitFixture(tempDir.resolve("repo"));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
        if (originalConfigDir == null) {
            System.clearProperty(MergePilotConfigPaths.CONFIG_DIR_PROPERTY);
        } else {
            System.setProperty(MergePilotConfigPaths.CONFIG_DIR_PROPERTY, originalConfigDir);
        }
    }

    private int run(Function<RebaseSettings, StreamingChatModel> factory, String... args) {
        var cli = new MergePilotCli(
                factory,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return new CommandLine(cli)
                .setErr(new PrintWriter(err, true, StandardCharsets.UTF_8))
                .execute(args);
    }

    private int run(StreamingChatModel model, String... args) {
        return run(settings -> model, args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testSuccessfulRebaseWritesJsonLinesLog() throws Exception {
        fixture.divergeOnSharedFile();
        var model = new ScriptedStreamingModel(RESOLVED_REPLY, PASSED_REPLY);
        var logFile = tempDir.resolve("events.jsonl");

        int exit = run(
                model,
                "--project", fixture.root.toString(),
                "--source", "feature",
                "--target", "main",
                "--log-file", logFile.toString());

        assertEquals(0, exit, stderr());
        assertEquals("line one\nline two merged\nline three\n", fixture.read("shared.txt"));
        assertTrue(stdout().contains("Rebase of feature onto main completed."));
        assertTrue(stdout().contains("[resolving_conflicts"));

        var lines = Files.readAllLines(logFile);
        assertFalse(lines.isEmpty());
        for (var line : lines) {
            assertTrue(Json.readTree(line).has("stage"), line);
        }
        assertEquals("completed", Json.readTree(lines.get(lines.size() - 1)).get("stage").asText());
    }

    @Test
    void testRejectedResolutionExitsWithFailureAndRollsBack() throws Exception {
        fixture.divergeOnSharedFile();
        var featureTip = fixture.tip("feature");
        var model = new ScriptedStreamingModel(
                RESOLVED_REPLY, "```json\n{\"passed\": false, \"issues\": [\"duplicate line two\"]}\n```");

        int exit = run(
                model,
                "--project", fixture.root.toString(),
                "--source", "feature",
                "--target", "main",
                "--max-attempts", "1");

        assertEquals(1, exit);
        assertTrue(stderr().contains("Rebase failed: 1/1 files could not be resolved automatically"));
        assertEquals(featureTip, fixture.tip("feature"));
        assertEquals(RepositoryState.SAFE, fixture.git.getRepository().getRepositoryState());
    }

    @Test
    void testValidationFailureIsUsageError() throws Exception {
        int exit = run(
                new ScriptedStreamingModel(),
                "--project", fixture.root.toString(),
                "--source", "feature",
                "--target", "main");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
        assertTrue(stderr().contains("Branch 'feature' does not exist"));
    }

    @Test
    void testInvalidMaxAttemptsIsUsageError() throws Exception {
        fixture.divergeOnSharedFile();
        int exit = run(
                new ScriptedStreamingModel(),
                "--project", fixture.root.toString(),
                "--source", "feature",
                "--target", "main",
                "--max-attempts", "0");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
    }

    @Test
    void testMissingApiKeyIsUsageError() throws Exception {
        fixture.divergeOnSharedFile();
        int exit = run(
                settings -> {
                    throw new IllegalStateException("Environment variable OPENAI_API_KEY is not set");
                },
                "--project", fixture.root.toString(),
                "--source", "feature",
                "--target", "main");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
        assertTrue(stderr().contains("OPENAI_API_KEY"));
    }

    @Test
    void testProjectMustBeADirectory() {
        int exit = run(
                new ScriptedStreamingModel(),
                "--project", tempDir.resolve("missing").toString(),
                "--source", "feature",
                "--target", "main");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
        assertTrue(stderr().contains("not a directory"));
    }

    @Test
    void testMissingRequiredOption() {
        assertEquals(CommandLine.ExitCode.USAGE, run(new ScriptedStreamingModel(), "--source", "feature"));
    }

    @Test
    void testContinueInProgressRebase() throws Exception {
        fixture.divergeOnSharedFile();
        var stopped = fixture.git.rebase().setUpstream("main").call();
        assertFalse(stopped.getStatus().isSuccessful());
        var model = new ScriptedStreamingModel(RESOLVED_REPLY, PASSED_REPLY);

        int exit = run(
                model,
                "--project", fixture.root.toString(),
                "--source", "feature",
                "--target", "main",
                "--continue");

        assertEquals(0, exit, stderr());
        assertTrue(stdout().contains("Continuing in-progress rebase"));
        assertEquals(RepositoryState.SAFE, fixture.git.getRepository().getRepositoryState());
        assertEquals("line one\nline two merged\nline three\n", fixture.read("shared.txt"));
    }
}
