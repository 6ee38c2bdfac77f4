package ai.mergepilot.agents;

import static org.junit.jupiter.api.Assertions.*;

import ai.mergepilot.testutil.ScriptedStreamingModel;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LlmResolutionAgentTest {
    private static final String CONFLICTED = """
            int a = 1;
            <<<<<<< HEAD
            int b = 2;
            =======
            int b = 3;
            >>>>>>> feature
            """;

    @TempDir
    Path tempDir;

    private ResolutionRequest request(int attempt) throws Exception {
        var file = tempDir.resolve("Calc.java");
        Files.writeString(file, CONFLICTED);
        return new ResolutionRequest("Calc.java", file, CONFLICTED, attempt, 3);
    }

    @Test
    void testWritesFencedReplyToDisk() throws Exception {
        var model = new ScriptedStreamingModel("Here you go:\n```java\nint a = 1;\nint b = 3;\n```");
        var req = request(0);

        var outcome = new LlmResolutionAgent(model, 4000).resolve(req).get(5, TimeUnit.SECONDS);

        assertTrue(outcome.ok());
        assertTrue(outcome.mutatedContentAvailableOnDisk());
        assertEquals("int a = 1;\nint b = 3;\n", Files.readString(req.absolutePath()));

        var messages = model.requests.get(0).messages();
        assertInstanceOf(SystemMessage.class, messages.get(0));
        var user = ((UserMessage) messages.get(1)).singleText();
        assertTrue(user.contains("<conflict_file path=\"Calc.java\">"));
        assertTrue(user.contains("<<<<<<< HEAD"));
        assertFalse(user.contains("<previous_attempts>"));
    }

    @Test
    void testRetryPromptMentionsPreviousAttempts() throws Exception {
        var model = new ScriptedStreamingModel("```\nint b = 3;\n```");
        new LlmResolutionAgent(model, 4000).resolve(request(2)).get(5, TimeUnit.SECONDS);

        var user = ((UserMessage) model.requests.get(0).messages().get(1)).singleText();
        assertTrue(user.contains("<previous_attempts>"));
        assertTrue(user.contains("2 of 3 attempts used"));
    }

    @Test
    void testReplyWithoutCodeBlockFails() throws Exception {
        var model = new ScriptedStreamingModel("I cannot resolve this conflict.");
        var req = request(0);

        var outcome = new LlmResolutionAgent(model, 4000).resolve(req).get(5, TimeUnit.SECONDS);

        assertFalse(outcome.ok());
        assertEquals("Resolution reply did not contain a fenced code block", outcome.error());
        assertEquals(CONFLICTED, Files.readString(req.absolutePath()));
    }

    @Test
    void testOversizedFileIsRefusedWithoutModelCall() throws Exception {
        var model = new ScriptedStreamingModel();
        var outcome = new LlmResolutionAgent(model, 10).resolve(request(0)).get(5, TimeUnit.SECONDS);

        assertFalse(outcome.ok());
        assertTrue(outcome.error().startsWith("File too large for automatic resolution"));
        assertTrue(model.requests.isEmpty());
    }

    @Test
    void testModelErrorFailsTheFuture() throws Exception {
        var model = new ScriptedStreamingModel().thenFail(new RuntimeException("rate limited"));
        var future = new LlmResolutionAgent(model, 4000).resolve(request(0));

        var e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals("rate limited", e.getCause().getMessage());
    }

    @Test
    void testEmptyReplyFailsTheFuture() throws Exception {
        var model = new ScriptedStreamingModel("   ");
        var future = new LlmResolutionAgent(model, 4000).resolve(request(0));

        var e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals("Empty response from model", e.getCause().getMessage());
    }

    @Test
    void testExtractFile() {
        assertEquals("x\n```inner```\ny", LlmResolutionAgent.extractFile("```md\nx\n```inner```\ny\n```"));
        assertEquals("first", LlmResolutionAgent.extractFile("```\nfirst\n```\nthen some prose"));
        assertNull(LlmResolutionAgent.extractFile("no fences here"));
    }
}
