package ai.mergepilot.agents;

import ai.mergepilot.prompts.ConflictPrompts;
import dev.langchain4j.model.chat.StreamingChatModel;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Resolves a conflicted file by asking a chat model for the complete merged file and writing the reply back to the
 * working tree.
 */
public class LlmResolutionAgent implements ResolutionAgent {
    private static final Logger logger = LogManager.getLogger(LlmResolutionAgent.class);

    // reply that ends with the closing fence: take everything up to it, so fences inside the file survive
    private static final Pattern WHOLE_REPLY_BLOCK = Pattern.compile("```[^\\n]*\\n(.*?)\\n?```\\s*$", Pattern.DOTALL);
    private static final Pattern FIRST_BLOCK = Pattern.compile("```[^\\n]*\\n(.*?)\\n?```", Pattern.DOTALL);

    private final StreamingChatModel model;
    private final int contentLimit;

    public LlmResolutionAgent(StreamingChatModel model, int contentLimit) {
        this.model = model;
        this.contentLimit = contentLimit;
    }

    @Override
    public CompletableFuture<ResolutionOutcome> resolve(ResolutionRequest request) {
        if (request.content().length() > contentLimit) {
            return CompletableFuture.completedFuture(ResolutionOutcome.failed(
                    "File too large for automatic resolution (%d characters, limit %d)"
                            .formatted(request.content().length(), contentLimit)));
        }
        var messages = ConflictPrompts.instance.resolutionMessages(request, contentLimit);
        logger.debug("Requesting resolution of {} (attempt {})", request.path(), request.fileAttempt() + 1);
        return StreamingChat.send(model, messages, "resolve " + request.path())
                .thenApply(reply -> apply(request, reply));
    }

    private ResolutionOutcome apply(ResolutionRequest request, String reply) {
        var resolved = extractFile(reply);
        if (resolved == null) {
            return ResolutionOutcome.failed("Resolution reply did not contain a fenced code block");
        }
        if (request.content().endsWith("\n") && !resolved.endsWith("\n")) {
            resolved = resolved + "\n";
        }
        try {
            Files.writeString(request.absolutePath(), resolved);
        } catch (IOException e) {
            logger.warn("Failed to write resolution of {}", request.path(), e);
            return ResolutionOutcome.failed("Failed to write resolved file: " + e.getMessage());
        }
        logger.debug("Wrote {} chars to {}", resolved.length(), request.path());
        return ResolutionOutcome.resolved();
    }

    static @Nullable String extractFile(String reply) {
        var text = reply.strip();
        var matcher = WHOLE_REPLY_BLOCK.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        matcher = FIRST_BLOCK.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }
}
