package ai.mergepilot.agents;

import ai.mergepilot.prompts.ConflictPrompts;
import ai.mergepilot.util.ConflictMarkers;
import dev.langchain4j.model.chat.StreamingChatModel;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Asks a chat model to review a resolved file. Files that still contain conflict markers are rejected without a
 * model call.
 */
public class LlmVerificationAgent implements VerificationAgent {
    private static final Logger logger = LogManager.getLogger(LlmVerificationAgent.class);

    private final StreamingChatModel model;
    private final int contentLimit;

    public LlmVerificationAgent(StreamingChatModel model, int contentLimit) {
        this.model = model;
        this.contentLimit = contentLimit;
    }

    @Override
    public CompletableFuture<VerificationVerdict> verify(VerificationRequest request) {
        if (ConflictMarkers.hasAnyMarker(request.content())) {
            logger.debug("{} still contains conflict markers", request.path());
            return CompletableFuture.completedFuture(
                    VerificationVerdict.rejected(List.of("Unresolved conflict markers remain in the file")));
        }
        var messages = ConflictPrompts.instance.verificationMessages(request, contentLimit);
        return StreamingChat.send(model, messages, "verify " + request.path())
                .thenApply(VerificationResponseParser::parse);
    }
}
