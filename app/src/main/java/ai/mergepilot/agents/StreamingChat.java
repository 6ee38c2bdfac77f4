package ai.mergepilot.agents;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Adapts a streaming chat call to a future of the complete reply text. */
final class StreamingChat {
    private static final Logger logger = LogManager.getLogger(StreamingChat.class);

    private StreamingChat() {}

    static CompletableFuture<String> send(StreamingChatModel model, List<ChatMessage> messages, String purpose) {
        var future = new CompletableFuture<String>();
        try {
            model.chat(messages, new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    logger.trace("{}: received {} chars", purpose, partialResponse.length());
                }

                @Override
                public void onCompleteResponse(ChatResponse response) {
                    var ai = response.aiMessage();
                    var text = ai == null ? null : ai.text();
                    if (text == null || text.isBlank()) {
                        future.completeExceptionally(new IllegalStateException("Empty response from model"));
                    } else {
                        future.complete(text);
                    }
                }

                @Override
                public void onError(Throwable error) {
                    logger.warn("{} failed: {}", purpose, error.getMessage());
                    future.completeExceptionally(error);
                }
            });
        } catch (RuntimeException e) {
            logger.warn("{} could not be sent", purpose, e);
            future.completeExceptionally(e);
        }
        return future;
    }
}
