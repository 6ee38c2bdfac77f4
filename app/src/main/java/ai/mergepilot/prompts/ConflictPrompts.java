package ai.mergepilot.prompts;

import ai.mergepilot.agents.ResolutionRequest;
import ai.mergepilot.agents.VerificationRequest;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Chat messages for the LLM-backed resolution and verification agents. */
public class ConflictPrompts {
    public static final ConflictPrompts instance = new ConflictPrompts();

    private static final String RESOLUTION_TEMPLATE = "conflict-resolution.mustache";
    private static final String VERIFICATION_TEMPLATE = "conflict-verification.mustache";

    private final Mustache resolutionTemplate;
    private final Mustache verificationTemplate;

    private ConflictPrompts() {
        MustacheFactory mf = new DefaultMustacheFactory("prompts");
        resolutionTemplate = mf.compile(RESOLUTION_TEMPLATE);
        verificationTemplate = mf.compile(VERIFICATION_TEMPLATE);
    }

    public List<ChatMessage> resolutionMessages(ResolutionRequest request, int contentLimit) {
        var context = templateContext(request.path(), request.content(), contentLimit, request.fileAttempt(), request.maxAttempts());
        return List.of(new SystemMessage(resolutionSystemIntro()), new UserMessage(render(resolutionTemplate, context)));
    }

    public List<ChatMessage> verificationMessages(VerificationRequest request, int contentLimit) {
        var context = templateContext(request.path(), request.content(), contentLimit, request.fileAttempt(), request.maxAttempts());
        return List.of(new SystemMessage(verificationSystemIntro()), new UserMessage(render(verificationTemplate, context)));
    }

    private static Map<String, Object> templateContext(String path, String content, int limit, int attempt, int maxAttempts) {
        Map<String, Object> context = new HashMap<>();
        context.put("path", path);
        context.put("content", truncate(content, limit));
        context.put("truncated", content.length() > limit);
        context.put("retry", attempt > 0);
        context.put("attempt", attempt);
        context.put("maxAttempts", maxAttempts);
        return context;
    }

    static String truncate(String content, int limit) {
        return content.length() <= limit ? content : content.substring(0, limit);
    }

    private static String render(Mustache template, Map<String, Object> context) {
        var writer = new StringWriter();
        template.execute(writer, context);
        return writer.toString();
    }

    private String resolutionSystemIntro() {
        return """
               You are an expert software engineer resolving git merge conflicts during a rebase.
               Conflict regions are delimited by lines starting with <<<<<<<, ======= and >>>>>>>.
               The side before ======= is the branch being rebased onto; the side after it is the commit being replayed.
               Produce the file as it should read once both changes are applied.
               Never leave conflict markers in your answer and never keep both versions of the same code.
               """;
    }

    private String verificationSystemIntro() {
        return """
               You are a meticulous code reviewer checking the result of an automated merge-conflict resolution.
               Judge only whether the conflicts were resolved correctly; do not suggest unrelated improvements.
               Answer strictly in the requested JSON format.
               """;
    }
}
