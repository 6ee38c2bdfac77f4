package ai.mergepilot.agents;

import ai.mergepilot.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Extracts a {@link VerificationVerdict} from a model reply. Candidates are tried in order: a ```json fenced block,
 * an object starting with {@code "passed"}, then the whole reply. A reply with no object carrying a boolean
 * {@code passed} yields a failed verdict.
 */
public final class VerificationResponseParser {
    private static final Logger logger = LogManager.getLogger(VerificationResponseParser.class);

    public static final String INVALID_FORMAT = "Invalid verification result format";

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Pattern PASSED_OBJECT = Pattern.compile("\\{\\s*\"passed\".*?}", Pattern.DOTALL);
    private static final Pattern PASSED_OBJECT_GREEDY = Pattern.compile("\\{\\s*\"passed\".*}", Pattern.DOTALL);

    private VerificationResponseParser() {}

    public static VerificationVerdict parse(String reply) {
        var candidates = new ArrayList<String>();
        addMatch(candidates, JSON_FENCE, reply, 1);
        addMatch(candidates, PASSED_OBJECT, reply, 0);
        addMatch(candidates, PASSED_OBJECT_GREEDY, reply, 0);
        candidates.add(reply.strip());

        for (var candidate : candidates) {
            var verdict = tryParse(candidate);
            if (verdict != null) {
                return verdict;
            }
        }
        logger.debug("No verdict found in reply: {}", reply);
        return VerificationVerdict.failed(INVALID_FORMAT);
    }

    private static void addMatch(List<String> candidates, Pattern pattern, String text, int group) {
        var matcher = pattern.matcher(text);
        if (matcher.find()) {
            candidates.add(matcher.group(group));
        }
    }

    private static @Nullable VerificationVerdict tryParse(String candidate) {
        JsonNode node;
        try {
            node = Json.readTree(candidate);
        } catch (JsonProcessingException e) {
            logger.trace("Candidate is not JSON: {}", e.getOriginalMessage());
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        var passed = node.get("passed");
        if (passed == null || !passed.isBoolean()) {
            return null;
        }
        if (passed.booleanValue()) {
            return VerificationVerdict.accepted();
        }
        var issues = new ArrayList<String>();
        var issuesNode = node.get("issues");
        if (issuesNode != null && issuesNode.isArray()) {
            for (var issue : issuesNode) {
                issues.add(issue.isTextual() ? issue.asText() : issue.toString());
            }
        } else if (issuesNode != null && issuesNode.isTextual()) {
            issues.add(issuesNode.asText());
        }
        return VerificationVerdict.rejected(issues);
    }
}
