package ai.mergepilot.agents;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class VerificationResponseParserTest {

    @Test
    void testFencedJsonPassed() {
        var verdict = VerificationResponseParser.parse("""
                Looks good to me.
                ```json
                {"passed": true, "issues": []}
                ```
                """);
        assertTrue(verdict.passed());
        assertFalse(verdict.isError());
    }

    @Test
    void testFencedJsonRejectedWithIssues() {
        var verdict = VerificationResponseParser.parse("""
                ```json
                {
                  "passed": false,
                  "issues": ["Duplicate import of java.util.List", "Missing closing brace"]
                }
                ```
                """);
        assertFalse(verdict.passed());
        assertNull(verdict.error());
        assertEquals(List.of("Duplicate import of java.util.List", "Missing closing brace"), verdict.issues());
    }

    @Test
    void testBareObjectInProse() {
        var verdict = VerificationResponseParser.parse(
                "Here is my verdict: {\"passed\": false, \"issues\": [\"conflict markers remain\"]} thanks");
        assertFalse(verdict.passed());
        assertEquals(List.of("conflict markers remain"), verdict.issues());
    }

    @Test
    void testNestedObjectNeedsGreedyMatch() {
        var verdict = VerificationResponseParser.parse(
                "{\"passed\": false, \"issues\": [{\"line\": 3, \"text\": \"duplicate\"}]}");
        assertFalse(verdict.passed());
        assertEquals(List.of("{\"line\":3,\"text\":\"duplicate\"}"), verdict.issues());
    }

    @Test
    void testIssuesAsSingleString() {
        var verdict = VerificationResponseParser.parse("{\"passed\": false, \"issues\": \"syntax error on line 2\"}");
        assertEquals(List.of("syntax error on line 2"), verdict.issues());
    }

    @Test
    void testMissingOrNonBooleanPassedIsInvalid() {
        assertEquals(
                VerificationResponseParser.INVALID_FORMAT,
                VerificationResponseParser.parse("{\"passed\": \"yes\"}").error());
        assertEquals(
                VerificationResponseParser.INVALID_FORMAT,
                VerificationResponseParser.parse("{\"ok\": true}").error());
    }

    @Test
    void testNoJsonAtAll() {
        var verdict = VerificationResponseParser.parse("The resolution looks fine.");
        assertFalse(verdict.passed());
        assertTrue(verdict.isError());
        assertEquals(VerificationResponseParser.INVALID_FORMAT, verdict.error());
    }
}
