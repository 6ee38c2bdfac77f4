package ai.mergepilot.rebase;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Diagnostic buckets for the issues reported by a rejected verification. Classification only shapes the message;
 * it never changes what the engine does next.
 */
public enum IssueCategory {
    CONFLICT_MARKERS("Conflict markers still present in file", "conflict markers remain"),
    DUPLICATE_CODE("Duplicate code found in resolution", "duplicate code detected"),
    SYNTAX_ERRORS("Possible syntax errors in resolved file", "syntax errors detected"),
    OTHER("Other issues", "see issues for details");

    private final String message;
    private final String shortLabel;

    IssueCategory(String message, String shortLabel) {
        this.message = message;
        this.shortLabel = shortLabel;
    }

    public String message() {
        return message;
    }

    public String shortLabel() {
        return shortLabel;
    }

    public static IssueCategory classify(String issue) {
        var lower = issue.toLowerCase(Locale.ROOT);
        if (lower.contains("conflict marker")
                || issue.contains("<<<<<<<")
                || issue.contains("=======")
                || issue.contains(">>>>>>>")) {
            return CONFLICT_MARKERS;
        }
        if (lower.contains("duplicate") || lower.contains("repeated") || lower.contains("redundant")) {
            return DUPLICATE_CODE;
        }
        if (lower.contains("syntax") || lower.contains("error") || lower.contains("invalid")) {
            return SYNTAX_ERRORS;
        }
        return OTHER;
    }

    /** Summary of a rejection, e.g. {@code Resolution verification failed: Duplicate code found in resolution}. */
    public static String describe(List<String> issues) {
        Set<IssueCategory> found = EnumSet.noneOf(IssueCategory.class);
        var other = new ArrayList<String>();
        for (var issue : issues) {
            var category = classify(issue);
            if (category == OTHER) {
                other.add(issue);
            } else {
                found.add(category);
            }
        }

        var details = new ArrayList<String>();
        for (var category : found) {
            details.add(category.message());
        }
        if (!other.isEmpty()) {
            details.add(OTHER.message() + ": " + String.join("; ", other));
        }
        if (details.isEmpty()) {
            details.add("Unknown verification issues");
        }
        return "Resolution verification failed: " + String.join(". ", details);
    }

    /** The most specific category present, used for short progress messages. */
    public static IssueCategory primary(List<String> issues) {
        var best = OTHER;
        for (var issue : issues) {
            var category = classify(issue);
            if (category.ordinal() < best.ordinal()) {
                best = category;
            }
        }
        return best;
    }
}
