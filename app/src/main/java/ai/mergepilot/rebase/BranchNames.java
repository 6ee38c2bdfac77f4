package ai.mergepilot.rebase;

import java.util.regex.Pattern;

/** Normalisation of user-supplied branch names before they reach the repository layer. */
public final class BranchNames {
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_/-]");

    private BranchNames() {}

    /** Strips every character outside {@code [A-Za-z0-9_/-]}. */
    public static String sanitize(String name) {
        return DISALLOWED.matcher(name).replaceAll("");
    }
}
