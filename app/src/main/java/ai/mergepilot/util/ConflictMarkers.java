package ai.mergepilot.util;

import java.util.regex.Pattern;

/** Detection of unresolved conflict markers in file content. */
public final class ConflictMarkers {
    // "<<<<<<< HEAD", "<<<<<<< Upstream, based on main", ...
    private static final Pattern START_MARKER = Pattern.compile("^<{7}(?:[ \\t].*)?\\r?$", Pattern.MULTILINE);
    private static final Pattern ANY_MARKER =
            Pattern.compile("^(?:<{7}|={7}|>{7}|\\|{7})(?:[ \\t].*)?\\r?$", Pattern.MULTILINE);

    private ConflictMarkers() {}

    /** True when some line opens a conflict region. */
    public static boolean hasConflictMarkers(String content) {
        return START_MARKER.matcher(content).find();
    }

    /** True when any marker line (open, base, separator or close) remains. */
    public static boolean hasAnyMarker(String content) {
        return ANY_MARKER.matcher(content).find();
    }
}
