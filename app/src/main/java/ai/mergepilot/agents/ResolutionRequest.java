package ai.mergepilot.agents;

import java.nio.file.Path;

/**
 * A conflicted file handed to a {@link ResolutionAgent}.
 *
 * @param path repository-relative path
 * @param absolutePath location of the file in the working tree; the agent writes the resolved content here
 * @param content current file content, conflict markers included
 * @param fileAttempt number of rejected verifications so far for this file
 * @param maxAttempts ceiling for {@code fileAttempt}
 */
public record ResolutionRequest(String path, Path absolutePath, String content, int fileAttempt, int maxAttempts) {
    public boolean isRetry() {
        return fileAttempt > 0;
    }
}
