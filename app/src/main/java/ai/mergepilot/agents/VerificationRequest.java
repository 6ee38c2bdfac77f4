package ai.mergepilot.agents;

/**
 * A resolved file handed to a {@link VerificationAgent}.
 *
 * @param fileAttempt number of rejected verifications so far for this file
 */
public record VerificationRequest(String path, String content, int fileAttempt, int maxAttempts) {}
