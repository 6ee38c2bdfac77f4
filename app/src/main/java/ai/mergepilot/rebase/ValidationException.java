package ai.mergepilot.rebase;

public class ValidationException extends Exception {
    private final ValidationError error;

    public ValidationException(ValidationError error, String message) {
        super(message);
        this.error = error;
    }

    public ValidationException(ValidationError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ValidationError error() {
        return error;
    }
}
