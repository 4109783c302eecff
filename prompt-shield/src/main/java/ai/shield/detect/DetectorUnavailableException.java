package ai.shield.detect;

public class DetectorUnavailableException extends RuntimeException {
    public DetectorUnavailableException(String message) {
        super(message);
    }

    public DetectorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
