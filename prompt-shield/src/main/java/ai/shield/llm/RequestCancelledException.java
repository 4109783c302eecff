package ai.shield.llm;

public class RequestCancelledException extends RuntimeException {
    public RequestCancelledException(String message) {
        super(message);
    }
}
