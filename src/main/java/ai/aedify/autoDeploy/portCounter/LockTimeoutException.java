package ai.aedify.autoDeploy.portCounter;

public class LockTimeoutException extends StorageUnavailableException {

    public LockTimeoutException(String message) {
        super(message);
    }

    public LockTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
