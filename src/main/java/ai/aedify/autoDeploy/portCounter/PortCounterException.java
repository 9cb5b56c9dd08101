package ai.aedify.autoDeploy.portCounter;

public abstract class PortCounterException extends RuntimeException {

    protected PortCounterException(String message) {
        super(message);
    }

    protected PortCounterException(String message, Throwable cause) {
        super(message, cause);
    }
}
