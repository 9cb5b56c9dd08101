package ai.aedify.autoDeploy.portCounter;

/**
 * 초기화 전에 포트 할당을 시도한 경우. 운영자 조치가 필요한 설정 오류입니다.
 */
public class NotInitializedException extends PortCounterException {

    public NotInitializedException(String message) {
        super(message);
    }

    public NotInitializedException(String message, Throwable cause) {
        super(message, cause);
    }
}
