package ai.aedify.autoDeploy.portCounter;

/**
 * 포트 카운터 저장소에 접근할 수 없거나 쓰기 도중 I/O 오류가 난 경우.
 * 재시도 가능한 인프라 장애로 취급합니다.
 */
public class StorageUnavailableException extends PortCounterException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
