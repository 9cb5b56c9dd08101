package ai.aedify.autoDeploy.portCounter;

/**
 * 배포되는 애플리케이션마다 고유한 호스트 포트를 발급하는 카운터.
 * <p>
 * 발급되는 포트는 항상 증가하며 재사용되지 않습니다. 구현체는 여러 요청이 동시에
 * 호출해도 같은 포트를 두 번 돌려주지 않아야 하고, 실패한 호출은 저장된 값을 바꾸지 않아야 합니다.
 */
public interface PortCounter {

    int MAX_PORT = 65535;

    /**
     * 저장소(파일 또는 테이블/행)가 없으면 초기 포트 값으로 생성합니다.
     * 이미 값이 있으면 아무것도 하지 않습니다.
     *
     * @throws StorageUnavailableException 저장소를 만들거나 접근할 수 없는 경우
     */
    void initialize();

    /**
     * 현재 포트 값을 반환하고 저장된 값을 1 증가시킵니다.
     *
     * @return 이번 배포에 할당된 호스트 포트
     * @throws StorageUnavailableException 저장소에 접근할 수 없는 경우
     * @throws NotInitializedException     초기화되지 않은 경우
     * @throws LockTimeoutException        제한 시간 안에 잠금을 얻지 못한 경우
     * @throws PortRangeExhaustedException  저장된 값이 {@link #MAX_PORT}를 넘은 경우
     */
    int allocateNext();

    /**
     * 로그와 헬스 체크에 표시할 백엔드 이름.
     */
    String backendName();
}
