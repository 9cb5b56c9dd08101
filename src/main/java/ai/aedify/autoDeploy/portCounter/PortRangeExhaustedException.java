package ai.aedify.autoDeploy.portCounter;

/**
 * 저장된 값이 유효한 TCP 포트 범위를 벗어나 더 이상 할당할 수 없는 경우. 저장된 값은 바뀌지 않습니다.
 */
public class PortRangeExhaustedException extends PortCounterException {

    public PortRangeExhaustedException(int currentPort) {
        super(String.format("할당 가능한 호스트 포트가 없습니다 (현재값 %d, 최대 %d)", currentPort, PortCounter.MAX_PORT));
    }
}
