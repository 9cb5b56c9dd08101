package ai.aedify.autoDeploy.portCounter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 서버 시작 시 포트 카운터를 한 번 초기화합니다.
 * 초기화에 실패해도 서버는 계속 실행되며, /health 에 misconfigured 로 표시됩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PortCounterInitializer implements ApplicationRunner {

    private final PortCounter portCounter;

    private volatile boolean initialized;
    private volatile String lastError;

    @Override
    public void run(ApplicationArguments args) {
        initialize();
    }

    public void initialize() {
        try {
            portCounter.initialize();
            initialized = true;
            lastError = null;
            log.info("포트 카운터 준비 완료 (backend: {})", portCounter.backendName());
        } catch (PortCounterException e) {
            initialized = false;
            lastError = e.getMessage();
            log.error("포트 카운터 초기화 실패 (backend: {}). 배포 요청은 포트를 할당받지 못합니다: {}",
                    portCounter.backendName(), e.getMessage(), e);
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public String getLastError() {
        return lastError;
    }

    public String getBackendName() {
        return portCounter.backendName();
    }
}
