package ai.aedify.autoDeploy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "port-counter")
public class PortCounterConfig {

    /**
     * file: 단일 호스트 전용, database: 여러 인스턴스가 같은 DB를 공유할 때
     */
    private String backend = "file";
    private int initialPort = 3003;
    private int containerPort = 3000;
    private String filePath = "port_counter.json";

    // null이면 파일 잠금을 무제한 대기
    private Duration lockTimeout;
    private Duration transactionTimeout = Duration.ofSeconds(10);

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public int getInitialPort() {
        return initialPort;
    }

    public void setInitialPort(int initialPort) {
        this.initialPort = initialPort;
    }

    public int getContainerPort() {
        return containerPort;
    }

    public void setContainerPort(int containerPort) {
        this.containerPort = containerPort;
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public Duration getTransactionTimeout() {
        return transactionTimeout;
    }

    public void setTransactionTimeout(Duration transactionTimeout) {
        this.transactionTimeout = transactionTimeout;
    }

    /**
     * 트랜잭션 제한 시간(초). 1초 미만은 0으로 잘리지 않도록 올림하며 최소 1초입니다.
     */
    public int getTransactionTimeoutSeconds() {
        long millis = transactionTimeout.toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.max(1, Math.min(seconds, Integer.MAX_VALUE));
    }
}
