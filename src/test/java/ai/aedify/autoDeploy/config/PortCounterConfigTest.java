package ai.aedify.autoDeploy.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PortCounterConfigTest {

    @Test
    void 트랜잭션_제한시간은_초_단위로_올림() {
        PortCounterConfig config = new PortCounterConfig();

        config.setTransactionTimeout(Duration.ofMillis(500));
        assertThat(config.getTransactionTimeoutSeconds()).isEqualTo(1);

        config.setTransactionTimeout(Duration.ofMillis(1500));
        assertThat(config.getTransactionTimeoutSeconds()).isEqualTo(2);

        config.setTransactionTimeout(Duration.ofSeconds(10));
        assertThat(config.getTransactionTimeoutSeconds()).isEqualTo(10);
    }

    @Test
    void 트랜잭션_제한시간은_최소_1초() {
        PortCounterConfig config = new PortCounterConfig();

        config.setTransactionTimeout(Duration.ZERO);

        assertThat(config.getTransactionTimeoutSeconds()).isEqualTo(1);
    }
}
