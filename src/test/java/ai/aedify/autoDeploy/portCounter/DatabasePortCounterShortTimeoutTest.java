package ai.aedify.autoDeploy.portCounter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "port-counter.backend=database",
        "port-counter.transaction-timeout=500ms"
})
class DatabasePortCounterShortTimeoutTest {

    @Autowired
    private PortCounter portCounter;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("DROP TABLE IF EXISTS port_counter");
        portCounter.initialize();
    }

    @Test
    void 제한시간이_1초_미만이어도_할당_성공() {
        assertThat(portCounter.allocateNext()).isEqualTo(3003);
        assertThat(portCounter.allocateNext()).isEqualTo(3004);
    }
}
