package ai.aedify.autoDeploy.config;

import ai.aedify.autoDeploy.portCounter.DatabasePortCounter;
import ai.aedify.autoDeploy.portCounter.FilePortCounter;
import ai.aedify.autoDeploy.portCounter.PortCounter;
import ai.aedify.autoDeploy.portCounter.repository.PortCounterRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Paths;

@Configuration
public class PortCounterBackendConfig {

    @Bean
    @ConditionalOnProperty(prefix = "port-counter", name = "backend", havingValue = "file", matchIfMissing = true)
    public PortCounter filePortCounter(PortCounterConfig config, ObjectMapper objectMapper) {
        return new FilePortCounter(
                Paths.get(config.getFilePath()),
                config.getInitialPort(),
                config.getLockTimeout(),
                objectMapper
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "port-counter", name = "backend", havingValue = "database")
    public PortCounter databasePortCounter(PortCounterConfig config,
                                           PortCounterRepository portCounterRepository,
                                           JdbcTemplate jdbcTemplate,
                                           PlatformTransactionManager transactionManager) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        // 호출자의 트랜잭션과 분리해 반환 즉시 행 잠금을 푼다
        transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        transactionTemplate.setTimeout(config.getTransactionTimeoutSeconds());

        return new DatabasePortCounter(
                portCounterRepository,
                jdbcTemplate,
                transactionTemplate,
                config.getInitialPort()
        );
    }
}
