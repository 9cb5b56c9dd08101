package ai.aedify.autoDeploy.portCounter;

import ai.aedify.autoDeploy.entity.HostPortCounter;
import ai.aedify.autoDeploy.portCounter.repository.PortCounterRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 관계형 DB의 단일 행({@code port_counter.id = 1})에 카운터를 저장하는 백엔드.
 * <p>
 * 할당은 하나의 트랜잭션에서 행을 {@code PESSIMISTIC_WRITE}로 잠그고 갱신한 뒤 커밋합니다.
 * 중간에 실패하면 롤백되어 포트가 소모되지 않습니다. 같은 DB를 바라보는 여러 서버 인스턴스 사이에서도 안전합니다.
 */
@Slf4j
public class DatabasePortCounter implements PortCounter {

    static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS port_counter (
                id INT NOT NULL PRIMARY KEY,
                current_port INT NOT NULL,
                updated_at TIMESTAMP NULL
            )""";
    static final String COUNT_ROW_SQL = "SELECT COUNT(*) FROM port_counter WHERE id = ?";
    static final String INSERT_ROW_SQL =
            "INSERT INTO port_counter (id, current_port, updated_at) VALUES (?, ?, CURRENT_TIMESTAMP)";

    private final PortCounterRepository portCounterRepository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int initialPort;

    public DatabasePortCounter(PortCounterRepository portCounterRepository,
                               JdbcTemplate jdbcTemplate,
                               TransactionTemplate transactionTemplate,
                               int initialPort) {
        this.portCounterRepository = portCounterRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.initialPort = initialPort;
    }

    @Override
    public void initialize() {
        try {
            jdbcTemplate.execute(CREATE_TABLE_SQL);

            Integer rows = jdbcTemplate.queryForObject(COUNT_ROW_SQL, Integer.class, HostPortCounter.SINGLETON_ID);
            if (rows != null && rows > 0) {
                log.debug("포트 카운터 행이 이미 존재합니다.");
                return;
            }

            jdbcTemplate.update(INSERT_ROW_SQL, HostPortCounter.SINGLETON_ID, initialPort);
            log.info("포트 카운터 초기화 완료 (초기값 {})", initialPort);
        } catch (DataIntegrityViolationException e) {
            // 동시에 초기화한 다른 인스턴스의 insert가 먼저 커밋됨
            confirmRowExists(e);
            log.info("다른 인스턴스가 포트 카운터를 먼저 초기화했습니다.");
        } catch (DataAccessException e) {
            String errorMessage = "포트 카운터 테이블 초기화 실패: " + e.getMessage();
            log.error(errorMessage, e);
            throw new StorageUnavailableException(errorMessage, e);
        }
    }

    private void confirmRowExists(DataIntegrityViolationException insertFailure) {
        Integer rows;
        try {
            rows = jdbcTemplate.queryForObject(COUNT_ROW_SQL, Integer.class, HostPortCounter.SINGLETON_ID);
        } catch (DataAccessException e) {
            String errorMessage = "포트 카운터 행 확인 실패: " + e.getMessage();
            log.error(errorMessage, e);
            throw new StorageUnavailableException(errorMessage, e);
        }
        if (rows == null || rows == 0) {
            String errorMessage = "포트 카운터 행을 만들 수 없습니다: " + insertFailure.getMessage();
            log.error(errorMessage, insertFailure);
            throw new StorageUnavailableException(errorMessage, insertFailure);
        }
    }

    @Override
    public int allocateNext() {
        try {
            Integer port = transactionTemplate.execute(status -> {
                HostPortCounter counter = portCounterRepository.findByIdForUpdate(HostPortCounter.SINGLETON_ID)
                        .orElseThrow(() -> new NotInitializedException(
                                "포트 카운터 행이 없습니다. 초기화가 필요합니다."));

                int current = counter.advance();
                portCounterRepository.saveAndFlush(counter);

                log.info("포트 할당: {} (다음 포트: {})", current, counter.getCurrentPort());
                return current;
            });
            if (port == null) {
                throw new StorageUnavailableException("포트 할당 트랜잭션이 결과를 반환하지 않았습니다.");
            }
            return port;
        } catch (PortRangeExhaustedException e) {
            log.error("포트 카운터가 최대 포트를 넘었습니다: {}", e.getMessage());
            throw e;
        } catch (PessimisticLockingFailureException | QueryTimeoutException | TransactionTimedOutException e) {
            String errorMessage = "포트 카운터 행 잠금 대기 시간 초과: " + e.getMessage();
            log.error(errorMessage, e);
            throw new LockTimeoutException(errorMessage, e);
        } catch (InvalidDataAccessResourceUsageException e) {
            String errorMessage = "포트 카운터 테이블이 없습니다. 초기화가 필요합니다: " + e.getMessage();
            log.error(errorMessage, e);
            throw new NotInitializedException(errorMessage, e);
        } catch (DataAccessException | TransactionException e) {
            String errorMessage = "포트 카운터 DB 접근 실패: " + e.getMessage();
            log.error(errorMessage, e);
            throw new StorageUnavailableException(errorMessage, e);
        }
    }

    @Override
    public String backendName() {
        return "database";
    }
}
