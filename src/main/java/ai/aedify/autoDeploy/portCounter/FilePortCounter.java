package ai.aedify.autoDeploy.portCounter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * 로컬 JSON 파일({@code {"current_port": N}})에 카운터를 저장하는 백엔드.
 * <p>
 * 읽기-증가-쓰기 전체를 파일 배타 잠금(advisory lock) 안에서 수행합니다. 같은 JVM 안에서는
 * 겹치는 파일 잠금을 잡을 수 없으므로 경로별 {@link ReentrantLock}을 먼저 잡고 파일 잠금을 겁니다.
 * 같은 호스트에서 같은 경로를 쓰는 프로세스 사이에서만 안전하며, 여러 서버 인스턴스에는
 * {@link DatabasePortCounter}를 사용해야 합니다.
 */
@Slf4j
public class FilePortCounter implements PortCounter {

    static final String CURRENT_PORT_FIELD = "current_port";
    private static final long LOCK_POLL_INTERVAL_MILLIS = 20;

    // 같은 JVM 안에서 같은 파일을 쓰는 인스턴스끼리 공유
    private static final ConcurrentHashMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final Path counterFile;
    private final int initialPort;
    private final Duration lockTimeout;
    private final ObjectMapper objectMapper;
    private final ReentrantLock localLock;

    /**
     * @param counterFile 카운터 파일 경로
     * @param initialPort 파일이 없을 때 기록할 첫 포트
     * @param lockTimeout 잠금 대기 한도, {@code null}이면 무제한 대기
     */
    public FilePortCounter(Path counterFile, int initialPort, Duration lockTimeout, ObjectMapper objectMapper) {
        this.counterFile = counterFile.toAbsolutePath().normalize();
        this.initialPort = initialPort;
        this.lockTimeout = lockTimeout;
        this.objectMapper = objectMapper;
        this.localLock = LOCAL_LOCKS.computeIfAbsent(this.counterFile, path -> new ReentrantLock());
    }

    @Override
    public void initialize() {
        withExclusiveLock(channel -> {
            if (channel.size() == 0) {
                writeCounter(channel, initialPort);
                log.info("포트 카운터 초기화 완료: {} (초기값 {})", counterFile, initialPort);
            } else {
                log.debug("포트 카운터 파일이 이미 존재합니다: {} (현재값 {})", counterFile, readCounter(channel));
            }
            return null;
        });
    }

    @Override
    public int allocateNext() {
        return withExclusiveLock(channel -> {
            int current;
            if (channel.size() == 0) {
                // 아직 초기화되지 않은 파일은 첫 할당 시 초기값으로 시작
                log.info("포트 카운터 파일이 비어 있어 초기값 {}으로 시작합니다: {}", initialPort, counterFile);
                current = initialPort;
            } else {
                current = readCounter(channel);
            }

            if (current > MAX_PORT) {
                log.error("포트 카운터가 최대 포트를 넘었습니다: {} ({})", current, counterFile);
                throw new PortRangeExhaustedException(current);
            }

            int next = current + 1;
            writeCounter(channel, next);

            log.info("포트 할당: {} (다음 포트: {})", current, next);
            return current;
        });
    }

    @Override
    public String backendName() {
        return "file";
    }

    ReentrantLock getLocalLock() {
        return localLock;
    }

    private <T> T withExclusiveLock(LockedOperation<T> operation) {
        long deadline = lockTimeout != null ? System.nanoTime() + lockTimeout.toNanos() : 0L;

        acquireLocalLock();
        try {
            createParentDirectories();
            try (FileChannel channel = FileChannel.open(counterFile, CREATE, READ, WRITE)) {
                FileLock fileLock = acquireFileLock(channel, deadline);
                try {
                    return operation.apply(channel);
                } finally {
                    fileLock.release();
                }
            }
        } catch (IOException e) {
            String errorMessage = "포트 카운터 파일 접근 실패: " + counterFile + " (" + e.getMessage() + ")";
            log.error(errorMessage, e);
            throw new StorageUnavailableException(errorMessage, e);
        } finally {
            localLock.unlock();
        }
    }

    private void acquireLocalLock() {
        if (lockTimeout == null) {
            localLock.lock();
            return;
        }
        try {
            if (!localLock.tryLock(lockTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new LockTimeoutException(
                        String.format("포트 카운터 잠금 대기 시간 초과 (%d ms): %s", lockTimeout.toMillis(), counterFile));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("포트 카운터 잠금 대기 중 인터럽트 발생: " + counterFile, e);
        }
    }

    private FileLock acquireFileLock(FileChannel channel, long deadline) throws IOException {
        if (lockTimeout == null) {
            return channel.lock();
        }
        while (true) {
            FileLock fileLock = channel.tryLock();
            if (fileLock != null) {
                return fileLock;
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new LockTimeoutException(
                        String.format("포트 카운터 파일 잠금 대기 시간 초과 (%d ms): %s", lockTimeout.toMillis(), counterFile));
            }
            try {
                Thread.sleep(LOCK_POLL_INTERVAL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StorageUnavailableException("포트 카운터 파일 잠금 대기 중 인터럽트 발생: " + counterFile, e);
            }
        }
    }

    private void createParentDirectories() throws IOException {
        Path parent = counterFile.getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }
    }

    private int readCounter(FileChannel channel) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate((int) channel.size());
        long position = 0;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                break;
            }
            position += read;
        }

        JsonNode root = objectMapper.readTree(buffer.array());
        JsonNode currentPort = root != null ? root.get(CURRENT_PORT_FIELD) : null;
        if (currentPort == null || !currentPort.canConvertToInt() || !currentPort.isIntegralNumber()) {
            throw new IOException("카운터 파일 형식이 올바르지 않습니다: " + root);
        }
        return currentPort.intValue();
    }

    private void writeCounter(FileChannel channel, int value) throws IOException {
        ObjectNode record = objectMapper.createObjectNode();
        record.put(CURRENT_PORT_FIELD, value);
        byte[] bytes = objectMapper.writeValueAsBytes(record);

        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        long position = 0;
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
        channel.truncate(bytes.length);
        channel.force(true);
    }

    @FunctionalInterface
    private interface LockedOperation<T> {
        T apply(FileChannel channel) throws IOException;
    }
}
