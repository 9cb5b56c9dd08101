package ai.aedify.autoDeploy.portCounter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilePortCounterTest {

    private static final int INITIAL_PORT = 3003;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void 순차_할당_후_재초기화해도_다음_포트_유지() throws Exception {
        // given
        Path counterFile = tempDir.resolve("port_counter.json");
        FilePortCounter portCounter = new FilePortCounter(counterFile, INITIAL_PORT, null, objectMapper);
        portCounter.initialize();

        // when
        int first = portCounter.allocateNext();
        int second = portCounter.allocateNext();
        int third = portCounter.allocateNext();
        portCounter.initialize();

        // then
        assertThat(List.of(first, second, third)).containsExactly(3003, 3004, 3005);
        assertThat(storedPort(counterFile)).isEqualTo(3006);
    }

    @Test
    void N번_순차_할당은_P부터_연속된_값을_반환() throws Exception {
        // given
        Path counterFile = tempDir.resolve("port_counter.json");
        FilePortCounter portCounter = new FilePortCounter(counterFile, 5000, null, objectMapper);
        portCounter.initialize();

        // when
        List<Integer> ports = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            ports.add(portCounter.allocateNext());
        }

        // then
        assertThat(ports).isEqualTo(IntStream.range(5000, 5050).boxed().collect(Collectors.toList()));
        assertThat(storedPort(counterFile)).isEqualTo(5050);
    }

    @Test
    void initialize는_기존_값을_덮어쓰지_않음() throws Exception {
        // given
        Path counterFile = tempDir.resolve("port_counter.json");
        Files.writeString(counterFile, "{\"current_port\": 4100}");
        FilePortCounter portCounter = new FilePortCounter(counterFile, INITIAL_PORT, null, objectMapper);

        // when
        portCounter.initialize();
        portCounter.initialize();

        // then
        assertThat(storedPort(counterFile)).isEqualTo(4100);
        assertThat(portCounter.allocateNext()).isEqualTo(4100);
    }

    @Test
    void 초기화_없이_할당하면_초기값부터_시작() throws Exception {
        // given
        Path counterFile = tempDir.resolve("nested/dir/port_counter.json");
        FilePortCounter portCounter = new FilePortCounter(counterFile, INITIAL_PORT, null, objectMapper);

        // when
        int port = portCounter.allocateNext();

        // then
        assertThat(port).isEqualTo(INITIAL_PORT);
        assertThat(storedPort(counterFile)).isEqualTo(INITIAL_PORT + 1);
    }

    @Test
    void 이전_값보다_짧은_값을_쓰면_남은_바이트를_잘라냄() throws Exception {
        // given
        Path counterFile = tempDir.resolve("port_counter.json");
        Files.writeString(counterFile, "{\"current_port\":     9999}                    ");
        FilePortCounter portCounter = new FilePortCounter(counterFile, INITIAL_PORT, null, objectMapper);

        // when
        portCounter.allocateNext();

        // then
        assertThat(Files.readString(counterFile)).isEqualTo("{\"current_port\":10000}");
    }

    @Test
    void 동시_할당은_중복없이_연속된_범위를_반환() throws Exception {
        // given
        Path counterFile = tempDir.resolve("port_counter.json");
        // 같은 파일을 쓰는 워커 여러 개를 흉내
        FilePortCounter workerA = new FilePortCounter(counterFile, INITIAL_PORT, null, objectMapper);
        FilePortCounter workerB = new FilePortCounter(counterFile, INITIAL_PORT, null, objectMapper);
        workerA.initialize();

        int callers = 10;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);

        try {
            // when
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                FilePortCounter worker = i % 2 == 0 ? workerA : workerB;
                futures.add(executor.submit(() -> {
                    start.await();
                    return worker.allocateNext();
                }));
            }
            start.countDown();

            Set<Integer> ports = new HashSet<>();
            for (Future<Integer> future : futures) {
                ports.add(future.get(10, TimeUnit.SECONDS));
            }

            // then
            assertThat(ports).hasSize(callers);
            assertThat(ports).containsExactlyInAnyOrderElementsOf(
                    IntStream.range(INITIAL_PORT, INITIAL_PORT + callers).boxed().collect(Collectors.toList()));
            assertThat(storedPort(counterFile)).isEqualTo(INITIAL_PORT + callers);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void 최대_포트를_넘으면_PortRangeExhausted_이고_파일은_그대로() throws Exception {
        // given
        Path counterFile = tempDir.resolve("port_counter.json");
        Files.writeString(counterFile, "{\"current_port\":" + PortCounter.MAX_PORT + "}");
        FilePortCounter portCounter = new FilePortCounter(counterFile, INITIAL_PORT, null, objectMapper);

        // when
        int last = portCounter.allocateNext();

        // then
        assertThat(last).isEqualTo(PortCounter.MAX_PORT);
        assertThatThrownBy(portCounter::allocateNext)
                .isInstanceOf(PortRangeExhaustedException.class);
        assertThat(storedPort(counterFile)).isEqualTo(PortCounter.MAX_PORT + 1);
    }

    @Test
    void int_최대값에서도_음수로_넘어가지_않음() throws Exception {
        // given
        Path counterFile = tempDir.resolve("port_counter.json");
        String content = "{\"current_port\":" + Integer.MAX_VALUE + "}";
        Files.writeString(counterFile, content);
        FilePortCounter portCounter = new FilePortCounter(counterFile, INITIAL_PORT, null, objectMapper);

        // when & then
        assertThatThrownBy(portCounter::allocateNext)
                .isInstanceOf(PortRangeExhaustedException.class);
        assertThatThrownBy(portCounter::allocateNext)
                .isInstanceOf(PortRangeExhaustedException.class);
        assertThat(Files.readString(counterFile)).isEqualTo(content);
    }

    @Test
    void 파일_형식이_깨져있으면_StorageUnavailable_이고_내용은_그대로() throws Exception {
        // given
        Path counterFile = tempDir.resolve("port_counter.json");
        Files.writeString(counterFile, "not-json");
        FilePortCounter portCounter = new FilePortCounter(counterFile, INITIAL_PORT, null, objectMapper);

        // when & then
        assertThatThrownBy(portCounter::allocateNext)
                .isInstanceOf(StorageUnavailableException.class);
        assertThat(Files.readString(counterFile, StandardCharsets.UTF_8)).isEqualTo("not-json");
    }

    @Test
    void 저장소를_만들_수_없으면_StorageUnavailable() throws Exception {
        // given
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "regular file");
        FilePortCounter portCounter = new FilePortCounter(
                blocker.resolve("port_counter.json"), INITIAL_PORT, null, objectMapper);

        // when & then
        assertThatThrownBy(portCounter::initialize)
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessageContaining("port_counter.json");
        assertThatThrownBy(portCounter::allocateNext)
                .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    void 잠금_대기_시간을_넘기면_LockTimeout_이고_값은_그대로() throws Exception {
        // given
        Path counterFile = tempDir.resolve("port_counter.json");
        FilePortCounter portCounter = new FilePortCounter(
                counterFile, INITIAL_PORT, Duration.ofMillis(100), objectMapper);
        portCounter.initialize();

        ExecutorService holder = Executors.newSingleThreadExecutor();
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            holder.submit(() -> {
                portCounter.getLocalLock().lock();
                try {
                    locked.countDown();
                    release.await();
                } finally {
                    portCounter.getLocalLock().unlock();
                }
                return null;
            });
            assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

            // when & then
            assertThatThrownBy(portCounter::allocateNext)
                    .isInstanceOf(LockTimeoutException.class)
                    .isInstanceOf(StorageUnavailableException.class);
            assertThat(storedPort(counterFile)).isEqualTo(INITIAL_PORT);
        } finally {
            release.countDown();
            holder.shutdown();
            holder.awaitTermination(5, TimeUnit.SECONDS);
        }

        // 잠금이 풀리면 다시 할당 가능
        assertThat(portCounter.allocateNext()).isEqualTo(INITIAL_PORT);
    }

    private int storedPort(Path counterFile) throws IOException {
        return objectMapper.readTree(counterFile.toFile()).get("current_port").asInt();
    }
}
