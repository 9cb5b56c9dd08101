package ai.aedify.autoDeploy.entity;

import ai.aedify.autoDeploy.portCounter.PortCounter;
import ai.aedify.autoDeploy.portCounter.PortRangeExhaustedException;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Getter
@ToString
@Table(name = "port_counter")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class HostPortCounter {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id")
    private int id;

    @Column(name = "current_port", nullable = false)
    private int currentPort;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * 현재 포트를 반환하고 카운터를 1 증가시킵니다. 잠금을 잡은 트랜잭션 안에서만 호출해야 합니다.
     *
     * @throws PortRangeExhaustedException 현재 값이 최대 포트를 넘은 경우 (값은 바뀌지 않음)
     */
    public int advance() {
        int current = this.currentPort;
        if (current > PortCounter.MAX_PORT) {
            throw new PortRangeExhaustedException(current);
        }
        this.currentPort = current + 1;
        this.updatedAt = LocalDateTime.now();
        return current;
    }
}
