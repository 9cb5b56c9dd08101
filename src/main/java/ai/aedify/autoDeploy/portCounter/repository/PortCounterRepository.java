package ai.aedify.autoDeploy.portCounter.repository;

import ai.aedify.autoDeploy.entity.HostPortCounter;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PortCounterRepository extends JpaRepository<HostPortCounter, Integer> {

    // SELECT ... FOR UPDATE
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from HostPortCounter c where c.id = :id")
    Optional<HostPortCounter> findByIdForUpdate(@Param("id") int id);
}
