package com.example.charging.repository;

import com.example.charging.model.ReservationTimer;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface ReservationTimerRepository extends JpaRepository<ReservationTimer, Long> {

    List<ReservationTimer> findByQueueEntryId(Long queueEntryId);

    @Query("select t from ReservationTimer t where t.dueAt <= :now order by t.dueAt asc")
    List<ReservationTimer> findDue(@Param("now") LocalDateTime now, Pageable page);
}
