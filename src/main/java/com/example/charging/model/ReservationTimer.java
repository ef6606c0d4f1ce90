package com.example.charging.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "reservation_timers",
        indexes = {
                @Index(name = "idx_reservation_timers_due", columnList = "due_at"),
                @Index(name = "idx_reservation_timers_entry", columnList = "queue_entry_id")
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReservationTimer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "queue_entry_id", nullable = false)
    private Long queueEntryId;

    @Column(name = "resource_id", nullable = false)
    private Long resourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Kind kind;

    /** the deadline this timer stands for */
    @Column(name = "fire_at", nullable = false)
    private LocalDateTime fireAt;

    /** next time the sweeper picks it up; moves forward on failed attempts */
    @Column(name = "due_at", nullable = false)
    private LocalDateTime dueAt;

    private int attempts;

    public enum Kind { WARNING, EXPIRY }
}
