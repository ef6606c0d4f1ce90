package com.example.charging.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(
        name = "usage_sessions",
        indexes = @Index(name = "idx_usage_sessions_entry", columnList = "queue_entry_id, ended_at")
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UsageSession {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "queue_entry_id", nullable = false)
    private Long queueEntryId;

    @Column(name = "resource_id", nullable = false)
    private Long resourceId;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "ended_at")
    private LocalDateTime endedAt;

    // meter readings are passed through as given by the caller
    @Column(precision = 10, scale = 3)
    private BigDecimal startMeterReading;

    @Column(precision = 10, scale = 3)
    private BigDecimal endMeterReading;

    @Column(length = 50)
    private String stopReason;

    public boolean isOpen() {
        return endedAt == null;
    }
}
