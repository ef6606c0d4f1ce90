package com.example.charging.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "queue_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_queue_entries_user_resource", columnNames = {"user_id", "resource_id"}),
        indexes = @Index(name = "idx_queue_entries_resource_status", columnList = "resource_id, status")
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueEntry {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(name = "resource_id", nullable = false)
    private Long resourceId;

    /** 1-based rank among queued entries; null once the entry left the line */
    private Integer position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QueueStatus status;

    private Integer estimatedWaitMinutes;

    /** set only while RESERVED */
    private LocalDateTime reservationExpiry;

    private int extensionCount;

    private LocalDateTime joinedAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public boolean isActive() {
        return status != null && status.isActive();
    }

    public boolean isQueued() {
        return status != null && status.isQueued();
    }

    public boolean isHead() {
        return position != null && position == 1;
    }
}
