package com.example.charging.dto;

import com.example.charging.model.QueueEntry;
import com.example.charging.model.QueueStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueEntryDTO {
    private Long id;
    private String userId;
    private Long resourceId;
    private Integer position;
    private QueueStatus status;
    private Integer estimatedWaitMinutes;
    private LocalDateTime reservationExpiry;
    private LocalDateTime joinedAt;
    private LocalDateTime updatedAt;

    public static QueueEntryDTO from(QueueEntry entry) {
        return QueueEntryDTO.builder()
                .id(entry.getId())
                .userId(entry.getUserId())
                .resourceId(entry.getResourceId())
                .position(entry.getPosition())
                .status(entry.getStatus())
                .estimatedWaitMinutes(entry.getEstimatedWaitMinutes())
                .reservationExpiry(entry.getReservationExpiry())
                .joinedAt(entry.getJoinedAt())
                .updatedAt(entry.getUpdatedAt())
                .build();
    }
}
