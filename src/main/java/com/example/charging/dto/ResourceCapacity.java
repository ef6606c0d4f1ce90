package com.example.charging.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResourceCapacity {
    private Long resourceId;
    private boolean active;
    private boolean open;
    private Integer maxQueueLength;
    private Integer averageUsageMinutes;

    public boolean isAvailable() {
        return active && open;
    }
}
