package com.example.charging.service.impl;

import com.example.charging.controllers.CapacityOracle;
import com.example.charging.dto.ResourceCapacity;
import com.example.charging.repository.StationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "capacity.source", havingValue = "jpa", matchIfMissing = true)
public class JpaCapacityOracle implements CapacityOracle {

    private final StationRepository stationRepository;

    @Override
    public ResourceCapacity getCapacity(Long resourceId) {
        return stationRepository.findById(resourceId)
                .map(station -> ResourceCapacity.builder()
                        .resourceId(station.getId())
                        .active(station.isActive())
                        .open(station.isOpen())
                        .maxQueueLength(station.getMaxQueueLength())
                        .averageUsageMinutes(station.getAverageSessionMinutes())
                        .build())
                .orElseGet(() -> {
                    log.warn("Station {} not found", resourceId);
                    return null;
                });
    }
}
