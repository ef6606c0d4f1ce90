package com.example.charging.controllers;

import com.example.charging.dto.ResourceCapacity;

public interface CapacityOracle {

    /** Current flags and limits of a station, or null when it is unknown or unreachable */
    ResourceCapacity getCapacity(Long resourceId);
}
