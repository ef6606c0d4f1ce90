package com.example.charging.controllers.impl;

import com.example.charging.controllers.CapacityOracle;
import com.example.charging.dto.ResourceCapacity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "capacity.source", havingValue = "remote")
public class RemoteCapacityOracle implements CapacityOracle {

    private final RestTemplate restTemplate;

    @Value("${capacity.api.base-url}")
    private String baseUrl;

    @Override
    public ResourceCapacity getCapacity(Long resourceId) {
        try {
            String url = baseUrl + "/stations/" + resourceId + "/capacity";
            ResourceCapacity capacity = restTemplate.getForObject(url, ResourceCapacity.class);
            if (capacity != null && capacity.getResourceId() == null) {
                capacity.setResourceId(resourceId);
            }
            return capacity;
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("Station {} is unknown to the capacity service", resourceId);
            return null;
        } catch (Exception e) {
            log.error("Failed to load capacity of station {}: {}", resourceId, e.getMessage());
            return null;
        }
    }
}
