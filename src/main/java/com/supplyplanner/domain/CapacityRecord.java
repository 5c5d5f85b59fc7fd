package com.supplyplanner.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class CapacityRecord {
    String warehouseId;
    double capacity;
    @Singular
    Map<String, Object> attributes;
}
