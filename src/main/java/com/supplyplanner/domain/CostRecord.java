package com.supplyplanner.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class CostRecord {
    String fromLocationId;
    String toLocationId;
    // per unit shipped
    double cost;
    @Singular
    Map<String, Object> attributes;
}
