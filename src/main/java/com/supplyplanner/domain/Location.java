package com.supplyplanner.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class Location {
    String id;
    LocationKind kind;
    String name;
    Double latitude;
    Double longitude;
    @Singular
    Map<String, Object> attributes;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    @JsonIgnore
    public boolean isWarehouse() {
        return kind == LocationKind.WAREHOUSE;
    }

    @JsonIgnore
    public boolean isStore() {
        return kind == LocationKind.STORE;
    }
}
