package com.supplyplanner.domain;

import lombok.Value;

@Value(staticConstructor = "of")
public class RouteEdge {
    String fromLocationId;
    String toLocationId;
}
