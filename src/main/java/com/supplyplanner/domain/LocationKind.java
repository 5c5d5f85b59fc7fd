package com.supplyplanner.domain;

public enum LocationKind {
    WAREHOUSE,
    STORE
}
