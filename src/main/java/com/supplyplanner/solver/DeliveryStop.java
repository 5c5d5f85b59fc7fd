package com.supplyplanner.solver;

/**
 * One delivery chunk: a store (by matrix index and id) and the quantity carried to it.
 */
public record DeliveryStop(int node, String locationId, double quantity) {
}
