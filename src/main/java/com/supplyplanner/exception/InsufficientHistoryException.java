package com.supplyplanner.exception;

public class InsufficientHistoryException extends SupplyPlannerException {
    public InsufficientHistoryException(String message) {
        super("INSUFFICIENT_HISTORY", message);
    }
    public InsufficientHistoryException(String storeId, int periods, int required) {
        super("INSUFFICIENT_HISTORY",
              "Store '" + storeId + "' has " + periods + " period(s) of demand history; at least "
                      + required + " required.");
    }
}
