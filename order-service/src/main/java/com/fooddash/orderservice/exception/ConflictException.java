package com.fooddash.orderservice.exception;

/**
 * A conditional write matched no row because another writer got there first.
 * HTTP Status: 409 Conflict. Never retried by the server.
 */
public class ConflictException extends RuntimeException {

    public static final String ORDER_ALREADY_CLAIMED = "ORDER_ALREADY_CLAIMED";
    public static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";

    private final String errorCode;

    public ConflictException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static ConflictException alreadyClaimed() {
        return new ConflictException(ORDER_ALREADY_CLAIMED,
                "This order has already been assigned to another driver or is no longer available");
    }

    public static ConflictException concurrentModification() {
        return new ConflictException(CONCURRENT_MODIFICATION,
                "The order was modified by another user. Please refresh and try again.");
    }

    public String getErrorCode() {
        return errorCode;
    }
}
