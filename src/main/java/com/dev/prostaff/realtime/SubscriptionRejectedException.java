package com.dev.prostaff.realtime;

public class SubscriptionRejectedException extends RuntimeException {

    public SubscriptionRejectedException(String message) {
        super(message);
    }
}
