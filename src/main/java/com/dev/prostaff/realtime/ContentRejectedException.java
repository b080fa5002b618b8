package com.dev.prostaff.realtime;

public class ContentRejectedException extends RuntimeException {

    public ContentRejectedException(String message) {
        super(message);
    }
}
