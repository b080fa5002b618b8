package com.dev.prostaff.realtime;

public record ErrorPayload(String error) {
}
