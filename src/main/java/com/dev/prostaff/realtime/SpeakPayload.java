package com.dev.prostaff.realtime;

public record SpeakPayload(String content, String recipientID) {
}
