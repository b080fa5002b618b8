package com.dev.prostaff.realtime;

import java.util.UUID;

public record StreamKey(String value) {

    public static StreamKey team(UUID organizationId) {
        return new StreamKey("team:" + organizationId);
    }

    public static StreamKey direct(UUID userA, UUID userB, UUID organizationId) {
        String a = userA.toString();
        String b = userB.toString();
        String low = a.compareTo(b) <= 0 ? a : b;
        String high = low.equals(a) ? b : a;
        return new StreamKey("dm:" + low + ":" + high + ":org:" + organizationId);
    }

    @Override
    public String toString() {
        return value;
    }
}
