package com.dev.prostaff.realtime;

public enum ChannelKind {
    TEAM,
    DIRECT
}
