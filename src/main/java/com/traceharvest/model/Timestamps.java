package com.traceharvest.model;

import java.time.Instant;

public final class Timestamps {

    private Timestamps() {
    }

    public static String utcIso(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis).toString();
    }
}
