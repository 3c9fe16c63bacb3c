package com.deepansh.adventure.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Saved engine state. The payload is whatever the engine handed out and is
 * passed back to it untouched; nothing on this side reads or merges it.
 */
public final class EngineSnapshot {

    private final JsonNode payload;

    public EngineSnapshot(JsonNode payload) {
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public JsonNode payload() {
        return payload;
    }

    @Override
    public String toString() {
        return "EngineSnapshot[opaque]";
    }
}
