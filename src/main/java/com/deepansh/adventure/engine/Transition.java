package com.deepansh.adventure.engine;

import java.util.List;

/**
 * Result of one engine step. Replaced wholesale on every step, never edited.
 *
 * @param inventory opaque per-item descriptors in the engine's own string form
 */
public record Transition(
        String observation,
        int score,
        int moves,
        int reward,
        boolean done,
        List<String> inventory
) {

    public Transition {
        observation = observation != null ? observation : "";
        inventory = inventory != null ? List.copyOf(inventory) : List.of();
    }
}
