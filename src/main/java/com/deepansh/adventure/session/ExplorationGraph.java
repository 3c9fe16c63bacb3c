package com.deepansh.adventure.session;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Map of explored locations, built from the movement actions the caller issued.
 *
 * Nodes are location names (first line of an observation); an edge is the text
 * {@code "<action> -> <destination>"}. The graph only grows.
 */
public class ExplorationGraph {

    private static final Set<String> MOVEMENT_ACTIONS = Set.of(
            "north", "south", "east", "west", "up", "down", "enter", "exit",
            "n", "s", "e", "w", "u", "d"
    );

    private final SortedMap<String, SortedSet<String>> exits = new TreeMap<>();

    /** Exact match only: "go north" or "North" are not movement actions. */
    public static boolean isMovementAction(String action) {
        return action != null && MOVEMENT_ACTIONS.contains(action);
    }

    /**
     * Records the outcome of an action issued from {@code origin}.
     * Non-movement actions are ignored. A movement action always registers the
     * origin as explored; the edge is only added when the location changed.
     *
     * @return true if a new edge was added
     */
    public boolean record(String origin, String action, String destination) {
        if (!isMovementAction(action)) {
            return false;
        }
        SortedSet<String> edges = exits.computeIfAbsent(origin, k -> new TreeSet<>());
        if (destination.equals(origin)) {
            return false;
        }
        return edges.add(action + " -> " + destination);
    }

    /** Locations in lexical order, each with its edges in lexical order. Read-only view. */
    public Map<String, SortedSet<String>> locations() {
        return Collections.unmodifiableSortedMap(exits);
    }

    public Set<String> edgesFrom(String location) {
        SortedSet<String> edges = exits.get(location);
        return edges != null ? Collections.unmodifiableSortedSet(edges) : Set.of();
    }

    public int edgeCount() {
        return exits.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isEmpty() {
        return exits.isEmpty();
    }
}
