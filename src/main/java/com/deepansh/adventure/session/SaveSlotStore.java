package com.deepansh.adventure.session;

import com.deepansh.adventure.engine.EngineSnapshot;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named engine snapshots, held in memory only. Everything here is gone when the
 * process exits. Saving under an existing name replaces the old snapshot.
 */
public class SaveSlotStore {

    private final Map<String, EngineSnapshot> slots = new HashMap<>();

    /** @return true if an earlier snapshot under this name was replaced */
    public boolean put(String slotName, EngineSnapshot snapshot) {
        return slots.put(slotName, snapshot) != null;
    }

    public Optional<EngineSnapshot> find(String slotName) {
        return Optional.ofNullable(slots.get(slotName));
    }

    public boolean contains(String slotName) {
        return slots.containsKey(slotName);
    }

    public Set<String> slotNames() {
        return new TreeSet<>(slots.keySet());
    }

    public int size() {
        return slots.size();
    }
}
