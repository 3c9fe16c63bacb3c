package com.deepansh.adventure.session;

import com.deepansh.adventure.config.GameProperties;
import com.deepansh.adventure.engine.EngineSnapshot;
import com.deepansh.adventure.engine.GameEngine;
import com.deepansh.adventure.engine.Transition;
import com.deepansh.adventure.model.SessionStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * One live game: the engine handle plus everything derived from its transitions.
 *
 * All engine interaction goes through here. Every public operation holds the
 * session's monitor, since the current transition, history, map and save slots
 * are mutated in place.
 *
 * Error policy:
 * - queries (valid actions, vocabulary, save) absorb engine failures and
 *   return a description of what went wrong
 * - transitions ({@link #takeAction}, the restore + look inside {@link #load})
 *   throw {@link SessionTransitionException}; the session is unusable afterwards
 *
 * Loading a slot does not rewind history or the exploration map, so after a
 * load both can describe moves the restored game never made.
 */
@Slf4j
public class GameSession {

    static final String UNKNOWN_LOCATION = "Unknown";
    private static final String LOOK = "look";

    private final String gameName;
    private final GameEngine engine;
    private final HistoryLog history;
    private final ExplorationGraph exploration = new ExplorationGraph();
    private final SaveSlotStore slots = new SaveSlotStore();
    private final VocabularyIndex vocabulary;
    private final int recentActions;
    private final int excerptLength;

    private Transition currentTransition;
    private String currentLocation;

    /**
     * Resets the engine to obtain the opening transition.
     *
     * @throws com.deepansh.adventure.engine.GameEngineException if the reset fails
     */
    public GameSession(String gameName, GameEngine engine, GameProperties properties) {
        this.gameName = gameName;
        this.engine = engine;
        this.history = new HistoryLog(properties.getHistory().getMaxEntries());
        this.vocabulary = new VocabularyIndex(engine, properties.getVocabulary().getPrefixLength());
        this.recentActions = properties.getMemory().getRecentActions();
        this.excerptLength = properties.getMemory().getExcerptLength();

        this.currentTransition = engine.reset();
        this.currentLocation = extractLocation(currentTransition.observation());
        log.info("Game session started [game={}, location='{}']", gameName, currentLocation);
    }

    /**
     * Location identity is the first non-empty line of the observation. Two rooms
     * that open with the same line are treated as one place.
     */
    static String extractLocation(String observation) {
        if (observation == null) {
            return UNKNOWN_LOCATION;
        }
        return observation.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .findFirst()
                .orElse(UNKNOWN_LOCATION);
    }

    public synchronized String takeAction(String action) {
        Transition next;
        try {
            next = engine.step(action);
        } catch (RuntimeException e) {
            throw new SessionTransitionException("Action '" + action + "' failed: " + e.getMessage(), e);
        }

        currentTransition = next;
        history.append(action, next.observation());

        String previous = currentLocation;
        currentLocation = extractLocation(next.observation());
        if (exploration.record(previous, action, currentLocation)) {
            log.debug("New exit mapped: '{}' --{}--> '{}'", previous, action, currentLocation);
        }

        return next.observation() + summaryLine(next) + (next.done() ? "\n\nGAME OVER" : "");
    }

    private String summaryLine(Transition t) {
        if (t.reward() > 0) {
            return String.format("\n\n+%d points! (Total: %d)", t.reward(), t.score());
        }
        return String.format("\n\n[Score: %d | Moves: %d]", t.score(), t.moves());
    }

    public synchronized String getMemorySummary() {
        List<HistoryEntry> recent = history.recent(recentActions);
        String recentText = recent.isEmpty()
                ? "  (none yet)"
                : recent.stream()
                        .map(e -> "  > " + e.action() + " -> " + excerpt(e.result()) + "...")
                        .collect(Collectors.joining("\n"));

        // Body lines carry a 4-space indent; only the first recent action line gets it.
        return "Current State:\n"
                + "    - Location: " + currentLocation + "\n"
                + "    - Score: " + currentTransition.score() + " points\n"
                + "    - Moves: " + currentTransition.moves() + "\n"
                + "    - Game: " + gameName + "\n"
                + "\n"
                + "    Recent Actions:\n"
                + "    " + recentText + "\n"
                + "\n"
                + "    Current Observation:\n"
                + "    " + currentTransition.observation();
    }

    private String excerpt(String result) {
        return result.length() > excerptLength ? result.substring(0, excerptLength) : result;
    }

    public synchronized String getMap() {
        if (exploration.isEmpty()) {
            return "Map: No locations explored yet. Try moving around!";
        }

        StringBuilder sb = new StringBuilder("Explored Locations and Exits:\n");
        for (Map.Entry<String, SortedSet<String>> location : exploration.locations().entrySet()) {
            sb.append("\n* ").append(location.getKey()).append('\n');
            location.getValue().forEach(edge -> sb.append("    -> ").append(edge).append('\n'));
        }
        sb.append("\n[Current] ").append(currentLocation);
        return sb.toString();
    }

    public synchronized String getInventory() {
        List<String> items = currentTransition.inventory();
        if (items.isEmpty()) {
            return "Inventory: You are empty-handed.";
        }
        return "Inventory: " + items.stream()
                .map(InventoryParser::displayName)
                .collect(Collectors.joining(", "));
    }

    public synchronized String getValidActions() {
        try {
            List<String> actions = engine.getValidActions();
            if (actions.isEmpty()) {
                return "No valid actions available.";
            }
            return "Valid Actions:\n" + actions.stream()
                    .map(a -> "  - " + a)
                    .collect(Collectors.joining("\n"));
        } catch (RuntimeException e) {
            log.warn("Valid actions unavailable [game={}]: {}", gameName, e.getMessage());
            return "Could not retrieve valid actions: " + e.getMessage();
        }
    }

    public synchronized String checkVocabulary(String word) {
        try {
            return vocabulary.check(word);
        } catch (RuntimeException e) {
            log.warn("Vocabulary check failed [word={}]: {}", word, e.getMessage());
            return "Could not check vocabulary: " + e.getMessage();
        }
    }

    public synchronized String save(String slotName) {
        try {
            boolean replaced = slots.put(slotName, engine.getState());
            log.info("Saved slot '{}' [location='{}', replaced={}]", slotName, currentLocation, replaced);
            return String.format("Game saved successfully to slot: '%s'", slotName);
        } catch (RuntimeException e) {
            log.error("Save to slot '{}' failed", slotName, e);
            return String.format("Error saving game to slot '%s': %s", slotName, e.getMessage());
        }
    }

    public synchronized String load(String slotName) {
        Optional<EngineSnapshot> snapshot = slots.find(slotName);
        if (snapshot.isEmpty()) {
            return String.format("Error: No save found in slot '%s'", slotName);
        }

        Transition refreshed;
        try {
            engine.setState(snapshot.get());
            refreshed = engine.step(LOOK);
        } catch (RuntimeException e) {
            throw new SessionTransitionException(
                    "Restoring slot '" + slotName + "' failed: " + e.getMessage(), e);
        }

        currentTransition = refreshed;
        currentLocation = extractLocation(refreshed.observation());
        log.info("Loaded slot '{}' [location='{}']", slotName, currentLocation);
        return String.format("Game loaded from slot: '%s'.\nCurrent location: %s",
                slotName, refreshed.observation());
    }

    public synchronized SessionStatus status() {
        return SessionStatus.builder()
                .gameName(gameName)
                .location(currentLocation)
                .score(currentTransition.score())
                .moves(currentTransition.moves())
                .done(currentTransition.done())
                .historySize(history.size())
                .exploredLocations(exploration.locations().size())
                .saveSlots(List.copyOf(slots.slotNames()))
                .build();
    }

    public String getGameName() {
        return gameName;
    }

    public synchronized String getCurrentLocation() {
        return currentLocation;
    }

    public synchronized Transition getCurrentTransition() {
        return currentTransition;
    }

    public synchronized List<HistoryEntry> getHistory() {
        return history.entries();
    }

    public synchronized Map<String, SortedSet<String>> getExploredLocations() {
        return exploration.locations();
    }

    /** Releases the engine. The session must not be used afterwards. */
    public synchronized void close() {
        engine.close();
    }
}
