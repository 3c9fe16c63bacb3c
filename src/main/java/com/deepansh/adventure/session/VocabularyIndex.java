package com.deepansh.adventure.session;

import com.deepansh.adventure.engine.GameEngine;

import java.util.List;

/**
 * Answers "does the game understand this word?" against the engine's dictionary.
 *
 * Z-machine dictionaries store words cut to a fixed length (six characters in
 * most Infocom story files), so "lantern" is stored as "lanter". An exact match
 * would miss every longer word; instead the first {@code prefixLength}
 * characters of the lower-cased word are matched against the start of each
 * dictionary token.
 */
public class VocabularyIndex {

    public static final int DEFAULT_PREFIX_LENGTH = 6;

    private final GameEngine engine;
    private final int prefixLength;

    public VocabularyIndex(GameEngine engine) {
        this(engine, DEFAULT_PREFIX_LENGTH);
    }

    public VocabularyIndex(GameEngine engine, int prefixLength) {
        this.engine = engine;
        this.prefixLength = prefixLength;
    }

    /**
     * Fetches the dictionary live on every call.
     *
     * @throws com.deepansh.adventure.engine.GameEngineException if the engine cannot supply it
     */
    public List<String> matches(String word) {
        String lower = word.toLowerCase();
        String prefix = lower.substring(0, Math.min(prefixLength, lower.length()));
        return engine.getDictionary().stream()
                .filter(token -> token.startsWith(prefix))
                .toList();
    }

    public String check(String word) {
        List<String> found = matches(word);
        if (found.isEmpty()) {
            return String.format(
                    "No, the game does NOT understand the word '%s'. Try a different synonym.", word);
        }
        return String.format("Yes, the game understands '%s' (matches: %s).", word, String.join(", ", found));
    }
}
