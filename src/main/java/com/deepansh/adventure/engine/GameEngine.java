package com.deepansh.adventure.engine;

import java.util.List;

/**
 * Contract of the external game-stepping engine.
 *
 * One instance wraps exactly one running game. Implementations report every
 * failure as a {@link GameEngineException}; callers decide whether that failure
 * is recoverable.
 */
public interface GameEngine extends AutoCloseable {

    /** Restart the game and return the opening transition. */
    Transition reset();

    /** Apply one action string verbatim and return the resulting transition. */
    Transition step(String action);

    List<String> getValidActions();

    /**
     * Every vocabulary token the interpreter knows. Tokens are stored truncated
     * to the story file's dictionary word length, so long words only appear
     * as their prefix.
     */
    List<String> getDictionary();

    EngineSnapshot getState();

    void setState(EngineSnapshot snapshot);

    /** Release the engine's resources. The default does nothing. */
    @Override
    default void close() {
    }
}
