package com.deepansh.adventure.engine;

/**
 * Any failure reported by, or while talking to, the game engine.
 */
public class GameEngineException extends RuntimeException {

    public GameEngineException(String message) {
        super(message);
    }

    public GameEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
