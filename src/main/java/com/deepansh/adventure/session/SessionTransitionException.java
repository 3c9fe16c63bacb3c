package com.deepansh.adventure.session;

import com.deepansh.adventure.engine.GameEngineException;

/**
 * An engine step or state restore failed part-way. The session no longer knows
 * what state the game is in and has to be restarted.
 */
public class SessionTransitionException extends GameEngineException {

    public SessionTransitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
