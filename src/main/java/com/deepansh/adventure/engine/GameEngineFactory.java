package com.deepansh.adventure.engine;

import java.util.List;

/**
 * Creates engines for a given game. The session layer only ever asks for one.
 */
public interface GameEngineFactory {

    GameEngine create(String gameName);

    /** Game identifiers the engine host can start. */
    List<String> availableGames();
}
