package com.deepansh.adventure.session;

import com.deepansh.adventure.config.GameProperties;
import com.deepansh.adventure.engine.GameEngine;
import com.deepansh.adventure.engine.GameEngineException;
import com.deepansh.adventure.engine.GameEngineFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a session for the configured game: starts an engine, resets it, and
 * wraps it. If the reset fails the engine is released again.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GameSessionFactory {

    private final GameEngineFactory engineFactory;
    private final GameProperties gameProperties;

    public GameSession create() {
        String gameName = gameProperties.getName();
        log.info("Creating game session [game={}]", gameName);

        GameEngine engine = engineFactory.create(gameName);
        try {
            return new GameSession(gameName, engine, gameProperties);
        } catch (GameEngineException e) {
            engine.close();
            throw e;
        }
    }
}
