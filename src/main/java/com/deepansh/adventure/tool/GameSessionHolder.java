package com.deepansh.adventure.tool;

import com.deepansh.adventure.session.GameSession;
import com.deepansh.adventure.session.GameSessionFactory;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Owns the process's one game session. The session is created on first use and
 * then kept until a restart is requested or the application shuts down.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GameSessionHolder {

    private final GameSessionFactory sessionFactory;

    private GameSession session;

    /**
     * @throws com.deepansh.adventure.engine.GameEngineException if no session exists and one cannot be started
     */
    public synchronized GameSession current() {
        if (session == null) {
            session = sessionFactory.create();
        }
        return session;
    }

    /** The live session, without starting one. */
    public synchronized Optional<GameSession> peek() {
        return Optional.ofNullable(session);
    }

    /** Drops the current session (releasing its engine) and starts a fresh one. */
    public synchronized GameSession restart() {
        discard();
        return current();
    }

    @PreDestroy
    public synchronized void discard() {
        if (session != null) {
            log.info("Discarding game session [game={}]", session.getGameName());
            session.close();
            session = null;
        }
    }
}
