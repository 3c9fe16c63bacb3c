package com.deepansh.adventure.api;

import com.deepansh.adventure.engine.GameEngineFactory;
import com.deepansh.adventure.model.SessionStatus;
import com.deepansh.adventure.tool.GameSessionHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Session lifecycle endpoints.
 *
 * GET  /api/v1/session         : status of the live session (starts it if needed)
 * POST /api/v1/session/restart : discard the session and start the configured game again
 * GET  /api/v1/games           : games the engine host can run
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final GameSessionHolder sessions;
    private final GameEngineFactory engineFactory;

    @GetMapping("/session")
    public ResponseEntity<SessionStatus> status() {
        return ResponseEntity.ok(sessions.current().status());
    }

    @PostMapping("/session/restart")
    public ResponseEntity<SessionStatus> restart() {
        log.info("Session restart requested");
        return ResponseEntity.ok(sessions.restart().status());
    }

    @GetMapping("/games")
    public ResponseEntity<List<String>> games() {
        return ResponseEntity.ok(engineFactory.availableGames());
    }
}
