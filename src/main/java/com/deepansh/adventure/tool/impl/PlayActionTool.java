package com.deepansh.adventure.tool.impl;

import com.deepansh.adventure.tool.GameSessionHolder;
import com.deepansh.adventure.tool.GameTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Sends one command to the game. A failure here is not turned into an error
 * string: the session state is unknown after a failed step.
 */
@Component
@RequiredArgsConstructor
public class PlayActionTool implements GameTool {

    private final GameSessionHolder sessions;

    @Override
    public String getName() {
        return "play_action";
    }

    @Override
    public String getDescription() {
        return """
                Execute a game action in the text adventure and get the game's response,
                followed by the current score and move count (or the points just earned).
                Examples: 'north', 'take lamp', 'open mailbox', 'examine leaflet'.
                Movement actions (north, south, east, west, up, down, enter, exit and
                n, s, e, w, u, d) also update the map.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "action", Map.of(
                                "type", "string",
                                "description", "The command to execute, e.g. 'north', 'take lamp', 'open mailbox'"
                        )
                ),
                "required", List.of("action")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String action = (String) arguments.get("action");
        if (action == null || action.isBlank()) {
            return "ERROR: 'action' argument is required";
        }
        return sessions.current().takeAction(action.trim());
    }
}
