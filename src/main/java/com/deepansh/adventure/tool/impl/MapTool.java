package com.deepansh.adventure.tool.impl;

import com.deepansh.adventure.tool.GameSessionHolder;
import com.deepansh.adventure.tool.GameTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class MapTool implements GameTool {

    private final GameSessionHolder sessions;

    @Override
    public String getName() {
        return "get_map";
    }

    @Override
    public String getDescription() {
        return """
                Get a map of the locations explored so far and the movement commands that
                connect them. Useful for navigation and for not getting lost.
                Locations are identified by the first line of the room description.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        return sessions.current().getMap();
    }
}
