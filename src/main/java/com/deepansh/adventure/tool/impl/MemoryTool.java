package com.deepansh.adventure.tool.impl;

import com.deepansh.adventure.tool.GameSessionHolder;
import com.deepansh.adventure.tool.GameTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class MemoryTool implements GameTool {

    private final GameSessionHolder sessions;

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public String getDescription() {
        return "Get a summary of the current game state: location, score, moves, "
                + "the last few actions with their results, and the current observation.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        return sessions.current().getMemorySummary();
    }
}
