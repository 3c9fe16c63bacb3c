package com.deepansh.adventure.tool.impl;

import com.deepansh.adventure.tool.GameSessionHolder;
import com.deepansh.adventure.tool.GameTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ValidActionsTool implements GameTool {

    private final GameSessionHolder sessions;

    @Override
    public String getName() {
        return "valid_actions";
    }

    @Override
    public String getDescription() {
        return "Get the list of actions the game currently accepts as meaningful in this state.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        return sessions.current().getValidActions();
    }
}
