package com.deepansh.adventure.tool.impl;

import com.deepansh.adventure.tool.GameSessionHolder;
import com.deepansh.adventure.tool.GameTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class InventoryTool implements GameTool {

    private final GameSessionHolder sessions;

    @Override
    public String getName() {
        return "inventory";
    }

    @Override
    public String getDescription() {
        return "Check what items you are currently carrying. Does not use up a game move.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        return sessions.current().getInventory();
    }
}
