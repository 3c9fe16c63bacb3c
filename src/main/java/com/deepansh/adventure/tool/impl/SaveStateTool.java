package com.deepansh.adventure.tool.impl;

import com.deepansh.adventure.tool.GameSessionHolder;
import com.deepansh.adventure.tool.GameTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SaveStateTool implements GameTool {

    private final GameSessionHolder sessions;

    @Override
    public String getName() {
        return "save_state";
    }

    @Override
    public String getDescription() {
        return """
                Save the current game state to a named slot before doing something risky.
                Saving to an existing slot name overwrites it.
                Slots are kept in memory only and are lost when the server restarts.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "slot_name", Map.of(
                                "type", "string",
                                "description", "Name of the save slot, e.g. 'before_combat', 'checkpoint_1'"
                        )
                ),
                "required", List.of("slot_name")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String slotName = (String) arguments.get("slot_name");
        if (slotName == null || slotName.isBlank()) {
            return "ERROR: 'slot_name' argument is required";
        }
        return sessions.current().save(slotName.trim());
    }
}
