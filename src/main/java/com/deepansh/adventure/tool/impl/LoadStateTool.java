package com.deepansh.adventure.tool.impl;

import com.deepansh.adventure.tool.GameSessionHolder;
import com.deepansh.adventure.tool.GameTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class LoadStateTool implements GameTool {

    private final GameSessionHolder sessions;

    @Override
    public String getName() {
        return "load_state";
    }

    @Override
    public String getDescription() {
        return """
                Load a previously saved game state, e.g. after dying or making a mistake.
                Returns the room description at the restored point.
                The action history and the map are not rolled back by a load.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "slot_name", Map.of(
                                "type", "string",
                                "description", "Name of the save slot to load from"
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
        return sessions.current().load(slotName.trim());
    }
}
