package com.deepansh.adventure.tool;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Snapshot of a tool's schema handed to callers.
 * Decouples the listing format from the GameTool implementation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    public static ToolDefinition from(GameTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .build();
    }
}
