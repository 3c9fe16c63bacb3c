package com.deepansh.adventure.tool;

import com.deepansh.adventure.session.SessionTransitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Central registry for all GameTool implementations.
 *
 * Spring injects every @Component that implements GameTool; they are indexed
 * by name for dispatch.
 *
 * Failures come back as "ERROR: ..." strings, except a failed game transition:
 * that one is rethrown, because the session behind it is no longer usable and
 * the caller has to know.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, GameTool> tools = new TreeMap<>();

    public ToolRegistry(List<GameTool> toolBeans) {
        toolBeans.forEach(tool -> {
            GameTool previous = tools.put(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}]", tool.getName());
        });
        log.info("Total tools registered: {}", tools.size());
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .map(ToolDefinition::from)
                .toList();
    }

    /**
     * Dispatches a tool call and returns its text output.
     *
     * @throws SessionTransitionException if the tool drove the game into an unknown state
     */
    public String execute(String toolName, Map<String, Object> arguments) {
        GameTool tool = tools.get(toolName);

        if (tool == null) {
            String msg = String.format(
                    "ERROR: Unknown tool '%s'. Available tools: %s", toolName, tools.keySet());
            log.warn(msg);
            return msg;
        }

        Map<String, Object> args = arguments != null ? arguments : Map.of();
        log.info("Executing tool: [{}] with args: {}", toolName, args);

        try {
            String result = tool.execute(args);
            log.debug("Tool [{}] returned: {}", toolName, result);
            return result;
        } catch (SessionTransitionException e) {
            log.error("Tool [{}] left the session in an unknown state", toolName, e);
            throw e;
        } catch (Exception e) {
            log.error("Unexpected error in tool [{}]", toolName, e);
            return "ERROR: Tool execution failed: " + e.getMessage();
        }
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }
}
