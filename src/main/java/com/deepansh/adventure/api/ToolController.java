package com.deepansh.adventure.api;

import com.deepansh.adventure.model.ToolInvocation;
import com.deepansh.adventure.model.ToolResult;
import com.deepansh.adventure.tool.ToolDefinition;
import com.deepansh.adventure.tool.ToolRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Tool dispatch endpoints.
 *
 * GET  /api/v1/tools         : tool names, descriptions and input schemas
 * POST /api/v1/tools/invoke  : { "toolName": "play_action", "arguments": { "action": "north" } }
 * GET  /api/v1/health
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class ToolController {

    private final ToolRegistry toolRegistry;

    @GetMapping("/tools")
    public ResponseEntity<List<ToolDefinition>> tools() {
        return ResponseEntity.ok(toolRegistry.getAllDefinitions());
    }

    @PostMapping("/tools/invoke")
    public ResponseEntity<ToolResult> invoke(@Valid @RequestBody ToolInvocation invocation) {
        long start = System.currentTimeMillis();
        String output = toolRegistry.execute(invocation.getToolName(), invocation.getArguments());
        long latency = System.currentTimeMillis() - start;

        log.info("Tool invocation complete [tool={}, latency={}ms]", invocation.getToolName(), latency);
        return ResponseEntity.ok(ToolResult.builder()
                .toolName(invocation.getToolName())
                .output(output)
                .latencyMs(latency)
                .build());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
