package com.deepansh.adventure.api;

import com.deepansh.adventure.engine.GameEngineException;
import com.deepansh.adventure.session.SessionTransitionException;
import com.deepansh.adventure.tool.ToolDefinition;
import com.deepansh.adventure.tool.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ToolController.class)
class ToolControllerTest {

    @Autowired MockMvc mockMvc;

    @MockBean ToolRegistry toolRegistry;

    @Test
    void invoke_returnsToolOutput() throws Exception {
        when(toolRegistry.execute(eq("play_action"), anyMap()))
                .thenReturn("North of House\n\n[Score: 0 | Moves: 1]");

        mockMvc.perform(post("/api/v1/tools/invoke")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"toolName\": \"play_action\", \"arguments\": {\"action\": \"north\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.toolName").value("play_action"))
                .andExpect(jsonPath("$.output").value("North of House\n\n[Score: 0 | Moves: 1]"));
    }

    @Test
    void invoke_blankToolName_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/tools/invoke")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"toolName\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("toolName: toolName must not be blank"));
    }

    @Test
    void invoke_transitionFailure_serviceUnavailableWithRestartHint() throws Exception {
        when(toolRegistry.execute(eq("play_action"), anyMap())).thenThrow(new SessionTransitionException(
                "Action 'north' failed: engine step failed", new GameEngineException("engine step failed")));

        mockMvc.perform(post("/api/v1/tools/invoke")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"toolName\": \"play_action\", \"arguments\": {\"action\": \"north\"}}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value(containsString("restart")));
    }

    @Test
    void tools_listsDefinitions() throws Exception {
        when(toolRegistry.getAllDefinitions()).thenReturn(List.of(ToolDefinition.builder()
                .name("memory")
                .description("Get a summary of the current game state")
                .inputSchema(Map.of("type", "object"))
                .build()));

        mockMvc.perform(get("/api/v1/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("memory"));
    }

    @Test
    void health_up() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
