package com.deepansh.adventure.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolInvocation {

    @NotBlank(message = "toolName must not be blank")
    private String toolName;

    /** String arguments by name, e.g. {"action": "open mailbox"} */
    @Builder.Default
    private Map<String, Object> arguments = new HashMap<>();
}
