package com.deepansh.adventure.tool;

import java.util.Map;

/**
 * Contract every game tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * so callers (usually an agent) know how to invoke the tool.
 *
 * Tools answer in plain text and report bad arguments and engine hiccups as
 * "ERROR: ..." or descriptive strings. The one exception is a failed game
 * transition, which surfaces as
 * {@link com.deepansh.adventure.session.SessionTransitionException}.
 */
public interface GameTool {

    /** Unique snake_case name used to invoke this tool */
    String getName();

    /** What the tool does and when to use it. Callers pick tools by this text. */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's string arguments. */
    Map<String, Object> getInputSchema();

    String execute(Map<String, Object> arguments);
}
