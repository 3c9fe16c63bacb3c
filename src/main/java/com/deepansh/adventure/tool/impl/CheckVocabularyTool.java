package com.deepansh.adventure.tool.impl;

import com.deepansh.adventure.tool.GameSessionHolder;
import com.deepansh.adventure.tool.GameTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CheckVocabularyTool implements GameTool {

    private final GameSessionHolder sessions;

    @Override
    public String getName() {
        return "check_vocabulary";
    }

    @Override
    public String getDescription() {
        return """
                Check whether a specific word is understood by the game's parser.
                Use this before trying unusual verbs or interacting with odd objects.
                The game only stores the first few letters of each word, so matches
                are reported by prefix.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "word", Map.of(
                                "type", "string",
                                "description", "A single word, e.g. 'lantern' or 'xyzzy'"
                        )
                ),
                "required", List.of("word")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String word = (String) arguments.get("word");
        if (word == null || word.isBlank()) {
            return "ERROR: 'word' argument is required";
        }
        return sessions.current().checkVocabulary(word.trim());
    }
}
