package com.deepansh.adventure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly-typed configuration for the game session.
 * Bound from application.yml under the "game" prefix.
 */
@ConfigurationProperties(prefix = "game")
@Data
public class GameProperties {

    /** Game identifier passed to the engine when the session is created. Set via GAME. */
    private String name = "zork1";

    private Engine engine = new Engine();
    private History history = new History();
    private Memory memory = new Memory();
    private Vocabulary vocabulary = new Vocabulary();

    @Data
    public static class Engine {
        private String baseUrl = "http://localhost:8765";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 30000;
    }

    @Data
    public static class History {
        private int maxEntries = 50;
    }

    @Data
    public static class Memory {
        /** How many history entries the memory summary shows */
        private int recentActions = 5;
        /** Result text is cut to this many characters in the summary */
        private int excerptLength = 60;
    }

    @Data
    public static class Vocabulary {
        /** The engine's dictionary keeps only this many leading characters per word */
        private int prefixLength = 6;
    }
}
