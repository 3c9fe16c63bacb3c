package com.deepansh.adventure.session;

/** One action the caller issued and the text the engine answered with. */
public record HistoryEntry(String action, String result) {}
