package com.deepansh.adventure.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStatus {

    private String gameName;
    private String location;
    private int score;
    private int moves;
    private boolean done;
    private int historySize;
    private int exploredLocations;

    /** Slot names only. Slots live in memory and do not survive a restart. */
    @Builder.Default
    private List<String> saveSlots = new ArrayList<>();
}
