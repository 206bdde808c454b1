package com.gateprep.common.constants;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Difficulty {

    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard");

    private final String wireValue;

    public static Difficulty fromString(String value) {
        if (value != null) {
            for (Difficulty difficulty : values()) {
                if (difficulty.wireValue.equalsIgnoreCase(value.trim())) {
                    return difficulty;
                }
            }
        }
        throw new IllegalArgumentException("Unknown difficulty: " + value + " (expected easy, medium or hard)");
    }
}
