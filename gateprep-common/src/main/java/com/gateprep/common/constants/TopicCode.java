package com.gateprep.common.constants;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * GATE Civil Engineering subject codes.
 */
@Getter
@RequiredArgsConstructor
public enum TopicCode {

    SM("Soil Mechanics"),
    FM("Fluid Mechanics"),
    SA("Structural Analysis"),
    RCC("Reinforced Concrete Design"),
    STEEL("Steel Structures"),
    GEO("Geomatics / Surveying"),
    ENV("Environmental Engineering"),
    TRANS("Transportation Engineering"),
    HYDRO("Hydrology & Irrigation"),
    CONST("Construction Management");

    public static final String GENERAL = "General";

    private static final Map<String, String> CATALOGUE;

    static {
        Map<String, String> catalogue = new LinkedHashMap<>();
        for (TopicCode code : values()) {
            catalogue.put(code.name(), code.displayName);
        }
        CATALOGUE = Collections.unmodifiableMap(catalogue);
    }

    private final String displayName;

    public static Optional<TopicCode> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim();
        for (TopicCode topic : values()) {
            if (topic.name().equalsIgnoreCase(normalized)) {
                return Optional.of(topic);
            }
        }
        return Optional.empty();
    }

    /**
     * Display name for a code, or {@value #GENERAL} when the code is unknown.
     */
    public static String displayNameOf(String code) {
        return fromCode(code).map(TopicCode::getDisplayName).orElse(GENERAL);
    }

    /**
     * Code to display name, in declaration order.
     */
    public static Map<String, String> catalogue() {
        return CATALOGUE;
    }
}
