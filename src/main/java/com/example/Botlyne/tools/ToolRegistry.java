package com.example.Botlyne.tools;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Knows which tools exist and which profile enables them.
 */
@Component
public class ToolRegistry {

    private final Map<ToolProfile, List<AiToolDefinition>> toolsByProfile;

    public ToolRegistry(List<AiToolDefinition> definitions) {
        Map<ToolProfile, List<AiToolDefinition>> byProfile = new EnumMap<>(ToolProfile.class);
        for (AiToolDefinition def : definitions) {
            for (ToolProfile profile : def.profiles()) {
                byProfile.computeIfAbsent(profile, p -> new ArrayList<>()).add(def);
            }
        }
        this.toolsByProfile = Collections.unmodifiableMap(byProfile);
    }

    public List<AiToolDefinition> getToolsForProfile(ToolProfile profile) {
        return toolsByProfile.getOrDefault(profile, List.of());
    }

    /**
     * Function bean names for {@code ChatClient.toolNames(...)}; empty for {@link ToolProfile#NONE}.
     */
    public List<String> getFunctionBeanNamesForProfile(ToolProfile profile) {
        return getToolsForProfile(profile).stream()
                .map(AiToolDefinition::functionBeanName)
                .toList();
    }
}
