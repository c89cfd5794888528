package com.example.Botlyne.tools;

import java.util.Set;

/**
 * Metadata for a tool exposed to the generation model. The callable itself is a separate
 * {@link java.util.function.Function} bean registered under {@link #functionBeanName()}.
 */
public interface AiToolDefinition {

    /**
     * Unique tool name, used in {@code ChatClient.toolNames(...)}.
     */
    String name();

    /**
     * Description shown to the model.
     */
    String description();

    Set<ToolProfile> profiles();

    default String functionBeanName() {
        return name();
    }
}
