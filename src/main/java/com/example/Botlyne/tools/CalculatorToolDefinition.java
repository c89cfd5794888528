package com.example.Botlyne.tools;

import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class CalculatorToolDefinition implements AiToolDefinition {

    public static final String NAME = "calculator";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return """
                Evaluates an arithmetic expression exactly. Supports numbers, + - * / % ^,
                parentheses, unary minus and the functions abs, sqrt, min, max, round, pow.
                Use it instead of doing arithmetic in your head.
                """;
    }

    @Override
    public Set<ToolProfile> profiles() {
        return Set.of(ToolProfile.ASSISTANT);
    }
}
