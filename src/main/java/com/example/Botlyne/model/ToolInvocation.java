package com.example.Botlyne.model;

public record ToolInvocation(String tool, String input, String output, boolean success) {
}
