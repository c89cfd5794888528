package com.example.Botlyne.model;

public record AgentReplyRequest(String agentId, String message) {
}
