package com.example.Botlyne.model;

public record ResolveRequest(Integer satisfactionScore) {
}
