package com.example.Botlyne.resilience;

/**
 * Keys of the external dependencies guarded by the engine. One circuit breaker per key.
 */
public final class DependencyNames {

    public static final String EMBEDDING = "embedding";
    public static final String VECTOR_STORE = "vector-store";
    public static final String GENERATION = "generation";

    private DependencyNames() {
    }
}
