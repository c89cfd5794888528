package com.example.Botlyne.provider;

/**
 * Turns text into a query vector.
 * Implementations throw {@link com.example.Botlyne.exception.TransientDependencyException} or
 * {@link com.example.Botlyne.exception.PermanentDependencyException} (or raw client exceptions,
 * which the resilience layer classifies).
 */
public interface EmbeddingProvider {

    float[] embed(String text);
}
