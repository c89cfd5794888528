package com.example.Botlyne.model;

/**
 * Receives stage events while a turn is orchestrated. Must not throw.
 */
@FunctionalInterface
public interface TurnListener {

    TurnListener NONE = event -> { };

    void onEvent(TurnEvent event);
}
