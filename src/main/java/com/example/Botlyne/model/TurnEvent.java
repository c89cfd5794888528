package com.example.Botlyne.model;

/**
 * A single progress event of a streamed turn.
 *
 * stage   - which step produced it
 * message - human-readable description of the step
 * payload - step detail: the route, retrieved source summaries, or the final {@link QueryTurnResponse}
 */
public record TurnEvent(
        TurnStage stage,
        String message,
        Object payload
) {
}
