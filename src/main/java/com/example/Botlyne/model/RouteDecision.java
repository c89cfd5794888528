package com.example.Botlyne.model;

/**
 * Router output.
 *
 * @param payload the bare expression for {@link QueryRoute#MATH_QUERY}, the address for
 *                {@link QueryRoute#CONTACT_EMAIL}, otherwise the original message
 */
public record RouteDecision(QueryRoute route, String payload) {
}
