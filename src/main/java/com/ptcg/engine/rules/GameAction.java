package com.ptcg.engine.rules;

import java.util.UUID;

/**
 * Everything a player can ask to do on their turn. Every action names the acting player.
 */
public sealed interface GameAction permits GameAction.DrawCard, GameAction.PlayCard, GameAction.AttachEnergy,
        GameAction.UseAttack, GameAction.Retreat, GameAction.EndTurn, GameAction.Pass {

    UUID playerId();

    record DrawCard(UUID playerId) implements GameAction {}

    /** Play a card from the hand; target may be null. */
    record PlayCard(UUID playerId, UUID cardId, UUID target) implements GameAction {}

    record AttachEnergy(UUID playerId, UUID energyId, UUID pokemonId) implements GameAction {}

    /** Use an attack of the active Pokemon; target may be null for the defending active Pokemon. */
    record UseAttack(UUID playerId, UUID pokemonId, int attackIndex, UUID target) implements GameAction {}

    /** Swap the active Pokemon with a benched one. */
    record Retreat(UUID playerId, UUID replacementId) implements GameAction {}

    record EndTurn(UUID playerId) implements GameAction {}

    record Pass(UUID playerId) implements GameAction {}
}
