package com.ptcg.engine.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ptcg.engine.game.GamePhase;
import com.ptcg.engine.player.SpecialCondition;

import java.util.List;
import java.util.UUID;

/**
 * Something that happened in a match. Events are recorded in order in the
 * game's {@link GameEventLog} and never changed afterwards.
 * Nullable components are marked in the record docs.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "event"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = GameEvent.GameStarted.class, name = "game_started"),
    @JsonSubTypes.Type(value = GameEvent.TurnOrderDetermined.class, name = "turn_order_determined"),
    @JsonSubTypes.Type(value = GameEvent.OpeningHandsDealt.class, name = "opening_hands_dealt"),
    @JsonSubTypes.Type(value = GameEvent.HandRevealed.class, name = "hand_revealed"),
    @JsonSubTypes.Type(value = GameEvent.MulliganPerformed.class, name = "mulligan_performed"),
    @JsonSubTypes.Type(value = GameEvent.ActivePokemonSelected.class, name = "active_pokemon_selected"),
    @JsonSubTypes.Type(value = GameEvent.PokemonBenched.class, name = "pokemon_benched"),
    @JsonSubTypes.Type(value = GameEvent.PrizeCardsPlaced.class, name = "prize_cards_placed"),
    @JsonSubTypes.Type(value = GameEvent.TurnStarted.class, name = "turn_started"),
    @JsonSubTypes.Type(value = GameEvent.PhaseChanged.class, name = "phase_changed"),
    @JsonSubTypes.Type(value = GameEvent.CardDrawn.class, name = "card_drawn"),
    @JsonSubTypes.Type(value = GameEvent.CardPlayed.class, name = "card_played"),
    @JsonSubTypes.Type(value = GameEvent.EnergyAttached.class, name = "energy_attached"),
    @JsonSubTypes.Type(value = GameEvent.AttackUsed.class, name = "attack_used"),
    @JsonSubTypes.Type(value = GameEvent.DamageDealt.class, name = "damage_dealt"),
    @JsonSubTypes.Type(value = GameEvent.SpecialConditionApplied.class, name = "special_condition_applied"),
    @JsonSubTypes.Type(value = GameEvent.SpecialConditionRemoved.class, name = "special_condition_removed"),
    @JsonSubTypes.Type(value = GameEvent.PokemonKnockedOut.class, name = "pokemon_knocked_out"),
    @JsonSubTypes.Type(value = GameEvent.PokemonPromoted.class, name = "pokemon_promoted"),
    @JsonSubTypes.Type(value = GameEvent.PrizeTaken.class, name = "prize_taken"),
    @JsonSubTypes.Type(value = GameEvent.PokemonRetreated.class, name = "pokemon_retreated"),
    @JsonSubTypes.Type(value = GameEvent.DeckShuffled.class, name = "deck_shuffled"),
    @JsonSubTypes.Type(value = GameEvent.TurnPassed.class, name = "turn_passed"),
    @JsonSubTypes.Type(value = GameEvent.TurnEnded.class, name = "turn_ended"),
    @JsonSubTypes.Type(value = GameEvent.GameEnded.class, name = "game_ended"),
    @JsonSubTypes.Type(value = GameEvent.GameCancelled.class, name = "game_cancelled")
})
public sealed interface GameEvent permits GameEvent.GameStarted, GameEvent.TurnOrderDetermined,
        GameEvent.OpeningHandsDealt, GameEvent.HandRevealed, GameEvent.MulliganPerformed,
        GameEvent.ActivePokemonSelected, GameEvent.PokemonBenched, GameEvent.PrizeCardsPlaced,
        GameEvent.TurnStarted, GameEvent.PhaseChanged, GameEvent.CardDrawn, GameEvent.CardPlayed,
        GameEvent.EnergyAttached, GameEvent.AttackUsed, GameEvent.DamageDealt,
        GameEvent.SpecialConditionApplied, GameEvent.SpecialConditionRemoved, GameEvent.PokemonKnockedOut,
        GameEvent.PokemonPromoted, GameEvent.PrizeTaken, GameEvent.PokemonRetreated, GameEvent.DeckShuffled,
        GameEvent.TurnPassed, GameEvent.TurnEnded, GameEvent.GameEnded, GameEvent.GameCancelled {

    // ---- Setup ----

    record GameStarted(
        @JsonProperty("game_id") UUID gameId,
        @JsonProperty("turn_order") List<UUID> turnOrder
    ) implements GameEvent {}

    record TurnOrderDetermined(
        @JsonProperty("turn_order") List<UUID> turnOrder,
        @JsonProperty("first_player") UUID firstPlayer
    ) implements GameEvent {}

    record OpeningHandsDealt(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("cards") int cards
    ) implements GameEvent {}

    /** A player's hand shown to another player before a mulligan. */
    record HandRevealed(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("revealed_to") UUID revealedTo,
        @JsonProperty("cards") List<UUID> cards
    ) implements GameEvent {}

    record MulliganPerformed(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("mulligan_count") int mulliganCount,
        @JsonProperty("hand_size") int handSize
    ) implements GameEvent {}

    record ActivePokemonSelected(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("pokemon_id") UUID pokemonId
    ) implements GameEvent {}

    record PokemonBenched(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("pokemon_id") UUID pokemonId
    ) implements GameEvent {}

    record PrizeCardsPlaced(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("count") int count
    ) implements GameEvent {}

    // ---- Turn structure ----

    record TurnStarted(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("turn_number") int turnNumber
    ) implements GameEvent {}

    record PhaseChanged(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("from") GamePhase from,
        @JsonProperty("to") GamePhase to
    ) implements GameEvent {}

    record TurnPassed(
        @JsonProperty("player_id") UUID playerId
    ) implements GameEvent {}

    record TurnEnded(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("turn_number") int turnNumber
    ) implements GameEvent {}

    // ---- Actions ----

    /** cardId is null when the deck was empty. */
    record CardDrawn(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("card_id") UUID cardId
    ) implements GameEvent {}

    /** target may be null. */
    record CardPlayed(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("card_id") UUID cardId,
        @JsonProperty("target") UUID target
    ) implements GameEvent {}

    record EnergyAttached(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("energy_id") UUID energyId,
        @JsonProperty("pokemon_id") UUID pokemonId
    ) implements GameEvent {}

    record AttackUsed(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("pokemon_id") UUID pokemonId,
        @JsonProperty("attack_name") String attackName,
        @JsonProperty("target_id") UUID targetId
    ) implements GameEvent {}

    record DamageDealt(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("pokemon_id") UUID pokemonId,
        @JsonProperty("amount") int amount,
        @JsonProperty("source") String source
    ) implements GameEvent {}

    record SpecialConditionApplied(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("pokemon_id") UUID pokemonId,
        @JsonProperty("condition") SpecialCondition condition
    ) implements GameEvent {}

    record SpecialConditionRemoved(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("pokemon_id") UUID pokemonId,
        @JsonProperty("condition") SpecialCondition condition
    ) implements GameEvent {}

    record PokemonKnockedOut(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("pokemon_id") UUID pokemonId
    ) implements GameEvent {}

    record PokemonPromoted(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("pokemon_id") UUID pokemonId
    ) implements GameEvent {}

    record PrizeTaken(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("remaining") int remaining
    ) implements GameEvent {}

    record PokemonRetreated(
        @JsonProperty("player_id") UUID playerId,
        @JsonProperty("retreated_id") UUID retreatedId,
        @JsonProperty("replacement_id") UUID replacementId
    ) implements GameEvent {}

    record DeckShuffled(
        @JsonProperty("player_id") UUID playerId
    ) implements GameEvent {}

    // ---- End of match ----

    /** winner is null for a draw. */
    record GameEnded(
        @JsonProperty("winner") UUID winner,
        @JsonProperty("reason") String reason
    ) implements GameEvent {}

    record GameCancelled(
        @JsonProperty("reason") String reason
    ) implements GameEvent {}
}
