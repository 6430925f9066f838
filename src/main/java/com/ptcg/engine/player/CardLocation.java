package com.ptcg.engine.player;

import java.util.UUID;

/**
 * Where a card currently sits for a player.
 */
public sealed interface CardLocation permits CardLocation.InHand, CardLocation.InDeck, CardLocation.InDiscard,
        CardLocation.Active, CardLocation.OnBench, CardLocation.InPrizes, CardLocation.AttachedEnergy,
        CardLocation.Stadium {

    /**
     * Whether the card is an active or benched Pokemon.
     */
    default boolean isInPlay() {
        return this instanceof Active || this instanceof OnBench;
    }

    record InHand() implements CardLocation {}

    record InDeck() implements CardLocation {}

    record InDiscard() implements CardLocation {}

    record Active() implements CardLocation {}

    record OnBench(int index) implements CardLocation {}

    record InPrizes() implements CardLocation {}

    /** Energy attached to the given Pokemon. */
    record AttachedEnergy(UUID pokemonId) implements CardLocation {}

    record Stadium() implements CardLocation {}
}
