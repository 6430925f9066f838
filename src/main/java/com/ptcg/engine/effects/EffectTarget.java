package com.ptcg.engine.effects;

import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * What an effect acts on.
 */
public sealed interface EffectTarget permits EffectTarget.None, EffectTarget.Self, EffectTarget.SpecificCard,
        EffectTarget.SpecificPlayer, EffectTarget.AllPlayerPokemon, EffectTarget.AllPokemon,
        EffectTarget.ActivePokemon, EffectTarget.Choice {

    record None() implements EffectTarget {}

    /** The card the effect is attached to. */
    record Self() implements EffectTarget {}

    record SpecificCard(UUID cardId) implements EffectTarget {}

    record SpecificPlayer(UUID playerId) implements EffectTarget {}

    /** Every Pokemon one player has in play. */
    record AllPlayerPokemon(UUID playerId) implements EffectTarget {}

    /** Every Pokemon in play on both sides. */
    record AllPokemon() implements EffectTarget {}

    record ActivePokemon(UUID playerId) implements EffectTarget {}

    /** The first count of the offered cards, in the order given. */
    record Choice(List<UUID> options, int count) implements EffectTarget {
        public Choice {
            options = List.copyOf(options);
        }
    }

    /**
     * A targeted card together with the player whose copy is meant.
     *
     * @param owner the player holding the card, null when no player holds it
     */
    record Resolved(UUID cardId, Player owner) {}

    /**
     * Resolve a target to the cards it names. Player and None targets name no cards.
     * Targets that name a player keep that player as owner, so a card id held by both
     * players resolves to the named side. Card ids with no named player go to the
     * context's player when they hold it, preferring a copy in play.
     */
    static List<Resolved> resolve(EffectTarget target, Game game, EffectContext context) {
        List<Resolved> cards = new ArrayList<>();
        if (target instanceof Self) {
            if (context.sourceCard() != null) {
                cards.add(resolveCard(game, context.sourceCard(), context.sourcePlayer()));
            }
        } else if (target instanceof SpecificCard specific) {
            cards.add(resolveCard(game, specific.cardId(), context.sourcePlayer()));
        } else if (target instanceof AllPlayerPokemon all) {
            game.findPlayer(all.playerId()).ifPresent(p -> addPokemonInPlay(cards, p));
        } else if (target instanceof AllPokemon) {
            for (Player player : game.getPlayers()) {
                addPokemonInPlay(cards, player);
            }
        } else if (target instanceof ActivePokemon active) {
            game.findPlayer(active.playerId())
                    .ifPresent(p -> p.getActivePokemon().ifPresent(id -> cards.add(new Resolved(id, p))));
        } else if (target instanceof Choice choice) {
            int count = Math.min(Math.max(choice.count(), 0), choice.options().size());
            for (UUID option : choice.options().subList(0, count)) {
                cards.add(resolveCard(game, option, context.sourcePlayer()));
            }
        }
        return cards;
    }

    private static void addPokemonInPlay(List<Resolved> cards, Player player) {
        for (UUID pokemon : player.getPokemonInPlay()) {
            cards.add(new Resolved(pokemon, player));
        }
    }

    private static Resolved resolveCard(Game game, UUID cardId, UUID preferredPlayer) {
        Optional<Player> preferred = preferredPlayer == null ? Optional.empty() : game.findPlayer(preferredPlayer);
        Player owner = preferred.filter(p -> p.isInPlay(cardId))
                .or(() -> game.findOwner(cardId).filter(p -> p.isInPlay(cardId)))
                .or(() -> preferred.filter(p -> p.findCardLocation(cardId).isPresent()))
                .or(() -> game.findOwner(cardId))
                .orElse(null);
        return new Resolved(cardId, owner);
    }
}
