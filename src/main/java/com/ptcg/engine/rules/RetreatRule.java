package com.ptcg.engine.rules;

import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardKind;
import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;

import java.util.Optional;
import java.util.UUID;

/**
 * Retreat once per turn, paying the retreat cost, to a benched Pokemon, unless Trapped.
 */
public class RetreatRule implements Rule {
    public static final String NAME = "Retreat";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> validate(Game game, GameAction action) {
        if (!(action instanceof GameAction.Retreat retreat)) {
            return Optional.empty();
        }
        Optional<Player> found = game.findPlayer(retreat.playerId());
        if (found.isEmpty()) {
            return Optional.of(RuleViolation.error(NAME, "Player not found"));
        }
        Player player = found.get();
        if (player.isRetreatedThisTurn()) {
            return Optional.of(RuleViolation.error(NAME, "Already retreated this turn"));
        }
        Optional<UUID> active = player.getActivePokemon();
        if (active.isEmpty()) {
            return Optional.of(RuleViolation.error(NAME, "No active Pokemon to retreat"));
        }
        if (!player.getBench().contains(retreat.replacementId())) {
            return Optional.of(RuleViolation.error(NAME, "Replacement is not on the bench"));
        }
        if (!player.canPokemonRetreat(active.get())) {
            return Optional.of(RuleViolation.error(NAME, "Active Pokemon is trapped"));
        }
        int retreatCost = game.getCardDatabase().findCard(active.get())
                .flatMap(Card::getPokemonData)
                .map(CardKind.Pokemon::retreatCost)
                .orElse(0);
        if (player.getAttachedEnergyCount(active.get()) < retreatCost) {
            return Optional.of(RuleViolation.error(NAME,
                    "Retreat costs " + retreatCost + " energy, " + player.getAttachedEnergyCount(active.get()) + " attached"));
        }
        return Optional.empty();
    }
}
