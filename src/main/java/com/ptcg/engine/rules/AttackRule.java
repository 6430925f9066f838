package com.ptcg.engine.rules;

import com.ptcg.engine.card.Attack;
import com.ptcg.engine.card.Card;
import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;

import java.util.List;
import java.util.Optional;

/**
 * The active Pokemon may use one of its attacks once per turn, if its energy pays
 * for it and no special condition stops it.
 */
public class AttackRule implements Rule {
    public static final String NAME = "Attack";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> validate(Game game, GameAction action) {
        if (!(action instanceof GameAction.UseAttack attack)) {
            return Optional.empty();
        }
        Optional<Player> found = game.findPlayer(attack.playerId());
        if (found.isEmpty()) {
            return Optional.of(RuleViolation.error(NAME, "Player not found"));
        }
        Player player = found.get();
        if (player.hasAttacked()) {
            return Optional.of(RuleViolation.error(NAME, "Already attacked this turn"));
        }
        if (!player.getActivePokemon().map(attack.pokemonId()::equals).orElse(false)) {
            return Optional.of(RuleViolation.error(NAME, "Only the active Pokemon can attack"));
        }
        Optional<Card> card = game.getCardDatabase().findCard(attack.pokemonId());
        if (card.isEmpty()) {
            return Optional.of(RuleViolation.error(NAME, "Card not found in database"));
        }
        List<Attack> attacks = card.get().getAttacks();
        if (attack.attackIndex() < 0 || attack.attackIndex() >= attacks.size()) {
            return Optional.of(RuleViolation.error(NAME, "No attack at index " + attack.attackIndex()));
        }
        Attack chosen = attacks.get(attack.attackIndex());
        if (!chosen.canBePaidWith(player.getAttachedEnergyTypes(attack.pokemonId(), game.getCardDatabase()))) {
            return Optional.of(RuleViolation.error(NAME, "Not enough energy for " + chosen.getName()));
        }
        if (!player.canPokemonAttack(attack.pokemonId())) {
            return Optional.of(RuleViolation.error(NAME, card.get().getName() + " cannot attack"));
        }
        return Optional.empty();
    }
}
