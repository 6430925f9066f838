package com.ptcg.engine.game;

import com.ptcg.engine.card.Attack;
import com.ptcg.engine.card.AttackTargetType;
import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardKind;
import com.ptcg.engine.card.DamageMode;
import com.ptcg.engine.card.EnergyType;
import com.ptcg.engine.card.StatusEffect;
import com.ptcg.engine.card.TrainerType;
import com.ptcg.engine.effects.EffectContext;
import com.ptcg.engine.effects.EffectTarget;
import com.ptcg.engine.effects.EffectTrigger;
import com.ptcg.engine.events.GameEvent;
import com.ptcg.engine.player.Player;
import com.ptcg.engine.player.SpecialConditionInstance;
import com.ptcg.engine.rules.ActionResult;
import com.ptcg.engine.rules.GameAction;
import com.ptcg.engine.rules.RuleEngine;
import com.ptcg.engine.rules.RuleViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Carries out player actions once the rule engine has accepted them.
 * <p>
 * Each action is validated, its preconditions are checked again against the live
 * state, and only then is the game changed. A rejected action leaves the game as it was.
 */
public final class ActionExecutor {
    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    /** Rule name on violations raised while carrying out an accepted action. */
    public static final String EXECUTION_RULE = "ActionExecution";

    /** Damage taken off when the defender resists the attacker's type. */
    public static final int RESISTANCE_REDUCTION = 30;

    private ActionExecutor() {
        // Utility class - prevent instantiation
    }

    /**
     * Validate and carry out one action. Rule hooks run only after the live-state
     * preconditions pass, so a refused action leaves no hook changes behind.
     *
     * @return the engine's result, or a rejection from {@value #EXECUTION_RULE}
     *         if the action cannot be carried out
     */
    public static ActionResult execute(Game game, RuleEngine engine, GameAction action) {
        ActionResult result = engine.checkAction(game, action);
        if (!result.accepted()) {
            return result;
        }

        Optional<String> problem = checkPreconditions(game, action);
        if (problem.isPresent()) {
            log.debug("action-refused gameId={} action={} reason={}",
                    game.getId(), action.getClass().getSimpleName(), problem.get());
            return ActionResult.rejected(RuleViolation.error(EXECUTION_RULE, problem.get()));
        }

        Optional<RuleViolation> hookFailure = engine.applyEffects(game, action);
        if (hookFailure.isPresent()) {
            return ActionResult.rejected(hookFailure.get());
        }

        Player player = game.findPlayer(action.playerId()).orElseThrow();
        if (action instanceof GameAction.DrawCard) {
            drawCard(game, player);
        } else if (action instanceof GameAction.PlayCard play) {
            playCard(game, player, play);
        } else if (action instanceof GameAction.AttachEnergy attach) {
            attachEnergy(game, player, attach);
        } else if (action instanceof GameAction.UseAttack attack) {
            useAttack(game, player, attack);
        } else if (action instanceof GameAction.Retreat retreat) {
            retreat(game, player, retreat);
        } else if (action instanceof GameAction.EndTurn) {
            endTurn(game, player);
        } else if (action instanceof GameAction.Pass) {
            game.recordEvent(new GameEvent.TurnPassed(player.getId()));
        }
        log.debug("action-executed gameId={} action={} playerId={}",
                game.getId(), action.getClass().getSimpleName(), player.getId());
        return result;
    }

    // ---- Preconditions ----

    private static Optional<String> checkPreconditions(Game game, GameAction action) {
        if (!game.isInProgress()) {
            return Optional.of("Game is not in progress");
        }
        Optional<Player> found = game.findPlayer(action.playerId());
        if (found.isEmpty()) {
            return Optional.of("Player not found: " + action.playerId());
        }
        Player player = found.get();

        if (action instanceof GameAction.PlayCard play) {
            if (!player.getHand().contains(play.cardId())) {
                return Optional.of("Card is not in hand");
            }
            Optional<Card> card = game.getCardDatabase().findCard(play.cardId());
            if (card.isEmpty()) {
                return Optional.of("Card not found in database: " + play.cardId());
            }
            if (card.get().isEnergy()) {
                return Optional.of("Energy cards must be attached");
            }
            if (card.get().isPokemon() && (!card.get().isBasicPokemon() || player.getBench().isFull())) {
                return Optional.of("Cannot bench " + card.get().getName());
            }
        } else if (action instanceof GameAction.AttachEnergy attach) {
            if (!player.getHand().contains(attach.energyId()) || !player.isInPlay(attach.pokemonId())) {
                return Optional.of("Cannot attach energy " + attach.energyId() + " to " + attach.pokemonId());
            }
        } else if (action instanceof GameAction.UseAttack attack) {
            if (!player.getActivePokemon().map(attack.pokemonId()::equals).orElse(false)) {
                return Optional.of("Attacker is not the active Pokemon");
            }
            Optional<Card> card = game.getCardDatabase().findCard(attack.pokemonId());
            if (card.isEmpty() || attack.attackIndex() < 0 || attack.attackIndex() >= card.get().getAttacks().size()) {
                return Optional.of("No attack at index " + attack.attackIndex());
            }
            if (findDefenders(game, player, attack, card.get().getAttacks().get(attack.attackIndex())).isEmpty()) {
                return Optional.of("No defending Pokemon to attack");
            }
        } else if (action instanceof GameAction.Retreat retreat) {
            Optional<UUID> active = player.getActivePokemon();
            if (active.isEmpty() || !player.getBench().contains(retreat.replacementId())) {
                return Optional.of("Cannot retreat to " + retreat.replacementId());
            }
            if (player.getAttachedEnergyCount(active.get()) < retreatCost(game, active.get())) {
                return Optional.of("Not enough energy to retreat");
            }
        } else if (action instanceof GameAction.EndTurn) {
            if (game.getTurnOrder().isEmpty()) {
                return Optional.of("No turn order");
            }
        }
        return Optional.empty();
    }

    // ---- Actions ----

    private static void drawCard(Game game, Player player) {
        Optional<UUID> drawn = player.drawCard();
        game.recordEvent(new GameEvent.CardDrawn(player.getId(), drawn.orElse(null)));
        trigger(game, EffectTrigger.ON_CARD_DRAW, player.getId(), drawn.orElse(null));
    }

    private static void playCard(Game game, Player player, GameAction.PlayCard play) {
        Card card = game.getCardDatabase().findCard(play.cardId()).orElseThrow();
        if (card.isPokemon()) {
            player.benchPokemon(card.getId());
            game.recordEvent(new GameEvent.PokemonBenched(player.getId(), card.getId()));
            trigger(game, EffectTrigger.ON_ENTER_PLAY, player.getId(), card.getId());
        } else {
            TrainerType trainerType = card.getTrainerData().map(CardKind.Trainer::trainerType).orElse(TrainerType.ITEM);
            player.getHand().remove(card.getId());
            if (trainerType == TrainerType.STADIUM) {
                player.setStadium(card.getId()).ifPresent(previous -> player.getDiscardPile().add(previous));
            } else {
                player.getDiscardPile().add(card.getId());
            }
            if (trainerType == TrainerType.SUPPORTER) {
                player.setSupporterPlayedThisTurn(true);
            }
        }
        game.recordEvent(new GameEvent.CardPlayed(player.getId(), card.getId(), play.target()));
        trigger(game, EffectTrigger.ON_PLAY, player.getId(), card.getId());
    }

    private static void attachEnergy(Game game, Player player, GameAction.AttachEnergy attach) {
        player.attachEnergy(attach.energyId(), attach.pokemonId());
        player.setEnergyAttachedThisTurn(true);
        game.recordEvent(new GameEvent.EnergyAttached(player.getId(), attach.energyId(), attach.pokemonId()));
        trigger(game, EffectTrigger.ON_ENERGY_ATTACH, player.getId(), attach.pokemonId());
    }

    private static void useAttack(Game game, Player attacker, GameAction.UseAttack action) {
        Card attackerCard = game.getCardDatabase().findCard(action.pokemonId()).orElseThrow();
        Attack attack = attackerCard.getAttacks().get(action.attackIndex());
        List<Defender> defenders = findDefenders(game, attacker, action, attack);
        Player opponent = game.getOpponent(attacker.getId()).orElseThrow();

        attacker.setHasAttacked(true);
        game.recordEvent(new GameEvent.AttackUsed(attacker.getId(), action.pokemonId(), attack.getName(),
                defenders.get(0).pokemonId()));
        trigger(game, EffectTrigger.ON_ATTACK, attacker.getId(), action.pokemonId());

        List<Boolean> flips = attack.getCoinFlipCount() > 0
                ? game.getRng().flipCoins(attack.getCoinFlipCount())
                : List.of();
        int base = attack.calculateDamage(
                energyCountFor(game, attacker, action.pokemonId(), attack),
                flips,
                pokemonCountFor(attacker, opponent, attack));

        for (Defender defender : defenders) {
            boolean defendingActive = defender.owner() == opponent
                    && defender.owner().getActivePokemon().map(defender.pokemonId()::equals).orElse(false);
            int damage = defendingActive
                    ? applyWeaknessAndResistance(game, attack, defender.pokemonId(), base)
                    : Math.max(0, base);
            if (damage > 0) {
                defender.owner().addDamage(defender.pokemonId(), damage);
                game.recordEvent(new GameEvent.DamageDealt(defender.owner().getId(), defender.pokemonId(), damage,
                        attack.getName()));
                trigger(game, EffectTrigger.ON_TAKE_DAMAGE, defender.owner().getId(), defender.pokemonId());
            }
            log.debug("attack gameId={} attacker={} attack={} defender={} base={} damage={}",
                    game.getId(), action.pokemonId(), attack.getName(), defender.pokemonId(), base, damage);
        }

        for (StatusEffect status : attack.getStatusEffects()) {
            if (StatusEffect.SELF.equals(status.target())) {
                inflict(game, attacker, action.pokemonId(), status);
            } else {
                for (Defender defender : defenders) {
                    inflict(game, defender.owner(), defender.pokemonId(), status);
                }
            }
        }

        boolean knockedOut = false;
        for (Defender defender : defenders) {
            Card defenderCard = game.getCardDatabase().findCard(defender.pokemonId()).orElseThrow();
            if (defender.owner().isInPlay(defender.pokemonId())
                    && defender.owner().isKnockedOut(defender.pokemonId(), defenderCard)) {
                TurnManager.resolveKnockOut(game, defender.owner(), defender.pokemonId());
                knockedOut = true;
            }
        }
        if (knockedOut) {
            TurnManager.checkWinConditions(game);
        }
    }

    private static void inflict(Game game, Player owner, UUID pokemonId, StatusEffect status) {
        if (owner.isInPlay(pokemonId) && game.getRng().rollPercent(status.probability())) {
            owner.addSpecialCondition(pokemonId, status.condition(), SpecialConditionInstance.PERMANENT,
                    game.getTurnNumber());
            game.recordEvent(new GameEvent.SpecialConditionApplied(owner.getId(), pokemonId, status.condition()));
        }
    }

    private static void retreat(Game game, Player player, GameAction.Retreat retreat) {
        UUID retreating = player.getActivePokemon().orElseThrow();
        player.discardEnergy(retreating, retreatCost(game, retreating));
        player.switchActive(retreat.replacementId());
        player.setRetreatedThisTurn(true);
        game.recordEvent(new GameEvent.PokemonRetreated(player.getId(), retreating, retreat.replacementId()));
    }

    private static void endTurn(Game game, Player player) {
        game.recordEvent(new GameEvent.TurnEnded(player.getId(), game.getTurnNumber()));
        int next = (game.getCurrentPlayerIndex() + 1) % game.getTurnOrder().size();
        game.setCurrentPlayerIndex(next);
        game.setTurnNumber(game.getTurnNumber() + 1);
        game.setPhase(GamePhase.BEGINNING_OF_TURN);
        game.getCurrentPlayerId()
                .flatMap(game::findPlayer)
                .ifPresent(Player::startTurn);
    }

    // ---- Helpers ----

    private record Defender(Player owner, UUID pokemonId) {}

    /**
     * The Pokemon an attack hits, by its target type.
     * <ul>
     *   <li>ACTIVE: the opponent's active Pokemon; an explicit target must be that Pokemon</li>
     *   <li>CHOOSE: the explicit target among the opponent's Pokemon in play, else the active one</li>
     *   <li>BENCH: the explicit target, which must be on the opponent's bench</li>
     *   <li>ALL: every opponent Pokemon in play, active first</li>
     *   <li>SELF: the attacking Pokemon</li>
     * </ul>
     * An empty list means the attack has nothing to hit.
     */
    private static List<Defender> findDefenders(Game game, Player attacker, GameAction.UseAttack action,
                                                Attack attack) {
        if (attack.getTargetType() == AttackTargetType.SELF) {
            return List.of(new Defender(attacker, action.pokemonId()));
        }
        Optional<Player> found = game.getOpponent(attacker.getId());
        if (found.isEmpty()) {
            return List.of();
        }
        Player opponent = found.get();
        Optional<UUID> active = opponent.getActivePokemon();
        UUID target = action.target();
        List<Defender> defenders = new ArrayList<>();
        switch (attack.getTargetType()) {
            case ALL -> {
                for (UUID pokemon : opponent.getPokemonInPlay()) {
                    defenders.add(new Defender(opponent, pokemon));
                }
            }
            case BENCH -> {
                if (target != null && opponent.getBench().contains(target)) {
                    defenders.add(new Defender(opponent, target));
                }
            }
            case CHOOSE -> {
                if (target == null) {
                    active.ifPresent(id -> defenders.add(new Defender(opponent, id)));
                } else if (opponent.isInPlay(target)) {
                    defenders.add(new Defender(opponent, target));
                }
            }
            default -> {
                if (active.isPresent() && (target == null || target.equals(active.get()))) {
                    defenders.add(new Defender(opponent, active.get()));
                }
            }
        }
        return defenders;
    }

    private static int energyCountFor(Game game, Player player, UUID pokemonId, Attack attack) {
        if (attack.getDamageMode() instanceof DamageMode.PerEnergy perEnergy && perEnergy.energyType() != null) {
            return (int) player.getAttachedEnergyTypes(pokemonId, game.getCardDatabase()).stream()
                    .filter(perEnergy.energyType()::equals)
                    .count();
        }
        return player.getAttachedEnergyCount(pokemonId);
    }

    private static int pokemonCountFor(Player attacker, Player defender, Attack attack) {
        if (!(attack.getDamageMode() instanceof DamageMode.PerPokemon perPokemon)) {
            return 0;
        }
        if ("opponent_bench".equals(perPokemon.location())) {
            return defender.getBench().size();
        }
        if ("in_play".equals(perPokemon.location())) {
            return attacker.getPokemonInPlay().size();
        }
        return attacker.getBench().size();
    }

    /**
     * Double the damage on weakness, take 30 off on resistance, never below zero.
     * The attacking type is the first non-Colorless energy in the attack's cost.
     */
    static int applyWeaknessAndResistance(Game game, Attack attack, UUID defenderId, int damage) {
        Optional<EnergyType> attackingType = attack.getCost().stream()
                .filter(type -> type != EnergyType.COLORLESS)
                .findFirst();
        Optional<CardKind.Pokemon> defender = game.getCardDatabase().findCard(defenderId).flatMap(Card::getPokemonData);
        if (attackingType.isEmpty() || defender.isEmpty()) {
            return Math.max(0, damage);
        }
        int result = damage;
        if (attackingType.get() == defender.get().weakness()) {
            result *= 2;
        }
        if (attackingType.get() == defender.get().resistance()) {
            result -= RESISTANCE_REDUCTION;
        }
        return Math.max(0, result);
    }

    private static int retreatCost(Game game, UUID pokemonId) {
        return game.getCardDatabase().findCard(pokemonId)
                .flatMap(Card::getPokemonData)
                .map(CardKind.Pokemon::retreatCost)
                .orElse(0);
    }

    private static void trigger(Game game, EffectTrigger trigger, UUID playerId, UUID cardId) {
        Map<String, String> data = cardId == null ? Map.of() : Map.of("card_id", cardId.toString());
        game.getEffectManager().triggerEffects(game, trigger,
                new EffectContext(null, playerId, new EffectTarget.Self(), trigger, data));
    }
}
