package com.ptcg.engine.game;

import com.ptcg.engine.card.Card;
import com.ptcg.engine.effects.EffectContext;
import com.ptcg.engine.effects.EffectTarget;
import com.ptcg.engine.effects.EffectTrigger;
import com.ptcg.engine.events.GameEvent;
import com.ptcg.engine.player.ConditionEffect;
import com.ptcg.engine.player.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Manages turn structure: turn start and end, phases, between-turn special
 * conditions, knock-outs and the end of the match.
 */
public final class TurnManager {
    private static final Logger log = LoggerFactory.getLogger(TurnManager.class);

    private TurnManager() {
        // Utility class - prevent instantiation
    }

    /**
     * Start the match without the setup protocol: the players play in seating order.
     *
     * @param game a game in SETUP with at least two players holding cards
     * @throws GameException if the game cannot start
     */
    public static void start(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "start the game");
        if (game.playerCount() < Game.MAX_PLAYERS) {
            throw new GameException("Need " + Game.MAX_PLAYERS + " players, have " + game.playerCount());
        }
        for (Player player : game.getPlayers()) {
            if (player.getDeck().isEmpty()) {
                throw new GameException("Player " + player.getName() + " has an empty deck");
            }
        }
        game.setStatus(GameStatus.IN_PROGRESS);
        game.setCurrentPlayerIndex(0);
        game.setPhase(GamePhase.BEGINNING_OF_TURN);
        game.recordEvent(new GameEvent.GameStarted(game.getId(), game.getTurnOrder()));
        log.info("game-started gameId={} firstPlayer={}", game.getId(), game.getCurrentPlayerId().orElse(null));
        startTurn(game);
    }

    /**
     * Begin the current player's turn: reset their per-turn flags, draw one card
     * and fire turn-start effects. An empty deck draws nothing.
     *
     * @param game a game in progress
     */
    public static void startTurn(Game game) throws GameException {
        game.requireStatus(GameStatus.IN_PROGRESS, "start a turn");
        Player player = game.getCurrentPlayer();
        player.startTurn();
        game.setPhase(GamePhase.BEGINNING_OF_TURN);
        game.recordEvent(new GameEvent.TurnStarted(player.getId(), game.getTurnNumber()));

        Optional<UUID> drawn = player.drawCard();
        game.recordEvent(new GameEvent.CardDrawn(player.getId(), drawn.orElse(null)));
        if (drawn.isEmpty()) {
            log.warn("turn-draw gameId={} playerId={} result=empty-deck", game.getId(), player.getId());
        }

        game.getEffectManager().onTurnStart(game, player.getId());
        log.debug("turn-started gameId={} playerId={} turn={}", game.getId(), player.getId(), game.getTurnNumber());
    }

    /**
     * End the current player's turn and start the next one. The turn number
     * goes up once every player has had a turn. Nothing follows if the match ended.
     *
     * @param game a game in progress
     */
    public static void endTurn(Game game) throws GameException {
        game.requireStatus(GameStatus.IN_PROGRESS, "end a turn");
        Player player = game.getCurrentPlayer();
        game.recordEvent(new GameEvent.TurnEnded(player.getId(), game.getTurnNumber()));
        game.getEffectManager().onTurnEnd(game, player.getId());

        if (checkWinConditions(game).isPresent()) {
            return;
        }

        int next = (game.getCurrentPlayerIndex() + 1) % game.getTurnOrder().size();
        game.setCurrentPlayerIndex(next);
        if (next == 0) {
            game.setTurnNumber(game.getTurnNumber() + 1);
        }
        startTurn(game);
    }

    /**
     * Move to the next phase. Leaving END_OF_TURN ends the turn.
     *
     * @return the phase the game is in afterwards
     */
    public static GamePhase nextPhase(Game game) throws GameException {
        game.requireStatus(GameStatus.IN_PROGRESS, "change phase");
        GamePhase from = game.getPhase();
        if (from == GamePhase.END_OF_TURN) {
            endTurn(game);
            return game.getPhase();
        }
        GamePhase to = from.next();
        game.setPhase(to);
        game.recordEvent(new GameEvent.PhaseChanged(game.getCurrentPlayerId().orElse(null), from, to));
        return to;
    }

    /**
     * End the match if a player has taken every prize or has no Pokemon left in play.
     * A player who has taken every prize wins even if they have also run out of Pokemon.
     *
     * @return the winner, if the match is over
     */
    public static Optional<UUID> checkWinConditions(Game game) {
        if (!game.isInProgress()) {
            return game.getWinner();
        }
        for (Player player : game.getPlayers()) {
            if (player.hasWon()) {
                finish(game, player.getId(), "All prize cards taken");
                return Optional.of(player.getId());
            }
        }
        for (Player player : game.getPlayers()) {
            if (player.hasLost()) {
                Optional<Player> opponent = game.getOpponent(player.getId());
                UUID winner = opponent.map(Player::getId).orElse(null);
                finish(game, winner, player.getName() + " has no Pokemon in play");
                return Optional.ofNullable(winner);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a player's special conditions between turns: poison and burn damage,
     * coin flips to recover from burn and sleep, expiring durations, then knock-outs.
     *
     * @return the condition effects that were resolved
     */
    public static List<ConditionEffect> applySpecialConditions(Game game, UUID playerId) throws GameException {
        game.requireStatus(GameStatus.IN_PROGRESS, "apply special conditions");
        Player player = game.getPlayer(playerId);
        List<ConditionEffect> effects = player.updateSpecialConditions(game.getTurnNumber());

        for (ConditionEffect effect : effects) {
            if (effect instanceof ConditionEffect.Damage damage) {
                if (player.isInPlay(damage.pokemonId())) {
                    player.addDamage(damage.pokemonId(), damage.amount());
                    game.recordEvent(new GameEvent.DamageDealt(playerId, damage.pokemonId(),
                            damage.amount(), damage.source()));
                }
            } else if (effect instanceof ConditionEffect.CoinFlip flip) {
                boolean heads = game.getRng().flipCoin();
                log.debug("condition-flip gameId={} pokemon={} condition={} heads={}",
                        game.getId(), flip.pokemonId(), flip.condition(), heads);
                if (heads) {
                    player.removeSpecialConditionType(flip.pokemonId(), flip.condition());
                    game.recordEvent(new GameEvent.SpecialConditionRemoved(playerId, flip.pokemonId(), flip.condition()));
                }
            } else if (effect instanceof ConditionEffect.ConditionRemoved removed) {
                game.recordEvent(new GameEvent.SpecialConditionRemoved(playerId, removed.pokemonId(), removed.condition()));
            }
        }

        for (UUID pokemonId : player.getPokemonInPlay()) {
            Optional<Card> card = game.getCardDatabase().findCard(pokemonId);
            if (card.isPresent() && player.isKnockedOut(pokemonId, card.get())) {
                resolveKnockOut(game, player, pokemonId);
            }
        }
        checkWinConditions(game);
        return effects;
    }

    /**
     * Cancel the match. No winner is recorded.
     *
     * @throws GameException if the match is already over
     */
    public static void cancel(Game game, String reason) throws GameException {
        if (game.getStatus().isTerminal()) {
            throw new GameException("Cannot cancel a game that is already " + game.getStatus());
        }
        game.setStatus(GameStatus.CANCELLED);
        game.recordEvent(new GameEvent.GameCancelled(reason));
        log.info("game-cancelled gameId={} reason={}", game.getId(), reason);
    }

    /**
     * A player gives up; their opponent wins.
     */
    public static void concede(Game game, UUID playerId) throws GameException {
        game.requireStatus(GameStatus.IN_PROGRESS, "concede");
        Player player = game.getPlayer(playerId);
        UUID winner = game.getOpponent(playerId).map(Player::getId).orElse(null);
        finish(game, winner, player.getName() + " conceded");
    }

    /**
     * Knock out one of the owner's Pokemon: it goes to the discard pile with its energy,
     * the opponent takes a prize and the owner's first benched Pokemon fills an empty active spot.
     */
    static void resolveKnockOut(Game game, Player owner, UUID pokemonId) {
        game.getEffectManager().triggerEffects(game, EffectTrigger.ON_KNOCK_OUT,
                new EffectContext(null, owner.getId(), new EffectTarget.Self(), EffectTrigger.ON_KNOCK_OUT,
                        Map.of("pokemon_id", pokemonId.toString())));
        if (!owner.knockOut(pokemonId)) {
            return;
        }
        game.getEffectManager().removeCardEffects(pokemonId);
        game.recordEvent(new GameEvent.PokemonKnockedOut(owner.getId(), pokemonId));
        log.info("knock-out gameId={} playerId={} pokemon={}", game.getId(), owner.getId(), pokemonId);

        Optional<Player> opponent = game.getOpponent(owner.getId());
        if (opponent.isPresent() && opponent.get().takePrizeCard()) {
            game.recordEvent(new GameEvent.PrizeTaken(opponent.get().getId(), opponent.get().getPrizeCards()));
        }
        owner.promoteFromBench()
                .ifPresent(promoted -> game.recordEvent(new GameEvent.PokemonPromoted(owner.getId(), promoted)));
    }

    private static void finish(Game game, UUID winner, String reason) {
        game.setStatus(GameStatus.FINISHED);
        game.setWinner(winner);
        game.recordEvent(new GameEvent.GameEnded(winner, reason));
        log.info("game-ended gameId={} winner={} reason={}", game.getId(), winner, reason);
    }
}
