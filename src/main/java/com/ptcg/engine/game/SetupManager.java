package com.ptcg.engine.game;

import com.ptcg.engine.card.Card;
import com.ptcg.engine.events.GameEvent;
import com.ptcg.engine.game.zones.Bench;
import com.ptcg.engine.player.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Pre-game setup: turn order, opening hands, the mulligan protocol, active and
 * bench placement, prizes, and the hand-off to the first turn.
 * <p>
 * Every operation requires the game to be in {@link GameStatus#SETUP} and throws
 * {@link GameException} without changing anything when a precondition fails.
 */
public final class SetupManager {
    private static final Logger log = LoggerFactory.getLogger(SetupManager.class);

    public static final int OPENING_HAND_SIZE = 7;

    /** Upper bound on redraws in {@link #mulliganUntilBasic}. */
    static final int MAX_MULLIGANS = 100;

    private SetupManager() {
        // Utility class - prevent instantiation
    }

    /**
     * Check the table is ready: at least two players, each with cards in their deck.
     */
    public static void startSetup(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "start setup");
        requireEnoughPlayers(game);
        for (Player player : game.getPlayers()) {
            if (player.getDeck().isEmpty()) {
                throw new GameException("Player " + player.getName() + " has an empty deck");
            }
        }
        log.info("setup step=start gameId={} players={}", game.getId(), game.playerCount());
    }

    /**
     * Choose the first player at random. The others follow in seating order.
     * @return the turn order
     */
    public static List<UUID> determineTurnOrder(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "determine turn order");
        requireEnoughPlayers(game);

        List<Player> seating = game.getPlayers();
        int firstIndex = game.getRng().nextInt(seating.size());
        List<UUID> order = new ArrayList<>(seating.size());
        order.add(seating.get(firstIndex).getId());
        for (int i = 0; i < seating.size(); i++) {
            if (i != firstIndex) {
                order.add(seating.get(i).getId());
            }
        }

        game.setTurnOrder(order);
        game.setTurnOrderDetermined(true);
        game.recordEvent(new GameEvent.TurnOrderDetermined(order, order.get(0)));
        log.info("setup step=turn-order gameId={} firstPlayer={}", game.getId(), order.get(0));
        return List.copyOf(order);
    }

    /**
     * Each player draws an opening hand of seven.
     */
    public static void dealOpeningHands(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "deal opening hands");
        if (!game.isTurnOrderDetermined()) {
            throw new GameException("Turn order must be determined before dealing opening hands");
        }
        for (Player player : game.getPlayers()) {
            if (!player.getHand().isEmpty()) {
                throw new GameException("Opening hands have already been dealt");
            }
        }
        for (UUID playerId : game.getTurnOrder()) {
            Player player = game.getPlayer(playerId);
            List<UUID> drawn = player.drawCards(OPENING_HAND_SIZE);
            game.recordEvent(new GameEvent.OpeningHandsDealt(playerId, drawn.size()));
            log.info("setup step=deal gameId={} playerId={} handSize={}", game.getId(), playerId, drawn.size());
        }
    }

    /**
     * Players whose hand holds no Basic Pokemon, in seating order.
     */
    public static List<UUID> checkForBasicPokemon(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "check for Basic Pokemon");
        List<UUID> withoutBasic = new ArrayList<>();
        for (Player player : game.getPlayers()) {
            if (player.findBasicPokemonInHand(game.getCardDatabase()).isEmpty()) {
                withoutBasic.add(player.getId());
            }
        }
        return withoutBasic;
    }

    public static MulliganDeclaration declareNoBasicPokemon(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "declare no Basic Pokemon");
        List<UUID> withoutBasic = checkForBasicPokemon(game);
        boolean all = !withoutBasic.isEmpty() && withoutBasic.size() == game.playerCount();
        return new MulliganDeclaration(withoutBasic, all);
    }

    /**
     * Defer a player's mulligan until their opponent has finished setting up.
     */
    public static void markPlayerForMulligan(Game game, UUID playerId) throws GameException {
        game.requireStatus(GameStatus.SETUP, "mark a player for mulligan");
        game.getPlayer(playerId);
        game.setPlayerAwaitingMulligan(playerId);
        log.info("setup step=mulligan-deferred gameId={} playerId={}", game.getId(), playerId);
    }

    /**
     * Show the declaring player's hand to the opponent and the opponent's hand to the declaring player.
     */
    public static List<HandReveal> revealHands(Game game, UUID playerId) throws GameException {
        game.requireStatus(GameStatus.SETUP, "reveal hands");
        Player player = game.getPlayer(playerId);
        Player opponent = game.getOpponent(playerId)
                .orElseThrow(() -> new GameException("Player " + playerId + " has no opponent"));

        List<HandReveal> reveals = List.of(
                new HandReveal(player.getId(), opponent.getId(), player.getHand().getCards()),
                new HandReveal(opponent.getId(), player.getId(), opponent.getHand().getCards()));
        for (HandReveal reveal : reveals) {
            game.recordEvent(new GameEvent.HandRevealed(reveal.playerId(), reveal.revealedTo(), reveal.cards()));
        }
        return reveals;
    }

    /**
     * Shuffle the hand back into the deck and draw seven again.
     * Counts towards every player's compensation limit.
     */
    public static void performMulligan(Game game, UUID playerId) throws GameException {
        game.requireStatus(GameStatus.SETUP, "perform a mulligan");
        Player player = game.getPlayer(playerId);

        player.returnHandToDeck();
        player.shuffleDeck(game.getRng());
        game.recordEvent(new GameEvent.DeckShuffled(playerId));
        player.drawCards(OPENING_HAND_SIZE);
        game.incrementMulliganCount();

        game.recordEvent(new GameEvent.MulliganPerformed(playerId, game.getMulliganCount(), player.getHand().size()));
        log.info("setup step=mulligan gameId={} playerId={} mulliganCount={} handSize={}",
                game.getId(), playerId, game.getMulliganCount(), player.getHand().size());
    }

    /**
     * Mulligan once.
     * @return whether the new hand holds a Basic Pokemon
     */
    public static boolean performMulliganAndCheckBasicPokemon(Game game, UUID playerId) throws GameException {
        performMulligan(game, playerId);
        return hasBasicInHand(game, game.getPlayer(playerId));
    }

    /**
     * Mulligan until the hand holds a Basic Pokemon.
     * @return the number of mulligans taken
     * @throws GameException if the player's hand and deck hold no Basic Pokemon at all
     */
    public static int mulliganUntilBasic(Game game, UUID playerId) throws GameException {
        game.requireStatus(GameStatus.SETUP, "perform a mulligan");
        Player player = game.getPlayer(playerId);
        if (hasBasicInHand(game, player)) {
            return 0;
        }
        if (!player.hasBasicPokemonInHandOrDeck(game.getCardDatabase())) {
            throw new GameException("Player " + player.getName() + " has no Basic Pokemon in hand or deck");
        }
        int mulligans = 0;
        while (mulligans < MAX_MULLIGANS) {
            mulligans++;
            if (performMulliganAndCheckBasicPokemon(game, playerId)) {
                return mulligans;
            }
        }
        throw new GameException("No Basic Pokemon drawn after " + MAX_MULLIGANS + " mulligans");
    }

    /**
     * Every player mulligans once.
     */
    public static MulliganResult performMulliganForAll(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "perform mulligans");
        List<UUID> withoutBasic = new ArrayList<>();
        for (Player player : game.getPlayers()) {
            if (!performMulliganAndCheckBasicPokemon(game, player.getId())) {
                withoutBasic.add(player.getId());
            }
        }
        if (withoutBasic.isEmpty()) {
            return new MulliganResult.AllWithBasic();
        }
        if (withoutBasic.size() == game.playerCount()) {
            return new MulliganResult.AllWithoutBasic();
        }
        return new MulliganResult.OneWithoutBasic(withoutBasic.get(0));
    }

    /**
     * Reveal both hands, then mulligan the declaring player once.
     * @return whether the new hand holds a Basic Pokemon
     */
    public static boolean declareAndPerformMulligan(Game game, UUID playerId) throws GameException {
        revealHands(game, playerId);
        return performMulliganAndCheckBasicPokemon(game, playerId);
    }

    /**
     * Run the mulligan deferred by {@link #markPlayerForMulligan}, if any.
     * @return the player who mulliganed
     */
    public static Optional<UUID> performPendingMulligans(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "perform pending mulligans");
        Optional<UUID> pending = game.getPlayerAwaitingMulligan();
        if (pending.isPresent()) {
            performMulligan(game, pending.get());
            game.setPlayerAwaitingMulligan(null);
        }
        return pending;
    }

    /**
     * Extra cards a player may draw: the total number of mulligans taken so far.
     */
    public static int getMulliganCompensationLimit(Game game, UUID playerId) throws GameException {
        game.getPlayer(playerId);
        return game.getMulliganCount();
    }

    /**
     * Draw up to n extra cards for the opponent's mulligans. Each player may claim once.
     * @return the cards drawn
     */
    public static List<UUID> mulliganCompensation(Game game, UUID playerId, int n) throws GameException {
        game.requireStatus(GameStatus.SETUP, "draw mulligan compensation");
        Player player = game.getPlayer(playerId);
        int limit = getMulliganCompensationLimit(game, playerId);
        if (n < 0 || n > limit) {
            throw new GameException("Declared card count " + n + " is outside 0.." + limit);
        }
        if (game.hasTakenCompensation(playerId)) {
            throw new GameException("Player " + player.getName() + " has already drawn mulligan compensation");
        }
        game.markCompensationTaken(playerId);
        List<UUID> drawn = player.drawCards(n);
        for (UUID cardId : drawn) {
            game.recordEvent(new GameEvent.CardDrawn(playerId, cardId));
        }
        log.info("setup step=compensation gameId={} playerId={} requested={} drawn={}",
                game.getId(), playerId, n, drawn.size());
        return drawn;
    }

    /**
     * Put a Basic Pokemon from the hand into the active spot.
     * A Pokemon already there moves to the bench.
     */
    public static void selectActivePokemon(Game game, UUID playerId, UUID cardId) throws GameException {
        game.requireStatus(GameStatus.SETUP, "select an active Pokemon");
        Player player = game.getPlayer(playerId);
        if (!player.getHand().contains(cardId)) {
            throw new GameException("Selected Pokemon is not in player's hand");
        }
        Card card = game.getCardDatabase().findCard(cardId)
                .orElseThrow(() -> new GameException("Card not found in database: " + cardId));
        if (!card.isPokemon()) {
            throw new GameException(card.getName() + " is not a Pokemon");
        }
        if (!card.isBasicPokemon()) {
            throw new GameException(card.getName() + " is not a Basic Pokemon");
        }
        if (!player.setActivePokemon(cardId)) {
            throw new GameException("No bench space for the current active Pokemon");
        }
        game.recordEvent(new GameEvent.ActivePokemonSelected(playerId, cardId));
        log.info("setup step=active gameId={} playerId={} pokemon={}", game.getId(), playerId, card.getName());
    }

    /**
     * Bench a batch of Pokemon from the hand. Either every card is benched or none is.
     * Pokemon in play are told apart by card id, so a batch may not name a card twice
     * or name a card the player already has in play.
     */
    public static void setupBench(Game game, UUID playerId, List<UUID> cardIds) throws GameException {
        game.requireStatus(GameStatus.SETUP, "set up the bench");
        Player player = game.getPlayer(playerId);

        if (player.getBench().size() + cardIds.size() > Bench.MAX_SIZE) {
            throw new GameException("Bench can hold at most " + Bench.MAX_SIZE + " Pokemon, "
                    + player.getBench().size() + " already benched and " + cardIds.size() + " requested");
        }

        Map<UUID, Integer> available = new HashMap<>();
        for (UUID inHand : player.getHand().getCards()) {
            available.merge(inHand, 1, Integer::sum);
        }
        Set<UUID> requested = new HashSet<>();
        for (UUID cardId : cardIds) {
            if (!requested.add(cardId)) {
                throw new GameException("Card " + cardId + " is requested more than once");
            }
            if (player.isInPlay(cardId)) {
                throw new GameException("Card " + cardId + " is already in play");
            }
            int remaining = available.getOrDefault(cardId, 0);
            if (remaining == 0) {
                throw new GameException("Card " + cardId + " is not in player's hand");
            }
            available.put(cardId, remaining - 1);
            Card card = game.getCardDatabase().findCard(cardId)
                    .orElseThrow(() -> new GameException("Card not found in database: " + cardId));
            if (!card.isPokemon()) {
                throw new GameException(card.getName() + " is not a Pokemon");
            }
        }

        for (UUID cardId : cardIds) {
            player.benchPokemon(cardId);
            game.recordEvent(new GameEvent.PokemonBenched(playerId, cardId));
        }
        log.info("setup step=bench gameId={} playerId={} benched={}", game.getId(), playerId, cardIds.size());
    }

    /**
     * Each player sets aside prizes from the top of their deck. A short deck gives fewer prizes.
     */
    public static void placePrizeCards(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "place prize cards");
        for (Player player : game.getPlayers()) {
            if (!player.getPrizes().isEmpty()) {
                throw new GameException("Prize cards have already been placed for " + player.getName());
            }
        }
        int count = game.getRules().prizeCards();
        for (Player player : game.getPlayers()) {
            int placed = player.placePrizeCards(count);
            game.recordEvent(new GameEvent.PrizeCardsPlaced(player.getId(), placed));
            if (placed < count) {
                log.warn("setup step=prizes gameId={} playerId={} placed={} requested={} reason=short-deck",
                        game.getId(), player.getId(), placed, count);
            } else {
                log.info("setup step=prizes gameId={} playerId={} placed={}", game.getId(), player.getId(), placed);
            }
        }
    }

    /**
     * Finish setup and begin the first turn.
     * @throws GameException if any player has no active Pokemon or a mulligan is still pending
     */
    public static void completeSetup(Game game) throws GameException {
        game.requireStatus(GameStatus.SETUP, "complete setup");
        requireEnoughPlayers(game);
        for (Player player : game.getPlayers()) {
            if (player.getActivePokemon().isEmpty()) {
                throw new GameException("Player " + player.getName() + " has no active Pokemon");
            }
        }
        if (game.getPlayerAwaitingMulligan().isPresent()) {
            throw new GameException("A mulligan is still pending for " + game.getPlayerAwaitingMulligan().get());
        }

        game.setStatus(GameStatus.IN_PROGRESS);
        game.setCurrentPlayerIndex(0);
        game.setPhase(GamePhase.BEGINNING_OF_TURN);
        game.recordEvent(new GameEvent.GameStarted(game.getId(), game.getTurnOrder()));
        log.info("setup step=complete gameId={} firstPlayer={}", game.getId(), game.getCurrentPlayerId().orElse(null));
        TurnManager.startTurn(game);
    }

    private static boolean hasBasicInHand(Game game, Player player) {
        return !player.findBasicPokemonInHand(game.getCardDatabase()).isEmpty();
    }

    private static void requireEnoughPlayers(Game game) throws GameException {
        if (game.playerCount() < Game.MAX_PLAYERS) {
            throw new GameException("Need " + Game.MAX_PLAYERS + " players, have " + game.playerCount());
        }
    }
}
