package com.ptcg.engine.game;

import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardDatabase;
import com.ptcg.engine.deck.Deck;
import com.ptcg.engine.effects.EffectManager;
import com.ptcg.engine.events.GameEvent;
import com.ptcg.engine.events.GameEventLog;
import com.ptcg.engine.events.LoggingEventListener;
import com.ptcg.engine.player.Player;
import com.ptcg.engine.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Complete state of one match.
 * <p>
 * A Game owns its players, event log, random source and effect manager; nothing
 * here is shared between matches except the immutable {@link CardDatabase}.
 * Setup and turn logic live in {@link SetupManager}, {@link TurnManager} and
 * {@link ActionExecutor}.
 */
public class Game {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    public static final int MAX_PLAYERS = 2;

    private final UUID id;
    private final GameRules rules;
    private final GameRng rng;
    private final GameEventLog eventLog;
    private final EffectManager effectManager;
    private CardDatabase cardDatabase;

    // Players in seating order
    private final Map<UUID, Player> players;
    private final List<UUID> turnOrder;
    private int currentPlayerIndex;

    // Match progress
    private GameStatus status;
    private UUID winner;
    private GamePhase phase;
    private int turnNumber;

    // Setup-only state
    private boolean turnOrderDetermined;
    private UUID playerAwaitingMulligan;
    private int mulliganCount;
    private final Set<UUID> compensatedPlayers;

    public Game(CardDatabase cardDatabase) {
        this(GameRules.defaults(), cardDatabase, new GameRng());
    }

    public Game(GameRules rules, CardDatabase cardDatabase, GameRng rng) {
        this.id = UUID.randomUUID();
        this.rules = rules;
        this.cardDatabase = cardDatabase;
        this.rng = rng;
        this.eventLog = new GameEventLog();
        this.eventLog.addListener(new LoggingEventListener(id));
        this.effectManager = new EffectManager();
        this.players = new LinkedHashMap<>();
        this.turnOrder = new ArrayList<>();
        this.currentPlayerIndex = 0;
        this.status = GameStatus.SETUP;
        this.phase = GamePhase.BEGINNING_OF_TURN;
        this.turnNumber = 1;
        this.compensatedPlayers = new HashSet<>();
    }

    // ---- Players ----

    /**
     * Seat a new player with the given deck. The deck's cards become the player's
     * draw pile, shuffled when the rules ask for it.
     * @throws GameException outside setup, when the table is full, or if the deck
     *                       holds a card the database does not know
     */
    public Player addPlayer(String name, Deck deck) throws GameException {
        List<UUID> cards = rules.autoShuffle() ? deck.shuffle(rng) : deck.toCardList();
        Player player = new Player(name);
        player.setDeck(cards);
        addPlayer(player);
        return player;
    }

    /**
     * Seat an already built player.
     * @throws GameException outside setup, when the table is full, or if the player
     *                       holds a card the database does not know
     */
    public void addPlayer(Player player) throws GameException {
        requireStatus(GameStatus.SETUP, "add a player");
        if (players.size() >= MAX_PLAYERS) {
            throw new GameException("Game already has " + MAX_PLAYERS + " players");
        }
        if (players.containsKey(player.getId())) {
            throw new GameException("Player already seated: " + player.getId());
        }
        for (UUID cardId : player.cardCounts().keySet()) {
            if (!cardDatabase.hasCard(cardId)) {
                throw new GameException("Card " + cardId + " of player " + player.getName()
                        + " is not in the card database");
            }
        }
        players.put(player.getId(), player);
        turnOrder.add(player.getId());
        log.info("player-added gameId={} playerId={} name={} deckSize={}",
                id, player.getId(), player.getName(), player.getDeck().size());
    }

    /**
     * Add cards to this game's database. Only allowed during setup.
     */
    public void registerCards(Collection<Card> cards) throws GameException {
        requireStatus(GameStatus.SETUP, "register cards");
        cardDatabase = cardDatabase.withCards(cards);
    }

    public Player getPlayer(UUID playerId) throws GameException {
        Player player = players.get(playerId);
        if (player == null) {
            throw new GameException("Player not found: " + playerId);
        }
        return player;
    }

    public Optional<Player> findPlayer(UUID playerId) {
        return Optional.ofNullable(players.get(playerId));
    }

    /**
     * Players in seating order.
     */
    public List<Player> getPlayers() {
        return List.copyOf(players.values());
    }

    public int playerCount() {
        return players.size();
    }

    /**
     * The first other player, in seating order.
     */
    public Optional<Player> getOpponent(UUID playerId) {
        for (Player player : players.values()) {
            if (!player.getId().equals(playerId)) {
                return Optional.of(player);
            }
        }
        return Optional.empty();
    }

    /**
     * The player who holds a card. Decks may share card ids, so a player with the
     * card in play is preferred over one holding it in another zone.
     */
    public Optional<Player> findOwner(UUID cardId) {
        for (Player player : players.values()) {
            if (player.isInPlay(cardId)) {
                return Optional.of(player);
            }
        }
        for (Player player : players.values()) {
            if (player.findCardLocation(cardId).isPresent()) {
                return Optional.of(player);
            }
        }
        return Optional.empty();
    }

    // ---- Turn order ----

    public List<UUID> getTurnOrder() {
        return List.copyOf(turnOrder);
    }

    void setTurnOrder(List<UUID> order) {
        turnOrder.clear();
        turnOrder.addAll(order);
        currentPlayerIndex = 0;
    }

    public int getCurrentPlayerIndex() {
        return currentPlayerIndex;
    }

    void setCurrentPlayerIndex(int currentPlayerIndex) {
        this.currentPlayerIndex = currentPlayerIndex;
    }

    public Optional<UUID> getCurrentPlayerId() {
        if (currentPlayerIndex < 0 || currentPlayerIndex >= turnOrder.size()) {
            return Optional.empty();
        }
        return Optional.of(turnOrder.get(currentPlayerIndex));
    }

    public Player getCurrentPlayer() throws GameException {
        UUID current = getCurrentPlayerId()
                .orElseThrow(() -> new GameException("No current player"));
        return getPlayer(current);
    }

    public boolean isCurrentPlayer(UUID playerId) {
        return getCurrentPlayerId().map(playerId::equals).orElse(false);
    }

    public boolean isTurnOrderDetermined() {
        return turnOrderDetermined;
    }

    void setTurnOrderDetermined(boolean turnOrderDetermined) {
        this.turnOrderDetermined = turnOrderDetermined;
    }

    // ---- Status ----

    public GameStatus getStatus() {
        return status;
    }

    void setStatus(GameStatus status) {
        this.status = status;
    }

    public boolean isInProgress() {
        return status == GameStatus.IN_PROGRESS;
    }

    /**
     * The winner once FINISHED; empty while playing, after a cancel, or for a draw.
     */
    public Optional<UUID> getWinner() {
        return Optional.ofNullable(winner);
    }

    void setWinner(UUID winner) {
        this.winner = winner;
    }

    public GamePhase getPhase() {
        return phase;
    }

    void setPhase(GamePhase phase) {
        this.phase = phase;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    void setTurnNumber(int turnNumber) {
        this.turnNumber = turnNumber;
    }

    /**
     * Throw unless the game is in the given status.
     * @param operation what the caller tried to do, for the message
     */
    public void requireStatus(GameStatus required, String operation) throws GameException {
        if (status != required) {
            throw new GameException("Cannot " + operation + " while game is " + status
                    + " (requires " + required + ")");
        }
    }

    // ---- Mulligan bookkeeping ----

    public Optional<UUID> getPlayerAwaitingMulligan() {
        return Optional.ofNullable(playerAwaitingMulligan);
    }

    void setPlayerAwaitingMulligan(UUID playerAwaitingMulligan) {
        this.playerAwaitingMulligan = playerAwaitingMulligan;
    }

    /**
     * Mulligans performed so far by all players.
     */
    public int getMulliganCount() {
        return mulliganCount;
    }

    void incrementMulliganCount() {
        mulliganCount++;
    }

    public boolean hasTakenCompensation(UUID playerId) {
        return compensatedPlayers.contains(playerId);
    }

    void markCompensationTaken(UUID playerId) {
        compensatedPlayers.add(playerId);
    }

    // ---- Shared services ----

    public void recordEvent(GameEvent event) {
        eventLog.record(event);
    }

    public UUID getId() {
        return id;
    }

    public GameRules getRules() {
        return rules;
    }

    public GameRng getRng() {
        return rng;
    }

    public GameEventLog getEventLog() {
        return eventLog;
    }

    public EffectManager getEffectManager() {
        return effectManager;
    }

    public CardDatabase getCardDatabase() {
        return cardDatabase;
    }
}
