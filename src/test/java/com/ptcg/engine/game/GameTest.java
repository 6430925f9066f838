package com.ptcg.engine.game;

import com.ptcg.engine.TestCards;
import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardDatabase;
import com.ptcg.engine.card.EnergyType;
import com.ptcg.engine.deck.Deck;
import com.ptcg.engine.player.Player;
import com.ptcg.engine.rng.GameRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Game.
 */
class GameTest {

    private Card pikachu;
    private Card lightning;
    private Game game;

    @BeforeEach
    void setUp() {
        pikachu = TestCards.basic("Pikachu", 60, 1);
        lightning = TestCards.energy(EnergyType.LIGHTNING);
        game = new Game(GameRules.defaults(), CardDatabase.of(pikachu, lightning), new GameRng(11));
    }

    private Deck deck() {
        Deck deck = new Deck("Sparks", "Standard");
        deck.addCard(pikachu.getId(), 4);
        deck.addCard(lightning.getId(), 56);
        return deck;
    }

    @Test
    void testNewGame() {
        assertEquals(GameStatus.SETUP, game.getStatus());
        assertEquals(GamePhase.BEGINNING_OF_TURN, game.getPhase());
        assertEquals(1, game.getTurnNumber());
        assertTrue(game.getPlayers().isEmpty());
        assertTrue(game.getCurrentPlayerId().isEmpty());
        assertTrue(game.getWinner().isEmpty());
        assertThrows(GameException.class, game::getCurrentPlayer);
    }

    @Test
    void testAddPlayerShufflesDeck() throws GameException {
        Player ash = game.addPlayer("Ash", deck());

        assertEquals(60, ash.getDeck().size());
        assertEquals(deck().shuffle(new GameRng(11)), ash.getDeck().getCards());
        assertEquals(List.of(ash.getId()), game.getTurnOrder());
        assertEquals(ash, game.getPlayer(ash.getId()));
    }

    @Test
    void testTableLimit() throws GameException {
        game.addPlayer("Ash", deck());
        game.addPlayer("Gary", deck());

        GameException e = assertThrows(GameException.class, () -> game.addPlayer("Brock", deck()));
        assertTrue(e.getMessage().contains("2 players"));
    }

    @Test
    void testUnknownCardIsRejected() {
        Deck deck = deck();
        deck.addCard(UUID.randomUUID(), 1);

        assertThrows(GameException.class, () -> game.addPlayer("Ash", deck));
        assertTrue(game.getPlayers().isEmpty());
    }

    @Test
    void testRegisterCardsDuringSetup() throws GameException {
        Card squirtle = TestCards.basic("Squirtle", 50, 1);
        game.registerCards(List.of(squirtle));
        assertTrue(game.getCardDatabase().hasCard(squirtle.getId()));

        Player misty = new Player("Misty");
        misty.setDeck(List.of(squirtle.getId()));
        game.addPlayer(misty);
        assertEquals(1, game.playerCount());
    }

    @Test
    void testOpponentAndOwner() throws GameException {
        Player ash = new Player("Ash");
        ash.getHand().add(pikachu.getId());
        Player gary = new Player("Gary");
        gary.setDeck(List.of(lightning.getId()));
        game.addPlayer(ash);
        game.addPlayer(gary);

        assertEquals(gary, game.getOpponent(ash.getId()).orElseThrow());
        assertEquals(ash, game.getOpponent(gary.getId()).orElseThrow());
        assertEquals(ash, game.findOwner(pikachu.getId()).orElseThrow());
        assertEquals(gary, game.findOwner(lightning.getId()).orElseThrow());
        assertTrue(game.findOwner(UUID.randomUUID()).isEmpty());
        assertThrows(GameException.class, () -> game.getPlayer(UUID.randomUUID()));
    }

    @Test
    void testFindOwnerPrefersCopyInPlay() throws GameException {
        Player ash = new Player("Ash");
        ash.getHand().add(pikachu.getId());
        Player gary = new Player("Gary");
        gary.getHand().add(pikachu.getId());
        gary.setActivePokemon(pikachu.getId());
        game.addPlayer(ash);
        game.addPlayer(gary);

        assertEquals(gary, game.findOwner(pikachu.getId()).orElseThrow());
    }

    @Test
    void testRequireStatus() throws GameException {
        game.requireStatus(GameStatus.SETUP, "test");
        GameException e = assertThrows(GameException.class,
                () -> game.requireStatus(GameStatus.IN_PROGRESS, "attack"));
        assertTrue(e.getMessage().contains("attack"));
    }
}
