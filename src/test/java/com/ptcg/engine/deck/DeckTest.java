package com.ptcg.engine.deck;

import com.ptcg.engine.TestCards;
import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardDatabase;
import com.ptcg.engine.card.EnergyType;
import com.ptcg.engine.card.TrainerType;
import com.ptcg.engine.rng.GameRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Deck.
 */
class DeckTest {

    private Card pikachu;
    private Card raichu;
    private Card lightning;
    private Card potion;
    private CardDatabase db;

    @BeforeEach
    void setUp() {
        pikachu = TestCards.basic("Pikachu", 60, 1);
        raichu = TestCards.stage1("Raichu", 80, "Pikachu");
        lightning = TestCards.energy(EnergyType.LIGHTNING);
        potion = TestCards.trainer("Potion", TrainerType.ITEM);
        db = CardDatabase.of(pikachu, raichu, lightning, potion);
    }

    private Deck standardDeck(int energyCount) {
        Deck deck = new Deck("Sparks", "Standard");
        deck.addCard(pikachu.getId(), 4);
        deck.addCard(lightning.getId(), energyCount);
        return deck;
    }

    @Test
    void testLegalStandardDeck() {
        Deck deck = standardDeck(56);
        assertEquals(60, deck.totalCards());
        assertTrue(deck.findValidationErrors(db).isEmpty());
        assertDoesNotThrow(() -> deck.validate(db));
    }

    @Test
    void testTooFewCards() {
        Deck deck = standardDeck(50);
        DeckValidationException e = assertThrows(DeckValidationException.class, () -> deck.validate(db));
        assertEquals(List.of(new DeckValidationError.TooFewCards(60, 54)), e.getErrors());
    }

    @Test
    void testTooManyCards() {
        Deck deck = standardDeck(57);
        assertEquals(List.of(new DeckValidationError.TooManyCards(60, 61)), deck.findValidationErrors(db));
    }

    @Test
    void testTooManyCopies() {
        Deck deck = standardDeck(51);
        deck.addCard(potion.getId(), 5);

        List<DeckValidationError> errors = deck.findValidationErrors(db);
        assertEquals(1, errors.size());
        DeckValidationError.TooManyCopies copies = assertInstanceOf(DeckValidationError.TooManyCopies.class, errors.get(0));
        assertEquals(potion.getId(), copies.cardId());
        assertEquals(5, copies.actual());
        assertEquals(DeckFormat.MAX_COPIES, copies.maximum());
    }

    @Test
    void testBasicEnergyHasNoCopyLimit() {
        Deck deck = standardDeck(56);
        assertTrue(deck.getCardQuantity(lightning.getId()) > DeckFormat.MAX_COPIES);
        assertTrue(deck.findValidationErrors(db).isEmpty());
    }

    @Test
    void testNoBasicPokemon() {
        Deck deck = new Deck("No Basics", "Standard");
        deck.addCard(raichu.getId(), 4);
        deck.addCard(lightning.getId(), 56);
        assertEquals(List.of(new DeckValidationError.NoBasicPokemon()), deck.findValidationErrors(db));
    }

    @Test
    void testEveryErrorIsReported() {
        Deck deck = new Deck("Broken", "Standard");
        deck.addCard(potion.getId(), 6);

        List<DeckValidationError> errors = deck.findValidationErrors(db);
        assertEquals(3, errors.size());
        assertInstanceOf(DeckValidationError.TooFewCards.class, errors.get(0));
        assertInstanceOf(DeckValidationError.TooManyCopies.class, errors.get(1));
        assertInstanceOf(DeckValidationError.NoBasicPokemon.class, errors.get(2));
    }

    @Test
    void testLimitedAndCustomFormats() {
        Deck limited = new Deck("Draft", "Limited");
        limited.addCard(pikachu.getId(), 4);
        limited.addCard(lightning.getId(), 40);
        assertTrue(limited.findValidationErrors(db).isEmpty());

        Deck custom = new Deck("Casual", "kitchen-table");
        custom.addCard(pikachu.getId(), 1);
        assertTrue(custom.findValidationErrors(db).isEmpty());
    }

    @Test
    void testAddAndRemoveCards() {
        Deck deck = new Deck("Edits", "Standard");
        deck.addCard(pikachu.getId(), 3);
        deck.removeCard(pikachu.getId(), 1);
        assertEquals(2, deck.getCardQuantity(pikachu.getId()));

        deck.removeCard(pikachu.getId(), 5);
        assertFalse(deck.containsCard(pikachu.getId()));
        assertEquals(0, deck.uniqueCards());

        deck.setCardQuantity(potion.getId(), 2);
        assertEquals(2, deck.totalCards());
        deck.setCardQuantity(potion.getId(), 0);
        assertEquals(0, deck.totalCards());
    }

    @Test
    void testStatistics() {
        Deck deck = standardDeck(50);
        deck.addCard(raichu.getId(), 2);
        deck.addCard(potion.getId(), 4);

        DeckStatistics stats = deck.getStatistics(db);
        assertEquals(60, stats.totalCards());
        assertEquals(4, stats.uniqueCards());
        assertEquals(6, stats.pokemonCount());
        assertEquals(4, stats.basicPokemonCount());
        assertEquals(50, stats.energyCount());
        assertEquals(4, stats.trainerCount());
        assertEquals(50, stats.energyDistribution().get(EnergyType.LIGHTNING));
        assertEquals(stats, deck.getStatistics(db));
    }

    @Test
    void testShuffleKeepsDeckList() {
        Deck deck = standardDeck(56);
        List<UUID> shuffled = deck.shuffle(new GameRng(42));
        List<UUID> sortedShuffle = new ArrayList<>(shuffled);
        List<UUID> sortedList = new ArrayList<>(deck.toCardList());
        sortedShuffle.sort(null);
        sortedList.sort(null);

        assertEquals(60, shuffled.size());
        assertEquals(sortedList, sortedShuffle);
        assertEquals(shuffled, deck.shuffle(new GameRng(42)));
    }

    @Test
    void testFromCardList() {
        Deck deck = Deck.fromCardList("Listed", "Standard",
                List.of(pikachu.getId(), pikachu.getId(), lightning.getId()));
        assertEquals(2, deck.getCardQuantity(pikachu.getId()));
        assertEquals(1, deck.getCardQuantity(lightning.getId()));
    }
}
