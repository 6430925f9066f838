package com.ptcg.engine.player;

import com.ptcg.engine.TestCards;
import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardDatabase;
import com.ptcg.engine.card.EnergyType;
import com.ptcg.engine.game.zones.Bench;
import com.ptcg.engine.rng.GameRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Player.
 */
class PlayerTest {

    private Player player;
    private Card pikachu;
    private Card squirtle;
    private Card raichu;
    private Card lightning;
    private CardDatabase db;

    @BeforeEach
    void setUp() {
        player = new Player("Ash");
        pikachu = TestCards.basic("Pikachu", 60, 1);
        squirtle = TestCards.basic("Squirtle", 50, 1);
        raichu = TestCards.stage1("Raichu", 80, "Pikachu");
        lightning = TestCards.energy(EnergyType.LIGHTNING);
        db = CardDatabase.of(pikachu, squirtle, raichu, lightning);
    }

    @Test
    void testDrawFromTop() {
        player.setDeck(List.of(pikachu.getId(), squirtle.getId(), lightning.getId()));

        assertEquals(pikachu.getId(), player.drawCard().orElseThrow());
        assertEquals(List.of(squirtle.getId(), lightning.getId()), player.drawCards(5));
        assertTrue(player.drawCard().isEmpty());
        assertEquals(3, player.getHand().size());
    }

    @Test
    void testReturnHandToDeckKeepsCards() {
        player.setDeck(List.of(pikachu.getId(), squirtle.getId(), lightning.getId()));
        player.drawCards(2);

        player.returnHandToDeck();
        player.shuffleDeck(new GameRng(3));

        assertTrue(player.getHand().isEmpty());
        assertEquals(3, player.getDeck().size());
        assertEquals(Map.of(pikachu.getId(), 1, squirtle.getId(), 1, lightning.getId(), 1), player.cardCounts());
    }

    @Test
    void testFindBasicPokemonInHand() {
        player.getHand().add(raichu.getId());
        player.getHand().add(lightning.getId());
        assertTrue(player.findBasicPokemonInHand(db).isEmpty());

        player.setDeck(List.of(squirtle.getId()));
        assertTrue(player.hasBasicPokemonInHandOrDeck(db));

        player.getHand().add(pikachu.getId());
        assertEquals(List.of(pikachu.getId()), player.findBasicPokemonInHand(db));
    }

    @Test
    void testPrizeCards() {
        assertEquals(Player.DEFAULT_PRIZE_CARDS, player.getPrizeCards());
        player.setDeck(List.of(pikachu.getId(), squirtle.getId(), lightning.getId(), raichu.getId()));

        assertEquals(4, player.placePrizeCards(6));
        assertEquals(4, player.getPrizeCards());
        assertTrue(player.getDeck().isEmpty());

        assertTrue(player.takePrizeCard());
        assertEquals(3, player.getPrizeCards());
        assertTrue(player.getHand().contains(pikachu.getId()));
    }

    @Test
    void testSetActiveMovesPreviousToBench() {
        player.getHand().add(pikachu.getId());
        player.getHand().add(squirtle.getId());

        assertTrue(player.setActivePokemon(pikachu.getId()));
        assertTrue(player.setActivePokemon(squirtle.getId()));

        assertEquals(squirtle.getId(), player.getActivePokemon().orElseThrow());
        assertEquals(List.of(pikachu.getId()), player.getBench().getPokemon());
        assertEquals(new CardLocation.OnBench(0), player.findCardLocation(pikachu.getId()).orElseThrow());
    }

    @Test
    void testBenchLimit() {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < Bench.MAX_SIZE + 1; i++) {
            UUID id = UUID.randomUUID();
            ids.add(id);
            player.getHand().add(id);
        }
        for (int i = 0; i < Bench.MAX_SIZE; i++) {
            assertTrue(player.benchPokemon(ids.get(i)));
        }
        assertFalse(player.benchPokemon(ids.get(Bench.MAX_SIZE)));
        assertTrue(player.getBench().isFull());
        assertTrue(player.getHand().contains(ids.get(Bench.MAX_SIZE)));
    }

    @Test
    void testAttachAndDiscardEnergy() {
        player.getHand().add(pikachu.getId());
        player.setActivePokemon(pikachu.getId());
        player.getHand().add(lightning.getId());

        assertTrue(player.attachEnergy(lightning.getId(), pikachu.getId()));
        assertEquals(List.of(EnergyType.LIGHTNING), player.getAttachedEnergyTypes(pikachu.getId(), db));
        assertEquals(new CardLocation.AttachedEnergy(pikachu.getId()),
                player.findCardLocation(lightning.getId()).orElseThrow());

        assertEquals(List.of(lightning.getId()), player.discardEnergy(pikachu.getId(), 2));
        assertEquals(0, player.getAttachedEnergyCount(pikachu.getId()));
        assertTrue(player.getDiscardPile().contains(lightning.getId()));
    }

    @Test
    void testAttachEnergyRequiresPokemonInPlay() {
        player.getHand().add(lightning.getId());
        assertFalse(player.attachEnergy(lightning.getId(), pikachu.getId()));
        assertTrue(player.getHand().contains(lightning.getId()));
    }

    @Test
    void testDamageAndKnockOut() {
        player.getHand().add(pikachu.getId());
        player.setActivePokemon(pikachu.getId());
        player.getHand().add(lightning.getId());
        player.attachEnergy(lightning.getId(), pikachu.getId());

        player.addDamage(pikachu.getId(), 40);
        player.healDamage(pikachu.getId(), 10);
        assertEquals(30, player.getDamage(pikachu.getId()));
        assertFalse(player.isKnockedOut(pikachu.getId(), pikachu));

        player.addDamage(pikachu.getId(), 30);
        assertTrue(player.isKnockedOut(pikachu.getId(), pikachu));

        assertTrue(player.knockOut(pikachu.getId()));
        assertTrue(player.getActivePokemon().isEmpty());
        assertEquals(0, player.getDamage(pikachu.getId()));
        assertTrue(player.getDiscardPile().contains(pikachu.getId()));
        assertTrue(player.getDiscardPile().contains(lightning.getId()));
        assertTrue(player.hasLost());
    }

    @Test
    void testPromoteFromBench() {
        player.getHand().add(pikachu.getId());
        player.getHand().add(squirtle.getId());
        player.setActivePokemon(pikachu.getId());
        player.benchPokemon(squirtle.getId());

        assertTrue(player.promoteFromBench().isEmpty());
        player.knockOut(pikachu.getId());
        assertEquals(squirtle.getId(), player.promoteFromBench().orElseThrow());
        assertTrue(player.getBench().isEmpty());
    }

    @Test
    void testConditionsBlockActions() {
        UUID id = pikachu.getId();
        player.addSpecialCondition(id, SpecialCondition.PARALYZED, 1, 1);
        assertFalse(player.canPokemonAttack(id));
        assertTrue(player.canPokemonRetreat(id));

        player.removeSpecialConditionType(id, SpecialCondition.PARALYZED);
        player.addSpecialCondition(id, SpecialCondition.TRAPPED, SpecialConditionInstance.PERMANENT, 1);
        assertTrue(player.canPokemonAttack(id));
        assertFalse(player.canPokemonRetreat(id));
    }

    @Test
    void testUpdateSpecialConditions() {
        UUID id = pikachu.getId();
        player.addSpecialCondition(id, new SpecialCondition.Poisoned(20), SpecialConditionInstance.PERMANENT, 1);
        player.addSpecialCondition(id, SpecialCondition.ASLEEP, 1, 1);

        List<ConditionEffect> effects = player.updateSpecialConditions(2);

        assertEquals(List.of(
                new ConditionEffect.Damage(id, 20, "Poison"),
                new ConditionEffect.CoinFlip(id, SpecialCondition.ASLEEP, "Remove sleep condition"),
                new ConditionEffect.ConditionRemoved(id, SpecialCondition.ASLEEP)), effects);
        assertTrue(player.hasSpecialConditionType(id, SpecialCondition.POISONED));
        assertFalse(player.hasSpecialConditionType(id, SpecialCondition.ASLEEP));
    }

    @Test
    void testSwitchActiveClearsConditions() {
        player.getHand().add(pikachu.getId());
        player.getHand().add(squirtle.getId());
        player.setActivePokemon(pikachu.getId());
        player.benchPokemon(squirtle.getId());
        player.addSpecialCondition(pikachu.getId(), SpecialCondition.CONFUSED, SpecialConditionInstance.PERMANENT, 1);

        assertTrue(player.switchActive(squirtle.getId()));
        assertEquals(squirtle.getId(), player.getActivePokemon().orElseThrow());
        assertTrue(player.getSpecialConditions(pikachu.getId()).isEmpty());
    }

    @Test
    void testStartTurnResetsFlags() {
        player.setHasAttacked(true);
        player.setEnergyAttachedThisTurn(true);
        player.setSupporterPlayedThisTurn(true);
        player.setRetreatedThisTurn(true);

        player.startTurn();

        assertFalse(player.hasAttacked());
        assertFalse(player.isEnergyAttachedThisTurn());
        assertFalse(player.isSupporterPlayedThisTurn());
        assertFalse(player.isRetreatedThisTurn());
    }

    @Test
    void testStadiumReplacement() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        assertTrue(player.setStadium(first).isEmpty());
        assertEquals(first, player.setStadium(second).orElseThrow());
        assertEquals(new CardLocation.Stadium(), player.findCardLocation(second).orElseThrow());
    }
}
