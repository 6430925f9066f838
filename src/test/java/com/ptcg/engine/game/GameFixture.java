package com.ptcg.engine.game;

import com.ptcg.engine.TestCards;
import com.ptcg.engine.card.Attack;
import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardDatabase;
import com.ptcg.engine.card.EnergyType;
import com.ptcg.engine.card.TrainerType;
import com.ptcg.engine.player.Player;
import com.ptcg.engine.player.SpecialCondition;
import com.ptcg.engine.rng.GameRng;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A started two-player game with known cards in known places.
 * <p>
 * Ash plays first with Pikachu active and Squirtle, three Lightning Energy, Professor Oak,
 * Potion and Stadium in hand. Gary has Charmander active and Bulbasaur and two Fire Energy
 * in hand. Both decks hold ten distinct basic energy cards, no prizes are placed, and Ash
 * has drawn one card for turn 1.
 */
public class GameFixture {
    public static final long SEED = 20240601L;

    public final Card pikachu;
    public final Card squirtle;
    public final Card charmander;
    public final Card bulbasaur;
    public final List<Card> ashLightning;
    public final List<Card> garyFire;
    public final Card oak;
    public final Card potion;
    public final Card stadium;
    public final List<Card> ashDeck;
    public final List<Card> garyDeck;

    public final CardDatabase db;
    public final Game game;
    public final Player ash;
    public final Player gary;

    public GameFixture() throws GameException {
        this(GameRules.defaults());
    }

    public GameFixture(GameRules rules) throws GameException {
        pikachu = TestCards.basic("Pikachu", 60, 1, EnergyType.FIGHTING, null,
                Attack.simple("Gnaw", List.of(EnergyType.COLORLESS), 10),
                Attack.withStatus("Thunder Jolt", List.of(EnergyType.LIGHTNING, EnergyType.COLORLESS), 30,
                        SpecialCondition.PARALYZED, 100));
        squirtle = TestCards.basic("Squirtle", 50, 1,
                Attack.simple("Bubble", List.of(EnergyType.WATER), 10));
        charmander = TestCards.basic("Charmander", 50, 1, EnergyType.WATER, EnergyType.LIGHTNING,
                Attack.simple("Scratch", List.of(EnergyType.COLORLESS), 10));
        bulbasaur = TestCards.basic("Bulbasaur", 40, 2, EnergyType.FIRE, null,
                Attack.simple("Vine Whip", List.of(EnergyType.GRASS), 20));
        ashLightning = TestCards.energies(EnergyType.LIGHTNING, 3);
        garyFire = TestCards.energies(EnergyType.FIRE, 2);
        oak = TestCards.trainer("Professor Oak", TrainerType.SUPPORTER);
        potion = TestCards.trainer("Potion", TrainerType.ITEM);
        stadium = TestCards.trainer("Power Plant", TrainerType.STADIUM);
        ashDeck = TestCards.energies(EnergyType.WATER, 10);
        garyDeck = TestCards.energies(EnergyType.GRASS, 10);

        List<Card> all = new ArrayList<>(List.of(pikachu, squirtle, charmander, bulbasaur, oak, potion, stadium));
        all.addAll(ashLightning);
        all.addAll(garyFire);
        all.addAll(ashDeck);
        all.addAll(garyDeck);
        db = CardDatabase.of(all);

        game = new Game(rules, db, new GameRng(SEED));

        ash = new Player("Ash");
        ash.getHand().add(pikachu.getId());
        ash.setActivePokemon(pikachu.getId());
        ash.getHand().add(squirtle.getId());
        ashLightning.forEach(c -> ash.getHand().add(c.getId()));
        ash.getHand().add(oak.getId());
        ash.getHand().add(potion.getId());
        ash.getHand().add(stadium.getId());
        ash.setDeck(ids(ashDeck));

        gary = new Player("Gary");
        gary.getHand().add(charmander.getId());
        gary.setActivePokemon(charmander.getId());
        gary.getHand().add(bulbasaur.getId());
        garyFire.forEach(c -> gary.getHand().add(c.getId()));
        gary.setDeck(ids(garyDeck));

        game.addPlayer(ash);
        game.addPlayer(gary);
        TurnManager.start(game);
    }

    public UUID lightning(int index) {
        return ashLightning.get(index).getId();
    }

    public static List<UUID> ids(List<Card> cards) {
        List<UUID> ids = new ArrayList<>(cards.size());
        for (Card card : cards) {
            ids.add(card.getId());
        }
        return ids;
    }
}
