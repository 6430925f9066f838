package com.ptcg.engine;

import com.ptcg.engine.card.Attack;
import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardKind;
import com.ptcg.engine.card.CardRarity;
import com.ptcg.engine.card.EnergyType;
import com.ptcg.engine.card.EvolutionStage;
import com.ptcg.engine.card.TrainerType;

import java.util.ArrayList;
import java.util.List;

/**
 * Card builders shared by the tests. Every call makes a card with a fresh id.
 */
public final class TestCards {

    private TestCards() {
        // Utility class - prevent instantiation
    }

    public static Card basic(String name, int hp, int retreatCost, Attack... attacks) {
        Card card = Card.pokemon(name, "Test Set", "1", CardRarity.COMMON,
                CardKind.Pokemon.basic(name, hp, retreatCost));
        for (Attack attack : attacks) {
            card.addAttack(attack);
        }
        return card;
    }

    public static Card basic(String name, int hp, int retreatCost, EnergyType weakness, EnergyType resistance,
                             Attack... attacks) {
        Card card = Card.pokemon(name, "Test Set", "1", CardRarity.COMMON,
                new CardKind.Pokemon(name, hp, retreatCost, weakness, resistance, EvolutionStage.BASIC, null));
        for (Attack attack : attacks) {
            card.addAttack(attack);
        }
        return card;
    }

    public static Card stage1(String name, int hp, String evolvesFrom) {
        return Card.pokemon(name, "Test Set", "2", CardRarity.UNCOMMON,
                new CardKind.Pokemon(name, hp, 1, null, null, EvolutionStage.STAGE1, evolvesFrom));
    }

    public static Card energy(EnergyType type) {
        return Card.energy(type.getJsonValue() + " Energy", "Test Set", "99", type, true);
    }

    public static List<Card> energies(EnergyType type, int count) {
        List<Card> cards = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            cards.add(energy(type));
        }
        return cards;
    }

    public static Card trainer(String name, TrainerType type) {
        return Card.trainer(name, "Test Set", "80", CardRarity.UNCOMMON, type);
    }
}
