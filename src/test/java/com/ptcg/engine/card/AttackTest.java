package com.ptcg.engine.card;

import com.ptcg.engine.player.SpecialCondition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Attack.
 */
class AttackTest {

    @Test
    void testSimpleDamage() {
        Attack attack = Attack.simple("Tackle", List.of(EnergyType.COLORLESS), 20);
        assertEquals(20, attack.calculateDamage(3, List.of(), 0));
        assertEquals(0, attack.getCoinFlipCount());
        assertEquals(1, attack.getTotalEnergyCost());
    }

    @Test
    void testCoinFlipDamage() {
        Attack attack = Attack.coinFlipDamage("Double Slap", List.of(EnergyType.COLORLESS), 10, 20, 3);
        assertEquals(3, attack.getCoinFlipCount());
        assertEquals(10, attack.calculateDamage(0, List.of(false, false, false), 0));
        assertEquals(50, attack.calculateDamage(0, List.of(true, false, true), 0));
    }

    @Test
    void testPerEnergyDamage() {
        Attack attack = Attack.simple("Hydro Pump", List.of(EnergyType.WATER), 10);
        attack.setDamageMode(new DamageMode.PerEnergy(10, EnergyType.WATER));
        assertEquals(40, attack.calculateDamage(3, List.of(), 0));
    }

    @Test
    void testPerPokemonAndVariableDamage() {
        Attack perPokemon = Attack.simple("Gang Up", List.of(EnergyType.COLORLESS), 0);
        perPokemon.setDamageMode(new DamageMode.PerPokemon(10, "bench"));
        assertEquals(40, perPokemon.calculateDamage(0, List.of(), 4));

        Attack variable = Attack.simple("Wild Swing", List.of(EnergyType.COLORLESS), 0);
        variable.setDamageMode(new DamageMode.Variable(30, 90));
        assertEquals(30, variable.calculateDamage(0, List.of(), 0));
    }

    @Test
    void testTypedCostNeedsMatchingEnergy() {
        Attack attack = Attack.simple("Thunderbolt", List.of(EnergyType.LIGHTNING, EnergyType.COLORLESS), 50);
        assertTrue(attack.canBePaidWith(List.of(EnergyType.LIGHTNING, EnergyType.FIRE)));
        assertTrue(attack.canBePaidWith(List.of(EnergyType.LIGHTNING, EnergyType.LIGHTNING)));
        assertFalse(attack.canBePaidWith(List.of(EnergyType.FIRE, EnergyType.FIRE)));
        assertFalse(attack.canBePaidWith(List.of(EnergyType.LIGHTNING)));
    }

    @Test
    void testFreeAttack() {
        Attack attack = Attack.simple("Splash", List.of(), 0);
        assertTrue(attack.canBePaidWith(List.of()));
    }

    @Test
    void testWithStatus() {
        Attack attack = Attack.withStatus("Poison Sting", List.of(EnergyType.GRASS), 10, SpecialCondition.POISONED, 100);
        assertEquals(1, attack.getStatusEffects().size());
        StatusEffect effect = attack.getStatusEffects().get(0);
        assertEquals(SpecialCondition.POISONED, effect.condition());
        assertEquals(StatusEffect.DEFENDING, effect.target());
    }
}
