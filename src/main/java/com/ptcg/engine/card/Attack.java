package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ptcg.engine.player.SpecialCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * An attack printed on a Pokemon card.
 */
public class Attack {
    @JsonProperty("name")
    private String name;

    @JsonProperty("cost")
    private List<EnergyType> cost = new ArrayList<>();

    @JsonProperty("damage")
    private int damage;

    @JsonProperty("effect")
    private String effect;

    @JsonProperty("damage_mode")
    private DamageMode damageMode;

    @JsonProperty("status_effects")
    private List<StatusEffect> statusEffects = new ArrayList<>();

    @JsonProperty("conditions")
    private List<String> conditions = new ArrayList<>();

    @JsonProperty("target_type")
    private AttackTargetType targetType = AttackTargetType.ACTIVE;

    public Attack() {
        // Default constructor for Jackson
    }

    public Attack(String name, List<EnergyType> cost, int damage) {
        this.name = name;
        this.cost = new ArrayList<>(cost);
        this.damage = damage;
    }

    /**
     * Fixed-damage attack against the defending active Pokemon.
     */
    public static Attack simple(String name, List<EnergyType> cost, int damage) {
        return new Attack(name, cost, damage);
    }

    /**
     * Attack that may inflict a special condition on the defending Pokemon.
     */
    public static Attack withStatus(String name, List<EnergyType> cost, int damage,
                                    SpecialCondition status, int probability) {
        Attack attack = new Attack(name, cost, damage);
        attack.addStatusEffect(StatusEffect.onDefending(status, probability));
        return attack;
    }

    /**
     * Attack that adds damage for each heads.
     */
    public static Attack coinFlipDamage(String name, List<EnergyType> cost, int baseDamage,
                                        int damagePerHeads, int flips) {
        Attack attack = new Attack(name, cost, baseDamage);
        attack.setDamageMode(new DamageMode.CoinFlip(damagePerHeads, flips));
        return attack;
    }

    /**
     * Compute the damage this attack deals before weakness and resistance.
     *
     * @param energyCount  energy attached to the attacker (of the matching type for PerEnergy)
     * @param coinResults  coin flip outcomes, true = heads
     * @param pokemonCount Pokemon counted by a PerPokemon mode
     */
    public int calculateDamage(int energyCount, List<Boolean> coinResults, int pokemonCount) {
        int total = damage;
        if (damageMode instanceof DamageMode.PerEnergy perEnergy) {
            total += perEnergy.perEnergy() * energyCount;
        } else if (damageMode instanceof DamageMode.CoinFlip coinFlip) {
            int heads = 0;
            for (Boolean result : coinResults) {
                if (Boolean.TRUE.equals(result)) {
                    heads++;
                }
            }
            total += coinFlip.perHeads() * heads;
        } else if (damageMode instanceof DamageMode.PerPokemon perPokemon) {
            total += perPokemon.perPokemon() * pokemonCount;
        } else if (damageMode instanceof DamageMode.Variable variable) {
            total = variable.min();
        }
        return total;
    }

    /**
     * Number of coins this attack flips when used.
     */
    @JsonIgnore
    public int getCoinFlipCount() {
        return damageMode instanceof DamageMode.CoinFlip coinFlip ? coinFlip.flips() : 0;
    }

    /**
     * Total energy needed to use this attack.
     */
    @JsonIgnore
    public int getTotalEnergyCost() {
        return cost.size();
    }

    /**
     * Whether attached energy pays this attack's cost. Typed costs need energy of that
     * type; Colorless costs take any energy left over.
     */
    public boolean canBePaidWith(List<EnergyType> attached) {
        List<EnergyType> remaining = new ArrayList<>(attached);
        int colorless = 0;
        for (EnergyType required : cost) {
            if (required == EnergyType.COLORLESS) {
                colorless++;
            } else if (!remaining.remove(required)) {
                return false;
            }
        }
        return remaining.size() >= colorless;
    }

    public String getName() {
        return name;
    }

    public List<EnergyType> getCost() {
        return cost;
    }

    public int getDamage() {
        return damage;
    }

    public String getEffect() {
        return effect;
    }

    public DamageMode getDamageMode() {
        return damageMode;
    }

    public List<StatusEffect> getStatusEffects() {
        return statusEffects;
    }

    public List<String> getConditions() {
        return conditions;
    }

    public AttackTargetType getTargetType() {
        return targetType;
    }

    public void addStatusEffect(StatusEffect statusEffect) {
        statusEffects.add(statusEffect);
    }

    public void addCondition(String condition) {
        conditions.add(condition);
    }

    // Setters for Jackson
    public void setName(String name) { this.name = name; }
    public void setCost(List<EnergyType> cost) { this.cost = cost; }
    public void setDamage(int damage) { this.damage = damage; }
    public void setEffect(String effect) { this.effect = effect; }
    public void setDamageMode(DamageMode damageMode) { this.damageMode = damageMode; }
    public void setStatusEffects(List<StatusEffect> statusEffects) { this.statusEffects = statusEffects; }
    public void setConditions(List<String> conditions) { this.conditions = conditions; }
    public void setTargetType(AttackTargetType targetType) {
        this.targetType = targetType == null ? AttackTargetType.ACTIVE : targetType;
    }
}
