package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A single printed card. Players and decks refer to cards by id only;
 * the {@link CardDatabase} owns the Card values.
 */
public class Card {
    @JsonProperty("id")
    private UUID id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("set_name")
    private String setName;

    @JsonProperty("set_number")
    private String setNumber;

    @JsonProperty("rarity")
    private CardRarity rarity = CardRarity.COMMON;

    @JsonProperty("kind")
    private CardKind kind;

    @JsonProperty("attacks")
    private List<Attack> attacks = new ArrayList<>();

    @JsonProperty("abilities")
    private List<Ability> abilities = new ArrayList<>();

    @JsonProperty("rules")
    private List<String> rules = new ArrayList<>();

    @JsonProperty("metadata")
    private Map<String, String> metadata = new LinkedHashMap<>();

    public Card() {
        // Default constructor for Jackson
    }

    public Card(UUID id, String name, String setName, String setNumber, CardRarity rarity, CardKind kind) {
        this.id = id;
        this.name = name;
        this.setName = setName;
        this.setNumber = setNumber;
        this.rarity = rarity;
        this.kind = kind;
    }

    /**
     * Create a Pokemon card with a fresh id.
     */
    public static Card pokemon(String name, String setName, String setNumber, CardRarity rarity,
                               CardKind.Pokemon data) {
        return new Card(UUID.randomUUID(), name, setName, setNumber, rarity, data);
    }

    /**
     * Create an Energy card with a fresh id.
     */
    public static Card energy(String name, String setName, String setNumber, EnergyType energyType, boolean basic) {
        return new Card(UUID.randomUUID(), name, setName, setNumber, CardRarity.COMMON,
                new CardKind.Energy(energyType, basic));
    }

    /**
     * Create a Trainer card with a fresh id.
     */
    public static Card trainer(String name, String setName, String setNumber, CardRarity rarity,
                               TrainerType trainerType) {
        return new Card(UUID.randomUUID(), name, setName, setNumber, rarity, new CardKind.Trainer(trainerType));
    }

    @JsonIgnore
    public CardType getCardType() {
        return kind.cardType();
    }

    @JsonIgnore
    public boolean isPokemon() {
        return kind instanceof CardKind.Pokemon;
    }

    @JsonIgnore
    public boolean isEnergy() {
        return kind instanceof CardKind.Energy;
    }

    @JsonIgnore
    public boolean isTrainer() {
        return kind instanceof CardKind.Trainer;
    }

    /**
     * True for Pokemon whose stage is Basic.
     */
    @JsonIgnore
    public boolean isBasicPokemon() {
        return kind instanceof CardKind.Pokemon pokemon && pokemon.stage() != null && pokemon.stage().isBasic();
    }

    /**
     * True for basic Energy cards. Basic energy is exempt from the copy limit.
     */
    @JsonIgnore
    public boolean isBasicEnergy() {
        return kind instanceof CardKind.Energy energy && energy.basic();
    }

    @JsonIgnore
    public Optional<CardKind.Pokemon> getPokemonData() {
        return kind instanceof CardKind.Pokemon pokemon ? Optional.of(pokemon) : Optional.empty();
    }

    @JsonIgnore
    public Optional<CardKind.Energy> getEnergyData() {
        return kind instanceof CardKind.Energy energy ? Optional.of(energy) : Optional.empty();
    }

    @JsonIgnore
    public Optional<CardKind.Trainer> getTrainerData() {
        return kind instanceof CardKind.Trainer trainer ? Optional.of(trainer) : Optional.empty();
    }

    /**
     * Hit points, or 0 for non-Pokemon cards.
     */
    @JsonIgnore
    public int getHp() {
        return getPokemonData().map(CardKind.Pokemon::hp).orElse(0);
    }

    /**
     * Add an attack. Ignored unless this card is a Pokemon.
     */
    public void addAttack(Attack attack) {
        if (isPokemon()) {
            attacks.add(attack);
        }
    }

    /**
     * Add an ability. Ignored unless this card is a Pokemon.
     */
    public void addAbility(Ability ability) {
        if (isPokemon()) {
            abilities.add(ability);
        }
    }

    public void addRule(String rule) {
        rules.add(rule);
    }

    public void putMetadata(String key, String value) {
        metadata.put(key, value);
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSetName() {
        return setName;
    }

    public String getSetNumber() {
        return setNumber;
    }

    public CardRarity getRarity() {
        return rarity;
    }

    public CardKind getKind() {
        return kind;
    }

    public List<Attack> getAttacks() {
        return attacks;
    }

    public List<Ability> getAbilities() {
        return abilities;
    }

    public List<String> getRules() {
        return rules;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    // Setters for Jackson
    public void setId(UUID id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setSetName(String setName) { this.setName = setName; }
    public void setSetNumber(String setNumber) { this.setNumber = setNumber; }
    public void setRarity(CardRarity rarity) { this.rarity = rarity; }
    public void setKind(CardKind kind) { this.kind = kind; }
    public void setAttacks(List<Attack> attacks) { this.attacks = attacks; }
    public void setAbilities(List<Ability> abilities) { this.abilities = abilities; }
    public void setRules(List<String> rules) { this.rules = rules; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }

    @Override
    public String toString() {
        return name + " (" + setName + " " + setNumber + ")";
    }
}
