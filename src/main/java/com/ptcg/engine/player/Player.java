package com.ptcg.engine.player;

import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardDatabase;
import com.ptcg.engine.card.CardKind;
import com.ptcg.engine.card.EnergyType;
import com.ptcg.engine.game.zones.Bench;
import com.ptcg.engine.game.zones.DiscardPile;
import com.ptcg.engine.game.zones.DrawPile;
import com.ptcg.engine.game.zones.Hand;
import com.ptcg.engine.rng.GameRng;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One side of a match: the player's zones, the Pokemon they have in play
 * and everything attached to those Pokemon.
 * <p>
 * Cards are held by id. Mutators return false (or an empty result) instead of
 * throwing when the move is not possible, and leave the player unchanged.
 */
public class Player {
    public static final int DEFAULT_PRIZE_CARDS = 6;

    private final UUID id;
    private final String name;

    // Zones
    private final Hand hand;
    private final DrawPile deck;
    private final DiscardPile discardPile;
    private final Bench bench;
    private final List<UUID> prizes;
    private UUID activePokemon;
    private UUID stadium;

    private int prizeCards;

    // State of Pokemon in play, keyed by Pokemon card id
    private final Map<UUID, List<UUID>> attachedEnergy;
    private final Map<UUID, Integer> damageCounters;
    private final Map<UUID, List<SpecialConditionInstance>> specialConditions;

    // Per-turn flags
    private boolean hasAttacked;
    private boolean energyAttachedThisTurn;
    private boolean supporterPlayedThisTurn;
    private boolean retreatedThisTurn;

    public Player(String name) {
        this(UUID.randomUUID(), name);
    }

    public Player(UUID id, String name) {
        this.id = id;
        this.name = name;
        this.hand = new Hand();
        this.deck = new DrawPile();
        this.discardPile = new DiscardPile();
        this.bench = new Bench();
        this.prizes = new ArrayList<>();
        this.prizeCards = DEFAULT_PRIZE_CARDS;
        this.attachedEnergy = new LinkedHashMap<>();
        this.damageCounters = new LinkedHashMap<>();
        this.specialConditions = new LinkedHashMap<>();
    }

    // ---- Deck and hand ----

    /**
     * Replace the draw pile with the given cards, first element on top.
     */
    public void setDeck(Collection<UUID> cardIds) {
        deck.clear();
        deck.addAll(cardIds);
    }

    /**
     * Draw the top card of the deck into the hand.
     * @return the drawn card, or empty if the deck is empty
     */
    public Optional<UUID> drawCard() {
        Optional<UUID> drawn = deck.draw();
        drawn.ifPresent(hand::add);
        return drawn;
    }

    /**
     * Draw up to count cards.
     * @return the cards actually drawn
     */
    public List<UUID> drawCards(int count) {
        List<UUID> drawn = deck.drawN(count);
        hand.addAll(drawn);
        return drawn;
    }

    public void shuffleDeck(GameRng rng) {
        deck.shuffle(rng);
    }

    /**
     * Put the whole hand back into the deck.
     * @return the returned cards
     */
    public List<UUID> returnHandToDeck() {
        List<UUID> returned = hand.removeAll();
        deck.addAll(returned);
        return returned;
    }

    public boolean discardFromHand(UUID cardId) {
        if (!hand.remove(cardId)) {
            return false;
        }
        discardPile.add(cardId);
        return true;
    }

    /**
     * Find every Basic Pokemon in the hand. Ids unknown to the database are skipped.
     */
    public List<UUID> findBasicPokemonInHand(CardDatabase cardDatabase) {
        List<UUID> basics = new ArrayList<>();
        for (UUID cardId : hand.getCards()) {
            cardDatabase.findCard(cardId)
                    .filter(Card::isBasicPokemon)
                    .ifPresent(c -> basics.add(cardId));
        }
        return basics;
    }

    /**
     * Whether a Basic Pokemon exists in the hand or the deck.
     */
    public boolean hasBasicPokemonInHandOrDeck(CardDatabase cardDatabase) {
        if (!findBasicPokemonInHand(cardDatabase).isEmpty()) {
            return true;
        }
        for (UUID cardId : deck.getCards()) {
            if (cardDatabase.findCard(cardId).map(Card::isBasicPokemon).orElse(false)) {
                return true;
            }
        }
        return false;
    }

    // ---- Prizes ----

    /**
     * Set aside up to count cards from the top of the deck as prizes.
     * @return the number of prizes actually placed
     */
    public int placePrizeCards(int count) {
        List<UUID> taken = deck.drawN(count);
        prizes.addAll(taken);
        prizeCards = prizes.size();
        return taken.size();
    }

    /**
     * Take one prize. The first face-down prize card, if any, goes to the hand.
     * @return false if no prizes remain
     */
    public boolean takePrizeCard() {
        if (prizeCards <= 0) {
            return false;
        }
        prizeCards--;
        if (!prizes.isEmpty()) {
            hand.add(prizes.remove(0));
        }
        return true;
    }

    // ---- Field ----

    /**
     * Make a card from the hand or bench the active Pokemon. A previous active
     * Pokemon moves to the bench.
     * @return false if the card is in neither zone or the bench has no room for the old active
     */
    public boolean setActivePokemon(UUID cardId) {
        boolean fromHand = hand.contains(cardId);
        boolean fromBench = bench.contains(cardId);
        if (!fromHand && !fromBench) {
            return false;
        }
        if (activePokemon != null && fromHand && bench.isFull()) {
            return false;
        }
        if (fromHand) {
            hand.remove(cardId);
        } else {
            bench.remove(cardId);
        }
        if (activePokemon != null) {
            bench.add(activePokemon);
        }
        activePokemon = cardId;
        return true;
    }

    /**
     * Move a Pokemon from the hand to the bench.
     * @return false if the card is not in hand or the bench is full
     */
    public boolean benchPokemon(UUID cardId) {
        if (bench.isFull() || !hand.contains(cardId)) {
            return false;
        }
        hand.remove(cardId);
        bench.add(cardId);
        return true;
    }

    /**
     * Swap the active Pokemon with a benched one. Special conditions on the
     * Pokemon leaving the active spot are removed.
     */
    public boolean switchActive(UUID benchedId) {
        if (activePokemon == null || !bench.contains(benchedId)) {
            return false;
        }
        UUID previous = activePokemon;
        bench.remove(benchedId);
        bench.add(previous);
        activePokemon = benchedId;
        clearSpecialConditions(previous);
        return true;
    }

    /**
     * Fill an empty active spot with the first benched Pokemon.
     * @return the promoted Pokemon, or empty if there was nothing to promote
     */
    public Optional<UUID> promoteFromBench() {
        if (activePokemon != null) {
            return Optional.empty();
        }
        Optional<UUID> promoted = bench.removeFirst();
        promoted.ifPresent(p -> activePokemon = p);
        return promoted;
    }

    public boolean isInPlay(UUID cardId) {
        return cardId != null && (cardId.equals(activePokemon) || bench.contains(cardId));
    }

    /**
     * Active Pokemon first, then the bench in order.
     */
    public List<UUID> getPokemonInPlay() {
        List<UUID> inPlay = new ArrayList<>(Bench.MAX_SIZE + 1);
        if (activePokemon != null) {
            inPlay.add(activePokemon);
        }
        inPlay.addAll(bench.getPokemon());
        return inPlay;
    }

    /**
     * Knock out a Pokemon in play: it and its energy go to the discard pile,
     * its damage and conditions are cleared and any effects on it stay the caller's concern.
     */
    public boolean knockOut(UUID pokemonId) {
        if (pokemonId.equals(activePokemon)) {
            activePokemon = null;
        } else if (!bench.remove(pokemonId)) {
            return false;
        }
        List<UUID> energy = attachedEnergy.remove(pokemonId);
        if (energy != null) {
            discardPile.addAll(energy);
        }
        discardPile.add(pokemonId);
        damageCounters.remove(pokemonId);
        specialConditions.remove(pokemonId);
        return true;
    }

    // ---- Energy ----

    /**
     * Attach an energy card from the hand to one of this player's Pokemon in play.
     */
    public boolean attachEnergy(UUID energyId, UUID pokemonId) {
        if (!hand.contains(energyId) || !isInPlay(pokemonId)) {
            return false;
        }
        hand.remove(energyId);
        attachedEnergy.computeIfAbsent(pokemonId, k -> new ArrayList<>()).add(energyId);
        return true;
    }

    /**
     * Discard up to count energy cards attached to a Pokemon, most recently attached first.
     * @return the discarded energy
     */
    public List<UUID> discardEnergy(UUID pokemonId, int count) {
        List<UUID> discarded = new ArrayList<>();
        List<UUID> energy = attachedEnergy.get(pokemonId);
        if (energy == null) {
            return discarded;
        }
        for (int i = 0; i < count && !energy.isEmpty(); i++) {
            discarded.add(energy.remove(energy.size() - 1));
        }
        if (energy.isEmpty()) {
            attachedEnergy.remove(pokemonId);
        }
        discardPile.addAll(discarded);
        return discarded;
    }

    public List<UUID> getAttachedEnergy(UUID pokemonId) {
        return List.copyOf(attachedEnergy.getOrDefault(pokemonId, List.of()));
    }

    public int getAttachedEnergyCount(UUID pokemonId) {
        List<UUID> energy = attachedEnergy.get(pokemonId);
        return energy == null ? 0 : energy.size();
    }

    /**
     * Types of the energy attached to a Pokemon. Non-energy or unknown ids are skipped.
     */
    public List<EnergyType> getAttachedEnergyTypes(UUID pokemonId, CardDatabase cardDatabase) {
        List<EnergyType> types = new ArrayList<>();
        for (UUID energyId : attachedEnergy.getOrDefault(pokemonId, List.of())) {
            cardDatabase.findCard(energyId)
                    .flatMap(Card::getEnergyData)
                    .map(CardKind.Energy::energyType)
                    .ifPresent(types::add);
        }
        return types;
    }

    // ---- Damage ----

    public void addDamage(UUID pokemonId, int damage) {
        if (damage <= 0) {
            return;
        }
        damageCounters.merge(pokemonId, damage, Integer::sum);
    }

    /**
     * Remove up to amount damage. A Pokemon healed to zero has no damage entry.
     */
    public void healDamage(UUID pokemonId, int amount) {
        Integer current = damageCounters.get(pokemonId);
        if (current == null || amount <= 0) {
            return;
        }
        int remaining = Math.max(0, current - amount);
        if (remaining == 0) {
            damageCounters.remove(pokemonId);
        } else {
            damageCounters.put(pokemonId, remaining);
        }
    }

    public int getDamage(UUID pokemonId) {
        return damageCounters.getOrDefault(pokemonId, 0);
    }

    /**
     * Whether the damage on a Pokemon has reached its HP.
     * Cards without HP are never knocked out.
     */
    public boolean isKnockedOut(UUID pokemonId, Card card) {
        int hp = card.getHp();
        return hp > 0 && getDamage(pokemonId) >= hp;
    }

    // ---- Special conditions ----

    public void addSpecialCondition(UUID pokemonId, SpecialCondition condition, int duration, int currentTurn) {
        addSpecialConditionWithData(pokemonId, condition, duration, currentTurn, Map.of());
    }

    public void addSpecialConditionWithData(UUID pokemonId, SpecialCondition condition, int duration,
                                            int currentTurn, Map<String, String> data) {
        specialConditions.computeIfAbsent(pokemonId, k -> new ArrayList<>())
                .add(new SpecialConditionInstance(condition, duration, currentTurn, data));
    }

    /**
     * Remove every condition of the same kind as the given one.
     */
    public void removeSpecialConditionType(UUID pokemonId, SpecialCondition conditionType) {
        List<SpecialConditionInstance> conditions = specialConditions.get(pokemonId);
        if (conditions == null) {
            return;
        }
        conditions.removeIf(instance -> instance.condition().sameKind(conditionType));
        if (conditions.isEmpty()) {
            specialConditions.remove(pokemonId);
        }
    }

    public void clearSpecialConditions(UUID pokemonId) {
        specialConditions.remove(pokemonId);
    }

    public boolean hasSpecialConditionType(UUID pokemonId, SpecialCondition conditionType) {
        return specialConditions.getOrDefault(pokemonId, List.of()).stream()
                .anyMatch(instance -> instance.condition().sameKind(conditionType));
    }

    public List<SpecialConditionInstance> getSpecialConditions(UUID pokemonId) {
        return List.copyOf(specialConditions.getOrDefault(pokemonId, List.of()));
    }

    /**
     * Produce the between-turns effects of every condition and count down durations.
     * Expired conditions are removed and reported as {@link ConditionEffect.ConditionRemoved}.
     */
    public List<ConditionEffect> updateSpecialConditions(int currentTurn) {
        List<ConditionEffect> effects = new ArrayList<>();
        Iterator<Map.Entry<UUID, List<SpecialConditionInstance>>> entries = specialConditions.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<UUID, List<SpecialConditionInstance>> entry = entries.next();
            UUID pokemonId = entry.getKey();
            List<SpecialConditionInstance> updated = new ArrayList<>();

            for (SpecialConditionInstance instance : entry.getValue()) {
                SpecialCondition condition = instance.condition();
                if (condition instanceof SpecialCondition.Poisoned poisoned) {
                    effects.add(new ConditionEffect.Damage(pokemonId, poisoned.damagePerTurn(), "Poison"));
                } else if (condition instanceof SpecialCondition.Burned burned) {
                    effects.add(new ConditionEffect.Damage(pokemonId, burned.damagePerTurn(), "Burn"));
                    effects.add(new ConditionEffect.CoinFlip(pokemonId, condition, "Remove burn condition"));
                } else if (condition instanceof SpecialCondition.Asleep) {
                    effects.add(new ConditionEffect.CoinFlip(pokemonId, condition, "Remove sleep condition"));
                }

                if (instance.duration() > 0) {
                    SpecialConditionInstance ticked = instance.tick();
                    if (ticked.duration() == 0) {
                        effects.add(new ConditionEffect.ConditionRemoved(pokemonId, condition));
                        continue;
                    }
                    updated.add(ticked);
                } else {
                    updated.add(instance);
                }
            }

            if (updated.isEmpty()) {
                entries.remove();
            } else {
                entry.setValue(updated);
            }
        }
        return effects;
    }

    /**
     * A Pokemon that is Paralyzed or Asleep cannot attack.
     */
    public boolean canPokemonAttack(UUID pokemonId) {
        for (SpecialConditionInstance instance : specialConditions.getOrDefault(pokemonId, List.of())) {
            if (instance.condition() instanceof SpecialCondition.Paralyzed
                    || instance.condition() instanceof SpecialCondition.Asleep) {
                return false;
            }
        }
        return true;
    }

    /**
     * A Trapped Pokemon cannot retreat.
     */
    public boolean canPokemonRetreat(UUID pokemonId) {
        return !hasSpecialConditionType(pokemonId, SpecialCondition.TRAPPED);
    }

    // ---- Turn ----

    /**
     * Reset the per-turn flags.
     */
    public void startTurn() {
        hasAttacked = false;
        energyAttachedThisTurn = false;
        supporterPlayedThisTurn = false;
        retreatedThisTurn = false;
    }

    /**
     * No Pokemon left in play.
     */
    public boolean hasLost() {
        return activePokemon == null && bench.isEmpty();
    }

    /**
     * Every prize has been taken.
     */
    public boolean hasWon() {
        return prizeCards == 0;
    }

    /**
     * Locate a card among this player's zones.
     */
    public Optional<CardLocation> findCardLocation(UUID cardId) {
        if (hand.contains(cardId)) {
            return Optional.of(new CardLocation.InHand());
        }
        if (deck.contains(cardId)) {
            return Optional.of(new CardLocation.InDeck());
        }
        if (discardPile.contains(cardId)) {
            return Optional.of(new CardLocation.InDiscard());
        }
        if (cardId.equals(activePokemon)) {
            return Optional.of(new CardLocation.Active());
        }
        int benchIndex = bench.indexOf(cardId);
        if (benchIndex >= 0) {
            return Optional.of(new CardLocation.OnBench(benchIndex));
        }
        if (prizes.contains(cardId)) {
            return Optional.of(new CardLocation.InPrizes());
        }
        for (Map.Entry<UUID, List<UUID>> entry : attachedEnergy.entrySet()) {
            if (entry.getValue().contains(cardId)) {
                return Optional.of(new CardLocation.AttachedEnergy(entry.getKey()));
            }
        }
        if (cardId.equals(stadium)) {
            return Optional.of(new CardLocation.Stadium());
        }
        return Optional.empty();
    }

    /**
     * Count of every card this player holds, across all zones, keyed by id.
     */
    public Map<UUID, Integer> cardCounts() {
        Map<UUID, Integer> counts = new HashMap<>();
        List<UUID> all = new ArrayList<>();
        all.addAll(hand.getCards());
        all.addAll(deck.getCards());
        all.addAll(discardPile.getCards());
        all.addAll(prizes);
        all.addAll(getPokemonInPlay());
        attachedEnergy.values().forEach(all::addAll);
        if (stadium != null) {
            all.add(stadium);
        }
        for (UUID cardId : all) {
            counts.merge(cardId, 1, Integer::sum);
        }
        return counts;
    }

    // ---- Accessors ----

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Hand getHand() {
        return hand;
    }

    public DrawPile getDeck() {
        return deck;
    }

    public DiscardPile getDiscardPile() {
        return discardPile;
    }

    public Bench getBench() {
        return bench;
    }

    public List<UUID> getPrizes() {
        return List.copyOf(prizes);
    }

    public int getPrizeCards() {
        return prizeCards;
    }

    public void setPrizeCards(int prizeCards) {
        this.prizeCards = prizeCards;
    }

    public Optional<UUID> getActivePokemon() {
        return Optional.ofNullable(activePokemon);
    }

    public Optional<UUID> getStadium() {
        return Optional.ofNullable(stadium);
    }

    /**
     * Put a stadium into play.
     * @return the stadium it replaced, if any
     */
    public Optional<UUID> setStadium(UUID stadium) {
        UUID previous = this.stadium;
        this.stadium = stadium;
        return Optional.ofNullable(previous);
    }

    public boolean hasAttacked() {
        return hasAttacked;
    }

    public void setHasAttacked(boolean hasAttacked) {
        this.hasAttacked = hasAttacked;
    }

    public boolean isEnergyAttachedThisTurn() {
        return energyAttachedThisTurn;
    }

    public void setEnergyAttachedThisTurn(boolean energyAttachedThisTurn) {
        this.energyAttachedThisTurn = energyAttachedThisTurn;
    }

    public boolean isSupporterPlayedThisTurn() {
        return supporterPlayedThisTurn;
    }

    public void setSupporterPlayedThisTurn(boolean supporterPlayedThisTurn) {
        this.supporterPlayedThisTurn = supporterPlayedThisTurn;
    }

    public boolean isRetreatedThisTurn() {
        return retreatedThisTurn;
    }

    public void setRetreatedThisTurn(boolean retreatedThisTurn) {
        this.retreatedThisTurn = retreatedThisTurn;
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
