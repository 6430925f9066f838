package com.ptcg.engine.game;

import java.util.List;
import java.util.UUID;

/**
 * A hand shown to another player.
 */
public record HandReveal(UUID playerId, UUID revealedTo, List<UUID> cards) {
    public HandReveal {
        cards = List.copyOf(cards);
    }
}
