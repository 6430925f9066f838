package com.ptcg.engine.game;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of players declaring whether their opening hand holds a Basic Pokemon.
 *
 * @param playersWithoutBasic players who must mulligan, in seating order
 * @param allWithoutBasic     true when no player holds a Basic
 */
public record MulliganDeclaration(List<UUID> playersWithoutBasic, boolean allWithoutBasic) {
    public MulliganDeclaration {
        playersWithoutBasic = List.copyOf(playersWithoutBasic);
    }

    public boolean anyWithoutBasic() {
        return !playersWithoutBasic.isEmpty();
    }
}
