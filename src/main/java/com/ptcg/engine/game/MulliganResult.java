package com.ptcg.engine.game;

import java.util.UUID;

/**
 * Result of every player taking a mulligan at once.
 */
public sealed interface MulliganResult permits MulliganResult.AllWithBasic, MulliganResult.AllWithoutBasic,
        MulliganResult.OneWithoutBasic {

    record AllWithBasic() implements MulliganResult {}

    record AllWithoutBasic() implements MulliganResult {}

    /** Exactly one player still has no Basic Pokemon. */
    record OneWithoutBasic(UUID playerId) implements MulliganResult {}
}
