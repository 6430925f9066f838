package com.ptcg.engine.effects;

import com.ptcg.engine.events.GameEvent;
import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;

import java.util.List;
import java.util.UUID;

/**
 * A player draws cards. The target may name the player; otherwise the context's source player draws.
 */
public class DrawCardsEffect extends BaseEffect {
    private final int count;

    public DrawCardsEffect(String name, int count, List<EffectTrigger> triggers) {
        super(name, "Draw " + count + " cards", triggers, List.of());
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        this.count = count;
    }

    @Override
    public boolean canApply(Game game, EffectContext context) {
        UUID playerId = drawingPlayer(context);
        return playerId != null && game.findPlayer(playerId).map(p -> !p.getDeck().isEmpty()).orElse(false);
    }

    @Override
    public List<EffectOutcome> apply(Game game, EffectContext context) throws EffectException {
        UUID playerId = drawingPlayer(context);
        if (playerId == null) {
            throw new EffectException(EffectException.Reason.INVALID_TARGET, "No player to draw cards");
        }
        Player player = game.findPlayer(playerId)
                .orElseThrow(() -> new EffectException(EffectException.Reason.INVALID_TARGET,
                        "Player not found: " + playerId));
        if (player.getDeck().isEmpty()) {
            throw new EffectException(EffectException.Reason.INSUFFICIENT_RESOURCES,
                    player.getName() + " has no cards left to draw");
        }
        List<UUID> drawn = player.drawCards(count);
        for (UUID cardId : drawn) {
            game.recordEvent(new GameEvent.CardDrawn(playerId, cardId));
        }
        return List.of(new EffectOutcome.CardsDrawn(playerId, drawn));
    }

    private static UUID drawingPlayer(EffectContext context) {
        if (context.target() instanceof EffectTarget.SpecificPlayer specific) {
            return specific.playerId();
        }
        return context.sourcePlayer();
    }
}
