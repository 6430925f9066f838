package com.ptcg.engine.effects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Game moments at which attached effects fire.
 */
public enum EffectTrigger {
    ON_PLAY("on_play"),
    ON_ENTER_PLAY("on_enter_play"),
    ON_LEAVE_PLAY("on_leave_play"),
    ON_KNOCK_OUT("on_knock_out"),
    ON_TURN_START("on_turn_start"),
    ON_TURN_END("on_turn_end"),
    ON_TAKE_DAMAGE("on_take_damage"),
    ON_DEAL_DAMAGE("on_deal_damage"),
    ON_ATTACK("on_attack"),
    ON_ENERGY_ATTACH("on_energy_attach"),
    ON_CARD_DRAW("on_card_draw"),
    /** Only fired when a caller triggers it explicitly. */
    MANUAL("manual");

    private final String jsonValue;

    EffectTrigger(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
