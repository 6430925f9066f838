package com.ptcg.engine.rules;

/**
 * The rule set used for a normal match.
 */
public final class StandardRules {

    private StandardRules() {
        // Utility class - prevent instantiation
    }

    public static RuleEngine createEngine() {
        return createEngine(RuleConfig.defaults());
    }

    public static RuleEngine createEngine(RuleConfig config) {
        RuleEngine engine = new RuleEngine(config);
        engine.addRule(new GameInProgressRule());
        engine.addRule(new TurnOrderRule());
        engine.addRule(new HandLimitRule());
        engine.addRule(new EnergyAttachmentRule());
        engine.addRule(new EnergyPerTurnRule());
        engine.addRule(new CardPlayRule());
        engine.addRule(new AttackRule());
        engine.addRule(new RetreatRule());
        return engine;
    }
}
