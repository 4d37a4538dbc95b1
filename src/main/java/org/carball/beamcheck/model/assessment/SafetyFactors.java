package org.carball.beamcheck.model.assessment;

/**
 * Material partial safety factors, applied as divisors to characteristic strength.
 */
public record SafetyFactors(double steel, double concrete, double reinforcement, double timber) {

    public SafetyFactors withSteel(double value) {
        return new SafetyFactors(value, concrete, reinforcement, timber);
    }

    public SafetyFactors withConcrete(double value) {
        return new SafetyFactors(steel, value, reinforcement, timber);
    }

    public SafetyFactors withReinforcement(double value) {
        return new SafetyFactors(steel, concrete, value, timber);
    }

    public SafetyFactors withTimber(double value) {
        return new SafetyFactors(steel, concrete, reinforcement, value);
    }
}
