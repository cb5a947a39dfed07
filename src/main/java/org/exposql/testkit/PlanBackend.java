package org.exposql.testkit;

/**
 * Something that compiles and executes a scenario, usually one plan strategy on the in-memory engine.
 */
public interface PlanBackend {
    String name();

    PlanOutcome execute(EquivalenceScenario scenario);
}
