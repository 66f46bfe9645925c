package io.trialforge.model;

public enum LifecycleState {
    PROBATION,
    GRADUATED,
    DEMOTED
}
