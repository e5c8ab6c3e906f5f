package com.tsingest.resolution;

import java.util.Set;

/**
 * Stages of a coordinated load. Each stage may only move to the next one; there are no retries.
 */
public enum CoordinatorState {
    SCANNING,
    CLASSIFIED,
    BASE_SELECTED,
    LOADING,
    DONE;

    public boolean canTransitionTo(CoordinatorState target) {
        return allowedTargets().contains(target);
    }

    private Set<CoordinatorState> allowedTargets() {
        return switch (this) {
            case SCANNING -> Set.of(CLASSIFIED);
            case CLASSIFIED -> Set.of(BASE_SELECTED);
            case BASE_SELECTED -> Set.of(LOADING);
            case LOADING -> Set.of(DONE);
            case DONE -> Set.of();
        };
    }
}
