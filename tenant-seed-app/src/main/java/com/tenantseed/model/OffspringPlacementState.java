package com.tenantseed.model;

public enum OffspringPlacementState {
    UNASSIGNED,
    OPTION_HOLD,
    RESERVED,
    PLACED,
    RETURNED,
    TRANSFERRED;

    /**
     * True once a buyer holds or has taken the offspring.
     */
    public boolean isSpokenFor() {
        return this == OPTION_HOLD || this == RESERVED || this == PLACED;
    }
}
