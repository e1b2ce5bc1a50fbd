package org.jstats.pitchlens_api.modules.dataset.model;

public enum CardType {
    FIRST_YELLOW,
    SECOND_YELLOW,
    RED;

    /**
     * Whether the booked player has to leave the pitch.
     */
    public boolean sendsOff() {
        return this != FIRST_YELLOW;
    }
}
