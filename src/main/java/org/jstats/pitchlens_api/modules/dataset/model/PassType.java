package org.jstats.pitchlens_api.modules.dataset.model;

public enum PassType {
    CROSS,
    HAND_PASS,
    HEAD_PASS,
    HIGH_PASS,
    LAUNCH,
    SIMPLE_PASS,
    SMART_PASS,
    LONG_BALL,
    THROUGH_BALL,
    CHIPPED_PASS,
    FLICK_ON,
    ASSIST,
    ASSIST_2ND,
    SWITCH_OF_PLAY
}
