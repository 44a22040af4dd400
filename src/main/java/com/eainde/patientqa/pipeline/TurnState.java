package com.eainde.patientqa.pipeline;

/**
 * States of a single user turn, in the order they are visited.
 */
public enum TurnState {
    RECEIVED,
    RETRIEVING,
    COMPOSING,
    RED_FLAG_CHECK_PRE,
    GENERATING,
    RED_FLAG_CHECK_POST,
    FINALIZED
}
