package net.littleredcomputer.refactor;

/** Why a proposed set of steps does not make a candidate theorem. */
public enum Rejection {
    OUT_OF_RANGE,
    TOO_SMALL,
    DISCONNECTED,
    MULTIPLE_EXITS,
    NO_HYPOTHESES,
    SELF_EXTRACTION,
    TRIVIAL,
}
