package org.crash.model;

/**
 * Cycle de vie d'un round. L'ordre des constantes est l'ordre d'avancement :
 * une phase ne revient jamais en arrière pour un même round.
 */
public enum RoundPhase {
    WAITING,
    COUNTING_DOWN,
    RUNNING,
    CRASHED,
    // transition non persistée : le round est abandonné sans toucher aux soldes
    ABANDONED;

    public boolean isTerminal() {
        return this == CRASHED || this == ABANDONED;
    }

    public boolean canAdvanceTo(RoundPhase next) {
        return next != null && next.ordinal() > ordinal();
    }
}
