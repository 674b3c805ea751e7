package org.crash.exception;

/**
 * Requête refusée par les règles du jeu (mauvaise phase, solde insuffisant, pari en double...).
 * Le message est renvoyé tel quel au client.
 */
public class GameRuleException extends RuntimeException {
    public GameRuleException(String message) {
        super(message);
    }
}
