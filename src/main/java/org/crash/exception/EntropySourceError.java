package org.crash.exception;

/**
 * La source d'aléa cryptographique a échoué. Erreur fatale : le process s'arrête,
 * aucun repli sur un générateur plus faible.
 */
public class EntropySourceError extends Error {
    public EntropySourceError(String message, Throwable cause) {
        super(message, cause);
    }
}
