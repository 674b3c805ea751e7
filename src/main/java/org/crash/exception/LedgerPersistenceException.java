package org.crash.exception;

/** Le store n'a pas pu enregistrer un pari ou un encaissement ; rien n'a été appliqué. */
public class LedgerPersistenceException extends RuntimeException {
    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
