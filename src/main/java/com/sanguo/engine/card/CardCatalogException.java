package com.sanguo.engine.card;

/**
 * Exception thrown by CardCatalog operations.
 */
public class CardCatalogException extends Exception {
    public CardCatalogException(String message) {
        super(message);
    }

    public CardCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
