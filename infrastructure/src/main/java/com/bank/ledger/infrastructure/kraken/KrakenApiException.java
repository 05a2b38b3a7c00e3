package com.bank.ledger.infrastructure.kraken;

/**
 * Kraken returned an error or could not be reached
 */
public class KrakenApiException extends RuntimeException {

    public KrakenApiException(String message) {
        super(message);
    }

    public KrakenApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
