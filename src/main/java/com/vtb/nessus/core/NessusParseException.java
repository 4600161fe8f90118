package com.vtb.nessus.core;

/**
 * Базовое исключение обработки выгрузки Nessus
 */
public class NessusParseException extends Exception {

    public NessusParseException(String message) {
        super(message);
    }

    public NessusParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
