package com.vtb.nessus.core;

/**
 * Файл пуст, не является корректным XML или не содержит ожидаемой структуры
 */
public class InvalidNessusFileException extends NessusParseException {

    public InvalidNessusFileException(String message) {
        super(message);
    }

    public InvalidNessusFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
