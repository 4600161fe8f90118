package com.vtb.nessus.core;

/**
 * Структурно корректная выгрузка без единой находки
 */
public class EmptyReportException extends NessusParseException {

    public EmptyReportException(String message) {
        super(message);
    }
}
