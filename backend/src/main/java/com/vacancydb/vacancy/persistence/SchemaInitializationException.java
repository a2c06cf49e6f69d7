package com.vacancydb.vacancy.persistence;

public class SchemaInitializationException extends RuntimeException {
    public SchemaInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
