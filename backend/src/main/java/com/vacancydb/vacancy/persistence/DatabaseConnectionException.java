package com.vacancydb.vacancy.persistence;

/**
 * The database could not be reached or rejected the credentials.
 */
public class DatabaseConnectionException extends RuntimeException {
    public DatabaseConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
