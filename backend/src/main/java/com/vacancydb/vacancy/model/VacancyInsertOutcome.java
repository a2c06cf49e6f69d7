package com.vacancydb.vacancy.model;

/**
 * What happened to a single vacancy handed to the writer. None of these are thrown.
 */
public enum VacancyInsertOutcome {
    INSERTED,
    /** A row with the same id already existed and was kept. */
    DUPLICATE,
    /** The record lacked {@code id}, {@code name} or {@code alternate_url}. */
    SKIPPED_MISSING_FIELDS,
    /** The database rejected the row; the error has been logged. */
    FAILED
}
