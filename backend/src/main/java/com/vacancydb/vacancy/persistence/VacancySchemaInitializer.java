package com.vacancydb.vacancy.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Creates the {@code companies} and {@code vacancies} tables when they are missing.
 * Safe to run against an already initialized database.
 */
@Component
public class VacancySchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(VacancySchemaInitializer.class);

    static final String CREATE_COMPANIES = """
        CREATE TABLE IF NOT EXISTS companies (
            id INT PRIMARY KEY,
            name VARCHAR(255) UNIQUE NOT NULL,
            url TEXT
        )
        """;

    static final String CREATE_VACANCIES = """
        CREATE TABLE IF NOT EXISTS vacancies (
            id INT PRIMARY KEY,
            company_id INT REFERENCES companies(id),
            name VARCHAR(255),
            salary_from INT,
            salary_to INT,
            currency VARCHAR(10),
            url TEXT
        )
        """;

    private static final List<String> STATEMENTS = List.of(CREATE_COMPANIES, CREATE_VACANCIES);

    public void createTables(JdbcTemplate jdbcTemplate) {
        for (String ddl : STATEMENTS) {
            try {
                jdbcTemplate.execute(ddl);
            } catch (DataAccessException e) {
                throw new SchemaInitializationException("Schema initialization failed: " + e.getMostSpecificCause().getMessage(), e);
            }
        }
        log.debug("Schema ready: companies, vacancies");
    }
}
