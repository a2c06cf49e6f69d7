package com.vacancydb.vacancy.api;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.SQLException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VacancyExceptionHandlerTest {

    @Test
    void readFailuresMapToServiceUnavailable() {
        VacancyExceptionHandler handler = new VacancyExceptionHandler();

        ResponseEntity<Map<String, String>> response = handler.handleDataAccess(
            new DataAccessResourceFailureException("query failed", new SQLException("connection reset")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody())
            .containsEntry("error", "database_unavailable")
            .containsEntry("message", "connection reset");
    }
}
