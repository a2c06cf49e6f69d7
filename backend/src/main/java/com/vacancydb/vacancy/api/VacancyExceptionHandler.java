package com.vacancydb.vacancy.api;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class VacancyExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(VacancyExceptionHandler.class);

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, String>> handleDataAccess(DataAccessException ex) {
    String message = ex.getMostSpecificCause().getMessage();
    log.error("Database query failed: {}", message, ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "database_unavailable", "message", message == null ? "" : message));
  }
}
