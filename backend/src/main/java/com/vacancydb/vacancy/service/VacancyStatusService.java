package com.vacancydb.vacancy.service;

import com.vacancydb.vacancy.model.StatusResponse;
import com.vacancydb.vacancy.persistence.VacancyJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;

@Service
public class VacancyStatusService {
    private static final Logger log = LoggerFactory.getLogger(VacancyStatusService.class);
    private final VacancyJdbcRepository repository;

    public VacancyStatusService(VacancyJdbcRepository repository) {
        this.repository = repository;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.warn("Database connectivity check failed: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, new LinkedHashMap<>());
        }
        return new StatusResponse(true, repository.tableCounts());
    }
}
