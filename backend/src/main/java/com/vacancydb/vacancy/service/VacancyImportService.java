package com.vacancydb.vacancy.service;

import com.vacancydb.vacancy.model.ImportSummary;
import com.vacancydb.vacancy.model.VacancyInsertOutcome;
import com.vacancydb.vacancy.persistence.VacancyJdbcRepository;
import com.vacancydb.vacancy.util.RecordFields;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads an upstream feed of employers and their vacancies. Each employer is written before its
 * vacancies so the foreign key can resolve.
 */
@Service
public class VacancyImportService {
    private static final Logger log = LoggerFactory.getLogger(VacancyImportService.class);
    private static final TypeReference<List<Map<String, Object>>> FEED_TYPE = new TypeReference<>() {};
    private static final int MAX_ERROR_SAMPLES = 10;

    private final VacancyJdbcRepository repository;
    private final ObjectMapper objectMapper;

    public VacancyImportService(VacancyJdbcRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    public List<Map<String, Object>> readFeed(Path path) {
        try {
            return objectMapper.readValue(Files.readAllBytes(path), FEED_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read vacancy feed " + path, e);
        }
    }

    public ImportSummary importFeed(List<Map<String, Object>> entries) {
        Instant startedAt = Instant.now();
        MutableCounts counts = new MutableCounts();
        ErrorCollector errors = new ErrorCollector();
        if (entries != null) {
            for (Map<String, Object> entry : entries) {
                importEntry(
                    RecordFields.nested(entry, "employer"),
                    vacancyList(entry == null ? null : entry.get("vacancies"), counts),
                    counts,
                    errors
                );
            }
        }
        ImportSummary summary = counts.toSummary(errors, startedAt, Instant.now());
        log.info(
            "Feed import finished: companies={}, vacancies={}, duplicates={}, skipped={}, failed={}",
            summary.companiesInserted(),
            summary.vacanciesInserted(),
            summary.duplicates(),
            summary.skipped(),
            summary.failed()
        );
        return summary;
    }

    public ImportSummary importEmployer(Map<String, Object> employer, List<Map<String, Object>> vacancies) {
        Instant startedAt = Instant.now();
        MutableCounts counts = new MutableCounts();
        ErrorCollector errors = new ErrorCollector();
        importEntry(employer, vacancies, counts, errors);
        return counts.toSummary(errors, startedAt, Instant.now());
    }

    private void importEntry(
        Map<String, Object> employer,
        List<Map<String, Object>> vacancies,
        MutableCounts counts,
        ErrorCollector errors
    ) {
        List<Map<String, Object>> safeVacancies = vacancies == null ? List.of() : vacancies;
        if (!RecordFields.hasKeys(employer, "id", "name")) {
            log.debug("Skipping employer without id/name and its {} vacancies", safeVacancies.size());
            counts.skipped += 1 + safeVacancies.size();
            return;
        }

        Object companyId = employer.get("id");
        try {
            if (repository.insertCompany(employer)) {
                counts.companiesInserted++;
            } else {
                counts.duplicates++;
            }
        } catch (DataAccessException e) {
            String message = "company " + companyId + ": " + e.getMostSpecificCause().getMessage();
            log.warn("Company write failed, skipping its vacancies: {}", message);
            errors.add(message);
            counts.failed++;
            counts.skipped += safeVacancies.size();
            return;
        }

        for (Map<String, Object> vacancy : safeVacancies) {
            VacancyInsertOutcome outcome = repository.insertVacancy(vacancy, companyId);
            switch (outcome) {
                case INSERTED -> counts.vacanciesInserted++;
                case DUPLICATE -> counts.duplicates++;
                case SKIPPED_MISSING_FIELDS -> counts.skipped++;
                case FAILED -> {
                    counts.failed++;
                    errors.add("vacancy " + (vacancy == null ? null : vacancy.get("id")) + " of company " + companyId);
                }
            }
        }
    }

    /**
     * Feed entries whose {@code vacancies} value is not a list, and list items that are not
     * objects, are counted as skipped.
     */
    private List<Map<String, Object>> vacancyList(Object raw, MutableCounts counts) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            log.debug("Skipping non-list vacancies value: {}", raw);
            counts.skipped++;
            return List.of();
        }
        List<Map<String, Object>> vacancies = new ArrayList<>();
        for (Object item : list) {
            Map<String, Object> vacancy = RecordFields.asRecord(item);
            if (vacancy == null) {
                log.debug("Skipping malformed vacancy item: {}", item);
                counts.skipped++;
            } else {
                vacancies.add(vacancy);
            }
        }
        return vacancies;
    }

    private static class MutableCounts {
        private int companiesInserted;
        private int vacanciesInserted;
        private int duplicates;
        private int skipped;
        private int failed;

        private ImportSummary toSummary(ErrorCollector errors, Instant startedAt, Instant finishedAt) {
            return new ImportSummary(
                companiesInserted,
                vacanciesInserted,
                duplicates,
                skipped,
                failed,
                errors.sampleErrors(),
                startedAt,
                finishedAt
            );
        }
    }

    private static class ErrorCollector {
        private final List<String> sampleErrors = new ArrayList<>();

        private void add(String message) {
            if (sampleErrors.size() < MAX_ERROR_SAMPLES) {
                sampleErrors.add(message);
            }
        }

        private List<String> sampleErrors() {
            return List.copyOf(sampleErrors);
        }
    }
}
