package com.vacancydb.vacancy.model;

import java.time.Instant;
import java.util.List;

public record ImportSummary(
    int companiesInserted,
    int vacanciesInserted,
    int duplicates,
    int skipped,
    int failed,
    List<String> sampleErrors,
    Instant startedAt,
    Instant finishedAt
) {
}
