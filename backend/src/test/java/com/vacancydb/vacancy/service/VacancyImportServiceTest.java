package com.vacancydb.vacancy.service;

import com.vacancydb.vacancy.model.ImportSummary;
import com.vacancydb.vacancy.model.VacancyInsertOutcome;
import com.vacancydb.vacancy.persistence.VacancyJdbcRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VacancyImportServiceTest {

    @Mock
    private VacancyJdbcRepository repository;

    private VacancyImportService service;

    @BeforeEach
    void setUp() {
        service = new VacancyImportService(repository, new ObjectMapper());
    }

    @Test
    void writesCompanyBeforeItsVacancies() {
        Map<String, Object> employer = Map.of("id", "15", "name", "Order Co", "alternate_url", "https://order");
        Map<String, Object> first = Map.of("id", "150", "name", "A", "alternate_url", "https://order/150");
        Map<String, Object> second = Map.of("id", "151", "name", "B", "alternate_url", "https://order/151");
        when(repository.insertCompany(employer)).thenReturn(true);
        when(repository.insertVacancy(first, "15")).thenReturn(VacancyInsertOutcome.INSERTED);
        when(repository.insertVacancy(second, "15")).thenReturn(VacancyInsertOutcome.DUPLICATE);

        ImportSummary summary = service.importEmployer(employer, List.of(first, second));

        InOrder order = inOrder(repository);
        order.verify(repository).insertCompany(employer);
        order.verify(repository).insertVacancy(first, "15");
        order.verify(repository).insertVacancy(second, "15");
        assertThat(summary.companiesInserted()).isEqualTo(1);
        assertThat(summary.vacanciesInserted()).isEqualTo(1);
        assertThat(summary.duplicates()).isEqualTo(1);
        assertThat(summary.failed()).isZero();
        assertThat(summary.finishedAt()).isAfterOrEqualTo(summary.startedAt());
    }

    @Test
    void failedVacanciesAreCountedAndSampled() {
        Map<String, Object> employer = Map.of("id", 20, "name", "Fail Co");
        Map<String, Object> broken = Map.of("id", 200, "name", "Broken", "alternate_url", "https://fail/200");
        Map<String, Object> partial = Map.of("id", 201, "alternate_url", "https://fail/201");
        when(repository.insertCompany(employer)).thenReturn(false);
        when(repository.insertVacancy(broken, 20)).thenReturn(VacancyInsertOutcome.FAILED);
        when(repository.insertVacancy(partial, 20)).thenReturn(VacancyInsertOutcome.SKIPPED_MISSING_FIELDS);

        ImportSummary summary = service.importEmployer(employer, List.of(broken, partial));

        assertThat(summary.companiesInserted()).isZero();
        assertThat(summary.duplicates()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.sampleErrors()).containsExactly("vacancy 200 of company 20");
    }

    @Test
    void companyFailureSkipsItsVacanciesButNotOtherEntries() {
        Map<String, Object> clashing = Map.of("id", 30, "name", "Same Name");
        Map<String, Object> healthy = Map.of("id", 31, "name", "Healthy");
        Map<String, Object> lost = Map.of("id", 300, "name", "Lost", "alternate_url", "https://x/300");
        Map<String, Object> kept = Map.of("id", 310, "name", "Kept", "alternate_url", "https://x/310");
        when(repository.insertCompany(clashing)).thenThrow(new DuplicateKeyException("name taken"));
        when(repository.insertCompany(healthy)).thenReturn(true);
        when(repository.insertVacancy(kept, 31)).thenReturn(VacancyInsertOutcome.INSERTED);

        ImportSummary summary = service.importFeed(List.of(
            Map.of("employer", clashing, "vacancies", List.of(lost)),
            Map.of("employer", healthy, "vacancies", List.of(kept))
        ));

        verify(repository, never()).insertVacancy(eq(lost), any());
        assertThat(summary.companiesInserted()).isEqualTo(1);
        assertThat(summary.vacanciesInserted()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.sampleErrors()).singleElement().asString().contains("company 30");
    }

    @Test
    void employerWithoutIdIsSkippedWithItsVacancies() {
        Map<String, Object> employer = Map.of("name", "Anonymous");
        Map<String, Object> vacancy = Map.of("id", 400, "name", "Ghost", "alternate_url", "https://ghost/400");

        ImportSummary summary = service.importEmployer(employer, List.of(vacancy));

        verify(repository, never()).insertCompany(anyMap());
        verify(repository, never()).insertVacancy(anyMap(), any());
        assertThat(summary.skipped()).isEqualTo(2);
    }

    @Test
    void nullFeedProducesEmptySummary() {
        ImportSummary summary = service.importFeed(null);

        assertThat(summary.companiesInserted()).isZero();
        assertThat(summary.vacanciesInserted()).isZero();
        assertThat(summary.sampleErrors()).isEmpty();
    }

    @Test
    void malformedVacancyEntriesAreCountedAsSkipped() {
        Map<String, Object> employer = Map.of("id", 50, "name", "Messy Co");
        Map<String, Object> good = Map.of("id", 500, "name", "Good", "alternate_url", "https://messy/500");
        when(repository.insertCompany(employer)).thenReturn(true);
        when(repository.insertVacancy(good, 50)).thenReturn(VacancyInsertOutcome.INSERTED);
        Map<String, Object> otherEmployer = Map.of("id", 51, "name", "Scalar Co");
        when(repository.insertCompany(otherEmployer)).thenReturn(true);

        ImportSummary summary = service.importFeed(List.of(
            Map.of("employer", employer, "vacancies", List.of(good, "not-a-vacancy", 42)),
            Map.of("employer", otherEmployer, "vacancies", "none")
        ));

        assertThat(summary.companiesInserted()).isEqualTo(2);
        assertThat(summary.vacanciesInserted()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(3);
    }
}
