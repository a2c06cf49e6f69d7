package com.vacancydb.vacancy.api;

import com.vacancydb.vacancy.model.AverageSalaryResponse;
import com.vacancydb.vacancy.model.CompanyVacancyCount;
import com.vacancydb.vacancy.model.ImportSummary;
import com.vacancydb.vacancy.model.StatusResponse;
import com.vacancydb.vacancy.model.VacancyListing;
import com.vacancydb.vacancy.model.VacancySalaryView;
import com.vacancydb.vacancy.persistence.VacancyJdbcRepository;
import com.vacancydb.vacancy.service.VacancyImportService;
import com.vacancydb.vacancy.service.VacancyStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class VacancyController {
    private final VacancyJdbcRepository repository;
    private final VacancyImportService importService;
    private final VacancyStatusService statusService;

    public VacancyController(
        VacancyJdbcRepository repository,
        VacancyImportService importService,
        VacancyStatusService statusService
    ) {
        this.repository = repository;
        this.importService = importService;
        this.statusService = statusService;
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/companies/vacancy-counts")
    public List<CompanyVacancyCount> companyVacancyCounts() {
        return repository.findCompanyVacancyCounts();
    }

    @GetMapping("/vacancies")
    public List<VacancyListing> allVacancies() {
        return repository.findAllVacancies();
    }

    @GetMapping("/vacancies/average-salary")
    public AverageSalaryResponse averageSalary() {
        return new AverageSalaryResponse(repository.findAverageSalary().orElse(null));
    }

    @GetMapping("/vacancies/above-average")
    public List<VacancySalaryView> vacanciesAboveAverage() {
        return repository.findVacanciesAboveAverageSalary();
    }

    @GetMapping("/vacancies/search")
    public List<VacancySalaryView> searchVacancies(
        @RequestParam(name = "keyword", required = false) String keyword
    ) {
        if (keyword == null || keyword.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "keyword is required");
        }
        return repository.findVacanciesByKeyword(keyword);
    }

    @PostMapping("/import")
    public ImportSummary importFeed(@RequestBody List<Map<String, Object>> feed) {
        return importService.importFeed(feed);
    }
}
