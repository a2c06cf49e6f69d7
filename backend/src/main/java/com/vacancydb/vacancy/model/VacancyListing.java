package com.vacancydb.vacancy.model;

public record VacancyListing(
    String companyName,
    String vacancyName,
    Integer salaryFrom,
    Integer salaryTo,
    String url
) {
}
