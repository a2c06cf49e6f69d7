package com.vacancydb.vacancy.model;

public record CompanyVacancyCount(String companyName, long vacancyCount) {}
