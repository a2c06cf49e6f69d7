package com.vacancydb.vacancy.model;

public record VacancySalaryView(String name, Integer salaryFrom, Integer salaryTo, String url) {}
