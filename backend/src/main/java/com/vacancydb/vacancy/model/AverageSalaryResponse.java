package com.vacancydb.vacancy.model;

import java.math.BigDecimal;

public record AverageSalaryResponse(BigDecimal averageSalary) {}
