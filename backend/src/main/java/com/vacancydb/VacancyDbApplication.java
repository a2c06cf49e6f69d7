package com.vacancydb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VacancyDbApplication {

  public static void main(String[] args) {
    SpringApplication.run(VacancyDbApplication.class, args);
  }
}
