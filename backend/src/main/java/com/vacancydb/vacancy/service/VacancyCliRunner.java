package com.vacancydb.vacancy.service;

import com.vacancydb.config.VacancyDbProperties;
import com.vacancydb.vacancy.model.ImportSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

@Component
public class VacancyCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(VacancyCliRunner.class);

    private final VacancyDbProperties properties;
    private final VacancyImportService importService;
    private final ConfigurableApplicationContext applicationContext;

    public VacancyCliRunner(
        VacancyDbProperties properties,
        VacancyImportService importService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.importService = importService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        String importFile = properties.getCli().getImportFile();
        if (importFile == null || importFile.isBlank()) {
            return;
        }

        Path feedPath = resolvePath(importFile.trim());
        log.info("Importing vacancy feed {}", feedPath);
        ImportSummary summary = importService.importFeed(importService.readFeed(feedPath));
        for (String error : summary.sampleErrors()) {
            log.warn("Import error: {}", error);
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
