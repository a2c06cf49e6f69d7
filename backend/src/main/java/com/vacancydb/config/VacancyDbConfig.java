package com.vacancydb.config;

import com.vacancydb.vacancy.persistence.DatabaseConnectionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.SQLException;

@Configuration
public class VacancyDbConfig {
    private static final Logger log = LoggerFactory.getLogger(VacancyDbConfig.class);

    /**
     * One physical connection for the whole application, auto-committing every statement.
     * Callers closing the connection handed out by the pool-less data source is a no-op;
     * the connection is released when the context shuts down.
     */
    @Bean(destroyMethod = "destroy")
    public SingleConnectionDataSource sessionDataSource(VacancyDbProperties properties) {
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource();
        dataSource.setUrl(properties.jdbcUrl());
        dataSource.setConnectionProperties(properties.connectionProperties());
        dataSource.setAutoCommit(true);
        dataSource.setSuppressClose(true);
        try {
            dataSource.initConnection();
        } catch (SQLException e) {
            throw new DatabaseConnectionException(
                "Unable to connect to " + describe(properties) + ": " + e.getMessage(), e);
        }
        log.info("Opened database session to {}", describe(properties));
        return dataSource;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private static String describe(VacancyDbProperties properties) {
        String url = properties.jdbcUrl();
        int query = url.indexOf('?');
        return query < 0 ? url : url.substring(0, query);
    }
}
