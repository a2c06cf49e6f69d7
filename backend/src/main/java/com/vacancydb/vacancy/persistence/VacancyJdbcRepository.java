package com.vacancydb.vacancy.persistence;

import com.vacancydb.vacancy.model.CompanyVacancyCount;
import com.vacancydb.vacancy.model.VacancyInsertOutcome;
import com.vacancydb.vacancy.model.VacancyListing;
import com.vacancydb.vacancy.model.VacancySalaryView;
import com.vacancydb.vacancy.util.RecordFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Companies and their vacancies. Every call runs as its own auto-committed statement on the
 * shared session connection; nothing here spans more than one statement.
 */
@Repository
public class VacancyJdbcRepository implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VacancyJdbcRepository.class);

    static final String DEFAULT_CURRENCY = "RUR";
    static final int DEFAULT_SALARY = 0;

    private static final RowMapper<VacancySalaryView> SALARY_VIEW_MAPPER = (rs, rowNum) -> new VacancySalaryView(
        rs.getString("name"),
        rs.getObject("salary_from", Integer.class),
        rs.getObject("salary_to", Integer.class),
        rs.getString("url")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public VacancyJdbcRepository(NamedParameterJdbcTemplate jdbc, VacancySchemaInitializer schemaInitializer) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
        schemaInitializer.createTables(jdbc.getJdbcTemplate());
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("companies", countTable("companies"));
        counts.put("vacancies", countTable("vacancies"));
        return counts;
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    /**
     * Inserts the company unless a row with the same id exists. Database errors, including a
     * clash on the unique company name, propagate to the caller.
     *
     * @return {@code true} when a row was written
     */
    public boolean insertCompany(Map<String, ?> company) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", RecordFields.toIntegerIfNumeric(company.get("id")))
            .addValue("name", RecordFields.asString(company.get("name")))
            .addValue("url", RecordFields.asString(company.get("alternate_url")));

        String sql = postgres
            ? """
                INSERT INTO companies (id, name, url)
                VALUES (:id, :name, :url)
                ON CONFLICT (id) DO NOTHING
                """
            : """
                INSERT INTO companies (id, name, url)
                SELECT CAST(:id AS INT), CAST(:name AS VARCHAR(255)), CAST(:url AS VARCHAR)
                WHERE NOT EXISTS (SELECT 1 FROM companies WHERE id = CAST(:id AS INT))
                """;
        return jdbc.update(sql, params) > 0;
    }

    /**
     * Best-effort vacancy insert. Records without {@code id}, {@code name} or
     * {@code alternate_url} are skipped; missing salary parts become 0, 0 and "RUR"; database
     * errors are logged and reported through the returned outcome instead of being thrown.
     */
    public VacancyInsertOutcome insertVacancy(Map<String, ?> vacancy, Object companyId) {
        if (!RecordFields.hasKeys(vacancy, "id", "name", "alternate_url")) {
            log.debug("Skipping vacancy without id/name/alternate_url: {}", vacancy);
            return VacancyInsertOutcome.SKIPPED_MISSING_FIELDS;
        }

        Map<String, Object> salary = RecordFields.nested(vacancy, "salary");
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", RecordFields.toIntegerIfNumeric(vacancy.get("id")))
            .addValue("companyId", RecordFields.toIntegerIfNumeric(companyId))
            .addValue("name", RecordFields.asString(vacancy.get("name")))
            .addValue("salaryFrom", RecordFields.intOrDefault(salary.get("from"), DEFAULT_SALARY))
            .addValue("salaryTo", RecordFields.intOrDefault(salary.get("to"), DEFAULT_SALARY))
            .addValue("currency", RecordFields.stringOrDefault(salary.get("currency"), DEFAULT_CURRENCY))
            .addValue("url", RecordFields.asString(vacancy.get("alternate_url")));

        String sql = postgres
            ? """
                INSERT INTO vacancies (id, company_id, name, salary_from, salary_to, currency, url)
                VALUES (:id, :companyId, :name, :salaryFrom, :salaryTo, :currency, :url)
                ON CONFLICT (id) DO NOTHING
                """
            : """
                INSERT INTO vacancies (id, company_id, name, salary_from, salary_to, currency, url)
                SELECT CAST(:id AS INT),
                       CAST(:companyId AS INT),
                       CAST(:name AS VARCHAR(255)),
                       CAST(:salaryFrom AS INT),
                       CAST(:salaryTo AS INT),
                       CAST(:currency AS VARCHAR(10)),
                       CAST(:url AS VARCHAR)
                WHERE NOT EXISTS (SELECT 1 FROM vacancies WHERE id = CAST(:id AS INT))
                """;
        try {
            int inserted = jdbc.update(sql, params);
            return inserted > 0 ? VacancyInsertOutcome.INSERTED : VacancyInsertOutcome.DUPLICATE;
        } catch (DataAccessException e) {
            log.error("Failed to insert vacancy: {}", e.getMostSpecificCause().getMessage());
            log.error("Rejected vacancy record: {}", vacancy);
            return VacancyInsertOutcome.FAILED;
        }
    }

    public List<CompanyVacancyCount> findCompanyVacancyCounts() {
        return jdbc.query(
            """
                SELECT c.name AS company_name, COUNT(v.id) AS vacancy_count
                FROM companies c
                LEFT JOIN vacancies v ON c.id = v.company_id
                GROUP BY c.name
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new CompanyVacancyCount(rs.getString("company_name"), rs.getLong("vacancy_count"))
        );
    }

    public List<VacancyListing> findAllVacancies() {
        return jdbc.query(
            """
                SELECT c.name AS company_name,
                       v.name AS vacancy_name,
                       v.salary_from,
                       v.salary_to,
                       v.url
                FROM vacancies v
                JOIN companies c ON v.company_id = c.id
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new VacancyListing(
                rs.getString("company_name"),
                rs.getString("vacancy_name"),
                rs.getObject("salary_from", Integer.class),
                rs.getObject("salary_to", Integer.class),
                rs.getString("url")
            )
        );
    }

    /**
     * Mean of the per-vacancy midpoint {@code (salary_from + salary_to) / 2}, over rows where
     * both bounds are present. Empty when there is no such row.
     */
    public Optional<BigDecimal> findAverageSalary() {
        BigDecimal average = jdbc.queryForObject(
            """
                SELECT AVG((salary_from + salary_to) / 2)
                FROM vacancies
                WHERE salary_from IS NOT NULL AND salary_to IS NOT NULL
                """,
            new MapSqlParameterSource(),
            BigDecimal.class
        );
        return Optional.ofNullable(average);
    }

    public List<VacancySalaryView> findVacanciesAboveAverageSalary() {
        Optional<BigDecimal> average = findAverageSalary();
        if (average.isEmpty()) {
            return List.of();
        }
        return jdbc.query(
            """
                SELECT name, salary_from, salary_to, url
                FROM vacancies
                WHERE ((salary_from + salary_to) / 2) > :average
                """,
            new MapSqlParameterSource().addValue("average", average.get()),
            SALARY_VIEW_MAPPER
        );
    }

    public List<VacancySalaryView> findVacanciesByKeyword(String keyword) {
        String needle = keyword == null ? "" : keyword.toLowerCase(Locale.ROOT);
        return jdbc.query(
            """
                SELECT name, salary_from, salary_to, url
                FROM vacancies
                WHERE LOWER(name) LIKE :nameLike
                """,
            new MapSqlParameterSource().addValue("nameLike", "%" + needle + "%"),
            SALARY_VIEW_MAPPER
        );
    }

    /**
     * Releases the session connection. The repository must not be used afterwards.
     */
    @Override
    public void close() {
        DataSource dataSource = jdbc.getJdbcTemplate().getDataSource();
        if (dataSource instanceof SingleConnectionDataSource session) {
            session.destroy();
        }
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        DataSource dataSource = jdbcTemplate.getJdbcTemplate().getDataSource();
        if (dataSource == null) {
            return false;
        }
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; using portable insert statements", e);
            return false;
        }
    }
}
