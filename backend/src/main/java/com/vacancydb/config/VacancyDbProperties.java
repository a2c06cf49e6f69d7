package com.vacancydb.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

@ConfigurationProperties(prefix = "vacancy-db")
public class VacancyDbProperties {
    private static final String DEFAULT_HOST = "localhost";
    private static final int DEFAULT_PORT = 5432;

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String database = "postgres";
    private String user;
    private String password;
    private String url;
    private Map<String, String> driverProperties = new LinkedHashMap<>();
    private Cli cli = new Cli();

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host == null || host.isBlank() ? DEFAULT_HOST : host.trim();
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port <= 0 ? DEFAULT_PORT : port;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    /**
     * Full JDBC url. When set it wins over host, port and database.
     */
    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    /**
     * Extra options handed to the driver untouched (sslmode, connectTimeout, ...).
     */
    public Map<String, String> getDriverProperties() {
        return driverProperties;
    }

    public void setDriverProperties(Map<String, String> driverProperties) {
        this.driverProperties = driverProperties == null ? new LinkedHashMap<>() : driverProperties;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public String jdbcUrl() {
        if (url != null && !url.isBlank()) {
            return url.trim();
        }
        return "jdbc:postgresql://" + host + ":" + port + "/" + (database == null ? "" : database);
    }

    public Properties connectionProperties() {
        Properties properties = new Properties();
        properties.putAll(driverProperties);
        if (user != null) {
            properties.setProperty("user", user);
        }
        if (password != null) {
            properties.setProperty("password", password);
        }
        return properties;
    }

    public static class Cli {
        private String importFile;
        private boolean exitAfterRun = true;

        public String getImportFile() {
            return importFile;
        }

        public void setImportFile(String importFile) {
            this.importFile = importFile;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
