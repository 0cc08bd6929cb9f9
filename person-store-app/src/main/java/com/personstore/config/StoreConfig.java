package com.personstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Location of the person database.
 * Define under 'personstore' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "personstore")
public class StoreConfig {

    public static final String JDBC_PREFIX = "jdbc:sqlite:";
    public static final String IN_MEMORY_URL = JDBC_PREFIX + ":memory:";

    private String databasePath = "database.db";
    private boolean inMemory = false;
    private Demo demo = new Demo();

    /**
     * The JDBC URL for the configured mode. In-memory wins over the file path.
     *
     * @throws IllegalStateException if file mode is selected without a path
     */
    public String jdbcUrl() {
        if (inMemory) {
            return IN_MEMORY_URL;
        }
        if (databasePath == null || databasePath.isBlank()) {
            throw new IllegalStateException("personstore.database-path must be set unless personstore.in-memory is true");
        }
        return JDBC_PREFIX + databasePath.trim();
    }

    public String getDatabasePath() { return databasePath; }
    public void setDatabasePath(String databasePath) { this.databasePath = databasePath; }

    public boolean isInMemory() { return inMemory; }
    public void setInMemory(boolean inMemory) { this.inMemory = inMemory; }

    public Demo getDemo() { return demo; }
    public void setDemo(Demo demo) { this.demo = demo; }

    public static class Demo {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
