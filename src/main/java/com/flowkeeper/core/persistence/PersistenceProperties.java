package com.flowkeeper.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Database connection for journals and conversations. Without a JDBC URL
 * everything is kept in memory and lost on restart.
 */
@Component
@ConfigurationProperties(prefix = "flowkeeper.persistence")
public class PersistenceProperties {

    private String jdbcUrl = "";
    private String username = "";
    private String password = "";
    private int maximumPoolSize = 10;

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getMaximumPoolSize() {
        return maximumPoolSize;
    }

    public void setMaximumPoolSize(int maximumPoolSize) {
        this.maximumPoolSize = maximumPoolSize;
    }
}
