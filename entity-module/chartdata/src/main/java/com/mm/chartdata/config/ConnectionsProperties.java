package com.mm.chartdata.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import java.util.HashMap;
import java.util.Map;

/** Named data-source connections selectable through a chart's {@code connectionId}. */
@ConfigurationProperties(prefix = "app")
public class ConnectionsProperties {
  private Map<String, ConnectionConfig> connections = new HashMap<>();
  public Map<String, ConnectionConfig> getConnections() { return connections; }
  public void setConnections(Map<String, ConnectionConfig> connections) { this.connections = connections; }

  public static class ConnectionConfig {
    private String url;
    private String username;
    private String password;
    private String driverClassName; // optional, derived from the url by Hikari when absent
    private int maximumPoolSize = 10;
    private long connectionTimeoutMs = 30000L;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getDriverClassName() { return driverClassName; }
    public void setDriverClassName(String driverClassName) { this.driverClassName = driverClassName; }

    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }

    public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
    public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }
  }
}
