package com.mm.chartdata.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app")
public class ProceduresProperties {
  private List<String> procedures = new ArrayList<>(); // always allowed in EXEC, in addition to the Redis set
  public List<String> getProcedures() { return procedures; }
  public void setProcedures(List<String> procedures) { this.procedures = procedures; }
}
