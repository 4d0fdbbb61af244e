package com.mm.chartdata.procedures;

import com.mm.chartdata.config.ProceduresProperties;
import com.mm.chartdata.query.ChartValidationException;
import com.mm.chartdata.security.ProcedureWhitelist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Stored procedures allowed in custom-query {@code EXEC} statements: the configured
 * {@code app.procedures} plus a Redis set that administrators maintain at runtime.
 * The whitelist is read per request and handed to the validator as a value.
 */
@Component
public class ProcedureWhitelistStore {
  private static final Logger log = LoggerFactory.getLogger(ProcedureWhitelistStore.class);
  // optional [schema]. prefix, then the procedure name
  private static final Pattern PROCEDURE_NAME = Pattern.compile("^(\\[?\\w+\\]?\\.)?\\[?\\w+\\]?$");

  private final StringRedisTemplate redis;
  private final ProceduresProperties props;
  private final String key;

  public ProcedureWhitelistStore(StringRedisTemplate redis, ProceduresProperties props,
                                 @Value("${CHART_PROCEDURES_KEY:chartdata:procedures}") String key) {
    this.redis = redis;
    this.props = props;
    this.key = key;
  }

  /** Current whitelist; falls back to the configured names when Redis is unreachable. */
  public ProcedureWhitelist current() {
    Set<String> names = new LinkedHashSet<>(props.getProcedures());
    try {
      Set<String> stored = redis.opsForSet().members(key);
      if (stored != null) names.addAll(stored);
    } catch (DataAccessException e) {
      log.warn("Procedure whitelist unavailable in Redis key={}, using configured list only: {}", key, e.toString());
    }
    return ProcedureWhitelist.of(names);
  }

  public void add(String procedureName) {
    String name = requireName(procedureName);
    redis.opsForSet().add(key, name);
    log.info("Procedure {} added to whitelist", name);
  }

  /** @return false when the name was not in the Redis set */
  public boolean remove(String procedureName) {
    String name = requireName(procedureName);
    Long removed = redis.opsForSet().remove(key, name);
    log.info("Procedure {} removed from whitelist (removed={})", name, removed);
    return removed != null && removed > 0;
  }

  private static String requireName(String raw) {
    String name = raw == null ? "" : raw.trim();
    if (name.isEmpty() || !PROCEDURE_NAME.matcher(name).matches()) {
      throw new ChartValidationException("Invalid stored procedure name: " + raw);
    }
    return name;
  }
}
