package com.mm.chartdata.config;

import com.mm.chartdata.query.PostgresDialect;
import com.mm.chartdata.query.SqlDialect;
import com.mm.chartdata.query.SqlServerDialect;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({ ConnectionsProperties.class, ProceduresProperties.class })
public class AppConfig {

    @Bean
    public SqlDialect sqlDialect(@Value("${CHART_SQL_DIALECT:sqlserver}") String dialect) {
        return switch (dialect.trim().toLowerCase(Locale.ROOT)) {
            case "sqlserver", "mssql" -> new SqlServerDialect();
            case "postgres", "postgresql" -> new PostgresDialect();
            default -> throw new IllegalStateException("Unsupported CHART_SQL_DIALECT: " + dialect);
        };
    }

    // Fan-out pool for batch renders; real parallelism is bounded by the connection pool
    @Bean(name = "chartBatchExecutor", destroyMethod = "shutdown")
    public ExecutorService chartBatchExecutor(@Value("${CHART_BATCH_THREADS:16}") int threads) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "chart-batch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), tf);
    }
}
