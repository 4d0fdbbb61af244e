package com.mm.chartdata.service.impl;

import com.mm.chartdata.jdbc.ConnectionNotFoundException;
import com.mm.chartdata.model.BatchRequest;
import com.mm.chartdata.model.BatchResult;
import com.mm.chartdata.query.ChartValidationException;
import com.mm.chartdata.service.BatchChartService;
import com.mm.chartdata.service.ChartDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs every chart of a dashboard concurrently. Each request is isolated: its failure becomes
 * the {@code error} of its own result and never cancels the others.
 */
@Service
public class BatchChartServiceImpl implements BatchChartService {

    private static final Logger log = LoggerFactory.getLogger(BatchChartServiceImpl.class);

    private final ChartDataService charts;
    private final ExecutorService executor;
    private final int maxRequests;

    public BatchChartServiceImpl(ChartDataService charts,
                                 @Qualifier("chartBatchExecutor") ExecutorService executor,
                                 @Value("${CHART_BATCH_MAX_REQUESTS:50}") int maxRequests) {
        this.charts = charts;
        this.executor = executor;
        this.maxRequests = maxRequests;
    }

    @Override
    public List<BatchResult> runBatch(List<BatchRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new ChartValidationException("Requests array is required and must not be empty");
        }
        if (requests.size() > maxRequests) {
            throw new ChartValidationException("Maximum " + maxRequests + " charts per batch request");
        }
        for (BatchRequest r : requests) {
            if (r == null || r.getWidgetId() == null || r.getWidgetId().isBlank()) {
                throw new ChartValidationException("Every batch request needs a widgetId");
            }
        }

        log.info("Running chart batch size={}", requests.size());
        List<CompletableFuture<Outcome>> futures = requests.stream()
                .map(r -> CompletableFuture.supplyAsync(() -> runOne(r), executor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<Outcome> outcomes = futures.stream().map(CompletableFuture::join).toList();

        // the batch only fails as a whole when no request could reach a data source
        boolean allUnreachable = outcomes.stream().allMatch(o -> o.error() instanceof ConnectionNotFoundException);
        if (allUnreachable) {
            throw outcomes.get(0).error();
        }

        long failed = outcomes.stream().filter(o -> o.result().isFailed()).count();
        log.info("Chart batch finished size={} ok={} failed={}", outcomes.size(), outcomes.size() - failed, failed);
        return outcomes.stream().map(Outcome::result).toList();
    }

    private Outcome runOne(BatchRequest request) {
        String widgetId = request.getWidgetId();
        if (request.getConfig() == null) {
            return new Outcome(BatchResult.failure(widgetId, "Missing chart config"), null);
        }
        try {
            return new Outcome(BatchResult.success(widgetId, charts.fetch(request.getConfig())), null);
        } catch (ResponseStatusException e) {
            String reason = e.getReason() != null ? e.getReason() : e.getMessage();
            log.warn("Chart widgetId={} failed status={}: {}", widgetId, e.getStatus().value(), reason);
            return new Outcome(BatchResult.failure(widgetId, reason), e);
        } catch (RuntimeException e) {
            log.error("Chart widgetId={} failed", widgetId, e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new Outcome(BatchResult.failure(widgetId, reason), e);
        }
    }

    private record Outcome(BatchResult result, RuntimeException error) {}
}
