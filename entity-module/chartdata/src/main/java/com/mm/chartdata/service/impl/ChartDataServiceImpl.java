package com.mm.chartdata.service.impl;

import com.mm.chartdata.engine.ChartQueryEngine;
import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartResult;
import com.mm.chartdata.model.QueryMode;
import com.mm.chartdata.query.ChartValidationException;
import com.mm.chartdata.service.ChartDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class ChartDataServiceImpl implements ChartDataService {

    private static final Logger log = LoggerFactory.getLogger(ChartDataServiceImpl.class);

    private final Map<QueryMode, ChartQueryEngine> engines = new EnumMap<>(QueryMode.class);

    public ChartDataServiceImpl(List<ChartQueryEngine> engines) {
        for (ChartQueryEngine e : engines) {
            this.engines.put(e.mode(), e);
        }
    }

    @Override
    public ChartResult fetch(ChartDataSource spec) {
        if (spec == null) throw new ChartValidationException("Chart configuration is required");
        QueryMode mode = QueryMode.resolve(spec);
        ChartQueryEngine engine = engines.get(mode);
        if (engine == null) {
            throw new IllegalStateException("No chart engine registered for mode " + mode);
        }

        ChartResult result = engine.run(spec);
        if (!result.getWarnings().isEmpty()) {
            log.warn("Chart fields dropped mode={} table={}: {}", mode, spec.getTable(), result.getWarnings());
        }
        log.debug("Chart fetched mode={} table={} rows={}", mode, spec.getTable(), result.getRows().size());
        return result;
    }
}
