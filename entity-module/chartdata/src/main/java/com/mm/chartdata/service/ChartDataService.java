package com.mm.chartdata.service;

import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartResult;

public interface ChartDataService {
    ChartResult fetch(ChartDataSource spec);
}
