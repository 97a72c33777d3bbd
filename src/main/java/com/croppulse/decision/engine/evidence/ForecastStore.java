package com.croppulse.decision.engine.evidence;

import com.croppulse.decision.model.ForecastDay;

import java.time.LocalDate;
import java.util.List;

public interface ForecastStore {

    /** Daily forecast for the farm's location starting at {@code from}, ordered by date. */
    List<ForecastDay> findForecast(String farmId, LocalDate from);
}
