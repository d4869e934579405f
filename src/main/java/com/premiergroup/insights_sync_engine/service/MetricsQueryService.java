package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.CanonicalMetrics;
import com.premiergroup.insights_sync_engine.dto.PeriodComparison;
import com.premiergroup.insights_sync_engine.dto.PeriodRange;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import com.premiergroup.insights_sync_engine.enums.DateFilter;
import com.premiergroup.insights_sync_engine.repository.DailyMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read side used by the dashboard endpoints.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class MetricsQueryService {

    private final DailyMetricRepository dailyMetricRepository;
    private final AggregationService aggregationService;
    private final Clock clock;

    public Optional<CanonicalMetrics> getDailyMetrics(String entityId, LocalDate date) {
        return dailyMetricRepository.findByEntityIdAndStatsDate(entityId, date)
                .map(d -> d.getMetrics().toCanonical());
    }

    public CanonicalMetrics getAggregate(String entityId, DateFilter dateRange, String startDate, String endDate) {
        PeriodRange period = resolve(dateRange, startDate, endDate);
        return aggregationService.getAggregate(entityId, period.start(), period.end());
    }

    /**
     * Current period against the equally long period right before it.
     */
    public PeriodComparison compareWithPreviousPeriod(
            String entityId,
            DateFilter dateRange,
            String startDate,
            String endDate
    ) {
        PeriodRange current = resolve(dateRange, startDate, endDate);
        PeriodRange previous = current.previous();

        CanonicalMetrics curr = aggregationService.aggregate(entityId, current.start(), current.end());
        CanonicalMetrics prev = aggregationService.aggregate(entityId, previous.start(), previous.end());

        Map<String, BigDecimal> changes = new LinkedHashMap<>();
        changes.put("spend", percentChange(curr.spend(), prev.spend()));
        changes.put("impressions", percentChange(BigDecimal.valueOf(curr.impressions()), BigDecimal.valueOf(prev.impressions())));
        changes.put("clicks", percentChange(BigDecimal.valueOf(curr.clicks()), BigDecimal.valueOf(prev.clicks())));
        changes.put("conversions", percentChange(
                BigDecimal.valueOf(curr.conversion(AttributionWindow.DEFAULT).count()),
                BigDecimal.valueOf(prev.conversion(AttributionWindow.DEFAULT).count())));
        changes.put("ctr", percentChange(curr.ctr(), prev.ctr()));
        changes.put("cpc", percentChange(curr.cpc(), prev.cpc()));
        changes.put("costPerConversion", percentChange(curr.costPerConversion(), prev.costPerConversion()));
        changes.put("roas", percentChange(curr.roas(AttributionWindow.DEFAULT), prev.roas(AttributionWindow.DEFAULT)));

        return new PeriodComparison(entityId, current, previous, curr, prev, changes);
    }

    private PeriodRange resolve(DateFilter dateRange, String startDate, String endDate) {
        LocalDate start = null;
        LocalDate end = null;
        if (dateRange == DateFilter.CUSTOM) {
            try {
                start = startDate == null ? null : LocalDate.parse(startDate);
                end = endDate == null ? null : LocalDate.parse(endDate);
            } catch (DateTimeParseException e) {
                log.error("Invalid date format for custom date range: {} to {}", startDate, endDate, e);
                throw new IllegalArgumentException("Invalid date format for custom date range");
            }
        }
        return dateRange.resolve(LocalDate.now(clock), start, end);
    }

    private BigDecimal percentChange(BigDecimal curr, BigDecimal prev) {
        if (prev.compareTo(BigDecimal.ZERO) == 0) {
            return curr.compareTo(BigDecimal.ZERO) == 0
                    ? BigDecimal.ZERO
                    : BigDecimal.valueOf(100);
        }
        return curr
                .subtract(prev)
                .divide(prev, 4, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100));
    }
}
