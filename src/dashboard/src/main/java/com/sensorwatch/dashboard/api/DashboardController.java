package com.sensorwatch.dashboard.api;

import com.sensorwatch.dashboard.model.AnomalyListResponse;
import com.sensorwatch.dashboard.model.SummaryListResponse;
import com.sensorwatch.dashboard.service.AnomalyQueryService;
import com.sensorwatch.dashboard.service.SummaryQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only endpoints for recent anomalies and incident summaries.
 *
 * <ul>
 *   <li>{@code GET /api/anomalies?duration=<seconds>}</li>
 *   <li>{@code GET /api/summaries?limit=<n>}</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class DashboardController {
  private final AnomalyQueryService anomalyQueryService;
  private final SummaryQueryService summaryQueryService;

  public DashboardController(
      AnomalyQueryService anomalyQueryService, SummaryQueryService summaryQueryService) {
    this.anomalyQueryService = anomalyQueryService;
    this.summaryQueryService = summaryQueryService;
  }

  /**
   * Lists anomaly-bearing events, newest first.
   *
   * @param duration optional trailing window in seconds
   */
  @GetMapping("/anomalies")
  public AnomalyListResponse listAnomalies(
      @RequestParam(value = "duration", required = false) String duration) {
    return anomalyQueryService.listRecent(duration);
  }

  /**
   * Lists the latest summaries, newest window first.
   *
   * @param limit optional max number of summaries (default 10)
   */
  @GetMapping("/summaries")
  public SummaryListResponse listSummaries(
      @RequestParam(value = "limit", required = false) String limit) {
    return summaryQueryService.listRecent(limit);
  }
}
