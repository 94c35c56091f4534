package com.sensorwatch.processor.batch;

import com.sensorwatch.processor.model.GroupedBatch;
import com.sensorwatch.processor.model.StoredEvent;
import com.sensorwatch.processor.model.SummaryWindow;
import com.sensorwatch.processor.store.RedisAnomalyEventStore;
import com.sensorwatch.processor.store.RedisSummaryStore;
import com.sensorwatch.processor.summary.SummaryGenerationException;
import com.sensorwatch.processor.summary.SummaryGenerator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic summarization of the unprocessed anomaly backlog.
 *
 * <p>One tick reads the backlog, asks the summary generator for a paragraph, stores it and only
 * then marks the records processed. A failed tick leaves the backlog untouched for the next one.
 * Ticks never overlap.
 */
@Component
public class SummaryBatchJob {
  private static final Logger log = LoggerFactory.getLogger(SummaryBatchJob.class);

  private final RedisAnomalyEventStore eventStore;
  private final RedisSummaryStore summaryStore;
  private final AnomalyGrouper grouper;
  private final SummaryGenerator summaryGenerator;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final AtomicLong lastBatchSize = new AtomicLong(0);
  private final Counter tickCounter;
  private final Counter summaryCounter;
  private final Counter recordsCounter;
  private final Counter skippedCounter;
  private final Counter summaryErrorCounter;
  private final Counter errorCounter;
  private final Timer tickTimer;

  public SummaryBatchJob(
      RedisAnomalyEventStore eventStore,
      RedisSummaryStore summaryStore,
      AnomalyGrouper grouper,
      SummaryGenerator summaryGenerator,
      MeterRegistry meterRegistry) {
    this.eventStore = eventStore;
    this.summaryStore = summaryStore;
    this.grouper = grouper;
    this.summaryGenerator = summaryGenerator;
    this.tickCounter = meterRegistry.counter("processor.batch.ticks.total");
    this.summaryCounter = meterRegistry.counter("processor.batch.summaries.total");
    this.recordsCounter = meterRegistry.counter("processor.batch.records.processed.total");
    this.skippedCounter = meterRegistry.counter("processor.batch.ticks.skipped.total");
    this.summaryErrorCounter = meterRegistry.counter("processor.batch.summary.errors.total");
    this.errorCounter = meterRegistry.counter("processor.batch.errors.total");
    this.tickTimer = meterRegistry.timer("processor.batch.tick.duration");
    meterRegistry.gauge("processor.batch.last.size", lastBatchSize);
  }

  @Scheduled(
      fixedDelayString = "${processor.batch.interval-ms:30000}",
      initialDelayString = "${processor.batch.interval-ms:30000}")
  public void summarize() {
    if (shuttingDown.get()) {
      return;
    }
    if (!running.compareAndSet(false, true)) {
      skippedCounter.increment();
      log.debug("Previous summary tick still running, skipping");
      return;
    }
    tickCounter.increment();
    Timer.Sample sample = Timer.start();
    try {
      runTick();
    } catch (SummaryGenerationException ex) {
      summaryErrorCounter.increment();
      log.warn("Summary generation failed, backlog kept for next tick: {}", ex.getMessage());
    } catch (Exception ex) {
      // Keep the scheduler running even if a tick fails.
      errorCounter.increment();
      log.error("Summary tick failed", ex);
    } finally {
      sample.stop(tickTimer);
      running.set(false);
    }
  }

  /** Stops accepting new ticks; a tick already in flight runs to completion. */
  @PreDestroy
  public void stop() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Summary batch job stopping");
    }
  }

  boolean isRunning() {
    return running.get();
  }

  private void runTick() {
    List<StoredEvent> batch = eventStore.findUnprocessedAnomalies();
    lastBatchSize.set(batch.size());
    if (batch.isEmpty()) {
      log.debug("No unprocessed anomalies");
      return;
    }

    GroupedBatch grouped = grouper.group(batch);
    Instant windowStart = Instant.ofEpochMilli(batch.get(0).timestamp());
    Instant windowEnd = Instant.ofEpochMilli(batch.get(batch.size() - 1).timestamp());

    String summary = summaryGenerator.generate(grouped);
    String summaryId = summaryStore.add(new SummaryWindow(windowStart, windowEnd, batch.size(), summary));
    summaryCounter.increment();

    eventStore.markProcessed(batch);
    recordsCounter.increment(batch.size());
    log.info(
        "Summarized {} anomaly records from {} sensors into {} ({} .. {})",
        batch.size(),
        grouped.anomaliesBySensor().size(),
        summaryId,
        windowStart,
        windowEnd);
  }
}
