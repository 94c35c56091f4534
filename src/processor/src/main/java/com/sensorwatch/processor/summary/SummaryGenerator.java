package com.sensorwatch.processor.summary;

import com.sensorwatch.processor.model.GroupedBatch;

/** Turns a grouped anomaly batch into a short human-readable incident summary. */
public interface SummaryGenerator {
  /**
   * @throws SummaryGenerationException when no usable text could be produced
   */
  String generate(GroupedBatch batch);
}
