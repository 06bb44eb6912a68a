package com.chronoplan.core.model;

import java.time.LocalDate;

/**
 * A downstream project affected by a delay.
 */
public record ImpactEntry(
    String projectId,
    String projectName,
    LocalDate originalEndDate,
    LocalDate newEndDate,
    long delayDays
) {}
