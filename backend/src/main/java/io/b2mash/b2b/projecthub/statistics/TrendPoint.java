package io.b2mash.b2b.projecthub.statistics;

import java.time.LocalDate;

/** Completion rate, in percent, of the items that existed at the end of {@code date}. */
public record TrendPoint(LocalDate date, double completionRate) {}
