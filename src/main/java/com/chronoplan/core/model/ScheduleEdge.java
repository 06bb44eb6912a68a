package com.chronoplan.core.model;

/**
 * Directed precedence edge: {@code from} must finish before {@code to} can finish.
 */
public record ScheduleEdge(String from, String to) {}
