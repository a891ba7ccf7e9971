package com.acme.orchestrator.repository;

/** Duration statistics for one activity over a query window, in milliseconds. */
public record ActivityStats(
    String activity, long count, double avgMs, long maxMs, long minMs) {}
