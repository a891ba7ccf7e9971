package com.acme.orchestrator.repository;

/** Number of persisted errors sharing one grouping hash, with a sample message. */
public record ErrorFrequency(String errorHash, String sampleMessage, long frequency) {}
