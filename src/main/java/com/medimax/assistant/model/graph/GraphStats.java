package com.medimax.assistant.model.graph;

public record GraphStats(long patientId, long nodeCount, long edgeCount) {
}
