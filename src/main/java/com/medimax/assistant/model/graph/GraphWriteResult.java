package com.medimax.assistant.model.graph;

public record GraphWriteResult(long patientId, int nodesWritten, int edgesWritten) {
}
