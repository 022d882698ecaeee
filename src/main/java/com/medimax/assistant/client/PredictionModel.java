package com.medimax.assistant.client;

public enum PredictionModel {
    CARDIOVASCULAR("cardiovascularModel"),
    DIABETES("diabetesModel");

    private final String healthKey;

    PredictionModel(String healthKey) {
        this.healthKey = healthKey;
    }

    /**
     * Name used in the health report.
     */
    public String healthKey() {
        return healthKey;
    }
}
