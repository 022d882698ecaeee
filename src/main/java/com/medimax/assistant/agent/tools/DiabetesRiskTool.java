package com.medimax.assistant.agent.tools;

import com.medimax.assistant.agent.ArgumentSchema;
import com.medimax.assistant.agent.ArgumentSpec;
import com.medimax.assistant.client.PredictionModel;
import com.medimax.assistant.client.PredictionServiceClient;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DiabetesRiskTool extends AbstractPredictionTool {

    static final List<String> SMOKING_HISTORY = List.of("never", "No Info", "current", "former", "ever", "not current");

    public DiabetesRiskTool(PredictionServiceClient predictionClient) {
        super(predictionClient, PredictionModel.DIABETES);
    }

    @Override
    public String getName() {
        return "predict_diabetes_risk";
    }

    @Override
    public String getDescription() {
        return "Predict diabetes risk from demographics, history and blood markers. Returns probability "
            + "and risk category.";
    }

    @Override
    public ArgumentSchema getArgumentSchema() {
        return ArgumentSchema.builder()
            .field("age", ArgumentSpec.requiredNumber("Age in years", 0, 120))
            .field("gender", ArgumentSpec.requiredChoice("Gender", List.of("Female", "Male", "Other")))
            .field("hypertension", ArgumentSpec.requiredInteger("Hypertension: 0 or 1", 0, 1))
            .field("heart_disease", ArgumentSpec.requiredInteger("Heart disease: 0 or 1", 0, 1))
            .field("smoking_history", ArgumentSpec.requiredChoice("Smoking history", SMOKING_HISTORY))
            .field("bmi", ArgumentSpec.requiredNumber("Body mass index", 0, 100))
            .field("HbA1c_level", ArgumentSpec.requiredNumber("HbA1c (%)", 0, 20))
            .field("blood_glucose_level", ArgumentSpec.requiredInteger("Blood glucose (mg/dL)", 0, 1000))
            .build();
    }
}
