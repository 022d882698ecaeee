package com.medimax.assistant.agent.tools;

import com.medimax.assistant.agent.ArgumentSchema;
import com.medimax.assistant.agent.ArgumentSpec;
import com.medimax.assistant.client.PredictionModel;
import com.medimax.assistant.client.PredictionServiceClient;
import org.springframework.stereotype.Component;

@Component
public class CardiovascularRiskTool extends AbstractPredictionTool {

    public CardiovascularRiskTool(PredictionServiceClient predictionClient) {
        super(predictionClient, PredictionModel.CARDIOVASCULAR);
    }

    @Override
    public String getName() {
        return "predict_cardiovascular_risk";
    }

    @Override
    public String getDescription() {
        return "Predict cardiovascular disease risk from vitals and lifestyle. Returns probability, "
            + "risk category and the main contributing factors.";
    }

    @Override
    public ArgumentSchema getArgumentSchema() {
        return ArgumentSchema.builder()
            .field("age", ArgumentSpec.requiredNumber("Age in years, or in days when above 150", 0, 50_000))
            .field("gender", ArgumentSpec.requiredInteger("1 = female, 2 = male", 1, 2))
            .field("height", ArgumentSpec.requiredNumber("Height in cm", 50, 260))
            .field("weight", ArgumentSpec.requiredNumber("Weight in kg", 10, 400))
            .field("ap_hi", ArgumentSpec.requiredInteger("Systolic blood pressure (mmHg)", 40, 300))
            .field("ap_lo", ArgumentSpec.requiredInteger("Diastolic blood pressure (mmHg)", 20, 200))
            .field("cholesterol", ArgumentSpec.requiredInteger("1 = normal, 2 = above normal, 3 = well above normal", 1, 3))
            .field("gluc", ArgumentSpec.requiredInteger("Glucose: 1 = normal, 2 = above normal, 3 = well above normal", 1, 3))
            .field("smoke", ArgumentSpec.requiredInteger("Smoker: 0 or 1", 0, 1))
            .field("alco", ArgumentSpec.requiredInteger("Alcohol intake: 0 or 1", 0, 1))
            .field("active", ArgumentSpec.requiredInteger("Physically active: 0 or 1", 0, 1))
            .build();
    }
}
