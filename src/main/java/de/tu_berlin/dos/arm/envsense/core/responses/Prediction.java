package de.tu_berlin.dos.arm.envsense.core.responses;

import com.google.gson.annotations.SerializedName;
import de.tu_berlin.dos.arm.envsense.utils.JsonUtil;

/**
 * Next-step temperature, or null when no usable model exists yet.
 */
public class Prediction {

    @SerializedName("predicted_next_temperature")
    public final Double predictedNextTemperature;

    private Prediction(Double predictedNextTemperature) {

        this.predictedNextTemperature = predictedNextTemperature;
    }

    public static Prediction of(double value) {

        return new Prediction(value);
    }

    public static Prediction unavailable() {

        return new Prediction(null);
    }

    public boolean isAvailable() {

        return predictedNextTemperature != null;
    }

    public String toJson() {

        return JsonUtil.toJson(this);
    }
}
