package de.tu_berlin.dos.arm.envsense.core.responses;

import com.google.gson.annotations.SerializedName;
import de.tu_berlin.dos.arm.envsense.io.Reading;

public class AnomalyRecord extends ReadingView {

    @SerializedName("anomaly_score")
    public final double anomalyScore;

    public AnomalyRecord(Reading reading, double anomalyScore) {

        super(reading);
        this.anomalyScore = anomalyScore;
    }
}
