package de.tu_berlin.dos.arm.envsense.core.responses;

import com.google.gson.annotations.SerializedName;
import de.tu_berlin.dos.arm.envsense.utils.JsonUtil;

import java.util.Collections;
import java.util.List;

/**
 * Means over the whole stored series, rounded to two decimals, plus the most recent readings. A mean is
 * null when its sensor has no values.
 */
public class AnalyticsSummary {

    @SerializedName("avg_temperature")
    public final Double avgTemperature;
    @SerializedName("avg_humidity")
    public final Double avgHumidity;
    @SerializedName("avg_battery")
    public final Double avgBattery;
    @SerializedName("recent_readings")
    public final List<ReadingView> recentReadings;

    public AnalyticsSummary(Double avgTemperature, Double avgHumidity, Double avgBattery, List<ReadingView> recentReadings) {

        this.avgTemperature = avgTemperature;
        this.avgHumidity = avgHumidity;
        this.avgBattery = avgBattery;
        this.recentReadings = Collections.unmodifiableList(recentReadings);
    }

    public String toJson() {

        return JsonUtil.toJson(this);
    }
}
