package de.tu_berlin.dos.arm.envsense.core.responses;

import com.google.gson.annotations.SerializedName;
import de.tu_berlin.dos.arm.envsense.io.Reading;
import de.tu_berlin.dos.arm.envsense.utils.JsonUtil;

import java.time.LocalDateTime;

/**
 * A reading as exposed to clients, keyed by the canonical column names. Absent sensors serialize as null.
 */
public class ReadingView {

    public final LocalDateTime time;
    @SerializedName("Battery")
    public final Double battery;
    @SerializedName("Humidity")
    public final Double humidity;
    @SerializedName("Motion")
    public final Double motion;
    @SerializedName("Temperature")
    public final Double temperature;

    public ReadingView(Reading reading) {

        this.time = reading.time;
        this.battery = reading.battery;
        this.humidity = reading.humidity;
        this.motion = reading.motion;
        this.temperature = reading.temperature;
    }

    public String toJson() {

        return JsonUtil.toJson(this);
    }
}
