package de.tu_berlin.dos.arm.envsense.core.responses;

import com.google.gson.annotations.SerializedName;
import de.tu_berlin.dos.arm.envsense.utils.JsonUtil;

import java.util.Collections;
import java.util.List;

public class PipelineStatus {

    @SerializedName("data_loaded")
    public final boolean dataLoaded;
    @SerializedName("row_count")
    public final int rowCount;
    public final List<String> columns;
    @SerializedName("model_exists")
    public final boolean modelExists;
    @SerializedName("anomaly_model_exists")
    public final boolean anomalyModelExists;

    public PipelineStatus(boolean dataLoaded, int rowCount, List<String> columns, boolean modelExists, boolean anomalyModelExists) {

        this.dataLoaded = dataLoaded;
        this.rowCount = rowCount;
        this.columns = Collections.unmodifiableList(columns);
        this.modelExists = modelExists;
        this.anomalyModelExists = anomalyModelExists;
    }

    public String toJson() {

        return JsonUtil.toJson(this);
    }
}
