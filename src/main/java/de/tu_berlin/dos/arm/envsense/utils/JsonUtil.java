package de.tu_berlin.dos.arm.envsense.utils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;

import java.time.LocalDateTime;

public interface JsonUtil {

    // nulls stay visible to consumers, a missing sensor is not a zero
    Gson GSON =
        new GsonBuilder()
            .serializeNulls()
            .registerTypeAdapter(LocalDateTime.class,
                (JsonSerializer<LocalDateTime>) (src, type, ctx) -> new JsonPrimitive(DateUtil.format(src)))
            .create();

    static String toJson(Object value) {

        return GSON.toJson(value);
    }
}
