package de.tu_berlin.dos.arm.envsense.clients.storage;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;

public interface ObjectStorageRest {

    @GET("{bucket}/{key}")
    Call<ResponseBody> getObject(
        @Path("bucket") String bucket,
        @Path(value = "key", encoded = true) String key
    );
}
