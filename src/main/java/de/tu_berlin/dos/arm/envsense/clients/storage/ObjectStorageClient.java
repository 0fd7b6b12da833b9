package de.tu_berlin.dos.arm.envsense.clients.storage;

import de.tu_berlin.dos.arm.envsense.clients.BatchSource;
import de.tu_berlin.dos.arm.envsense.clients.TransportException;
import okhttp3.OkHttpClient;
import okhttp3.ResponseBody;
import org.apache.log4j.Logger;
import retrofit2.Response;
import retrofit2.Retrofit;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Downloads the batch object from an S3-style HTTP endpoint ({@code baseUrl/bucket/key}). Requests are
 * anonymous and carry no signature, so the bucket must allow public reads; a private bucket answers with
 * 403 and the fetch fails.
 */
public class ObjectStorageClient implements BatchSource {

    private static final Logger LOG = Logger.getLogger(ObjectStorageClient.class);

    public final String baseUrl;
    public final String bucket;
    public final String objectKey;
    public final ObjectStorageRest service;

    public ObjectStorageClient(String baseUrl, String bucket, String objectKey, int connectTimeoutSeconds, int readTimeoutSeconds) {

        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.bucket = bucket;
        this.objectKey = objectKey;
        OkHttpClient okHttpClient = new OkHttpClient.Builder()
            .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
            .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
            .build();
        Retrofit retrofit =
            new Retrofit.Builder()
                .baseUrl(this.baseUrl)
                .client(okHttpClient)
                .build();

        this.service = retrofit.create(ObjectStorageRest.class);
    }

    @Override
    public byte[] fetch() throws TransportException {

        Response<ResponseBody> response;
        try {
            response = this.service.getObject(this.bucket, this.objectKey).execute();
        }
        catch (IOException e) {

            throw new TransportException("Request for " + this.bucket + "/" + this.objectKey + " failed", e);
        }
        if (!response.isSuccessful()) {

            if (response.errorBody() != null) response.errorBody().close();
            throw new TransportException("Request for " + this.bucket + "/" + this.objectKey + " returned HTTP " + response.code());
        }
        try (ResponseBody body = response.body()) {

            if (body == null) throw new TransportException("Empty response for " + this.bucket + "/" + this.objectKey);
            byte[] bytes = body.bytes();
            LOG.info("Downloaded " + bytes.length + " bytes from " + this.baseUrl + this.bucket + "/" + this.objectKey);
            return bytes;
        }
        catch (IOException e) {

            throw new TransportException("Reading body of " + this.bucket + "/" + this.objectKey + " failed", e);
        }
    }
}
