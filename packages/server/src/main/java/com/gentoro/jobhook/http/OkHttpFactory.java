package com.gentoro.jobhook.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  private OkHttpFactory() {}

  /**
   * Client for outbound calls. Retries are handled by callers, so OkHttp's own connection-failure
   * retry is disabled and each attempt maps to exactly one request.
   */
  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .writeTimeout(readTimeout)
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
