package com.gentoro.knowledge.http;

import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;

public class OkHttpFactory {
  public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
  public static final int DEFAULT_READ_TIMEOUT_SECONDS = 20;

  public static OkHttpClient create() {
    return create(DEFAULT_CONNECT_TIMEOUT_SECONDS, DEFAULT_READ_TIMEOUT_SECONDS, List.of());
  }

  /** Client shared by a connector. Extra interceptors are added after the logging one. */
  public static OkHttpClient create(
      int connectTimeoutSeconds, int readTimeoutSeconds, List<Interceptor> interceptors) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
            .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
            .addInterceptor(new LoggingInterceptor());
    for (Interceptor interceptor : interceptors) {
      builder.addInterceptor(interceptor);
    }
    return builder.build();
  }
}
