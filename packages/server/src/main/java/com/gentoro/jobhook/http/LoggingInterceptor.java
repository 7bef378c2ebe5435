package com.gentoro.jobhook.http;

import com.gentoro.jobhook.signature.SignatureCodec;
import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Logs every outbound call with its status and latency. Header values that carry credentials are
 * shortened before they reach the log.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "➡️ Sending {} {} (signature={}, authorization={})",
          request.method(),
          request.url(),
          mask(request.header(SignatureCodec.HEADER)),
          mask(request.header("Authorization")));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsed(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    log.debug(
        "⬅️ Received {} for {} {} in {} ms",
        response.code(),
        request.method(),
        request.url(),
        elapsed(startTime));
    return response;
  }

  private static long elapsed(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  static String mask(String value) {
    if (value == null) return "-";
    return value.length() <= 12 ? "***" : value.substring(0, 12) + "***";
  }
}
