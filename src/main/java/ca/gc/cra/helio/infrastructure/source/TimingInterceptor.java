package ca.gc.cra.helio.infrastructure.source;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each archive request with its status and duration at DEBUG, and failures at WARN.
 */
final class TimingInterceptor implements Interceptor {
  private static final Logger log = LoggerFactory.getLogger(TimingInterceptor.class);

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long start = System.nanoTime();
    log.debug("GET {}", request.url());
    try {
      Response response = chain.proceed(request);
      log.debug("HTTP {} from {} in {} ms", response.code(), request.url().host(), elapsedMillis(start));
      return response;
    } catch (IOException ex) {
      log.warn("GET {} failed after {} ms: {}", request.url(), elapsedMillis(start), ex.toString());
      throw ex;
    }
  }

  private static long elapsedMillis(long start) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
  }
}
