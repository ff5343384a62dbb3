package ca.gc.cra.helio.infrastructure.source;

import ca.gc.cra.helio.application.port.ChannelSourcePort;
import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.FetchedImage;
import ca.gc.cra.helio.domain.acquire.TransportException;
import ca.gc.cra.helio.domain.time.CaptureTimestamps;
import ca.gc.cra.helio.validation.Strings;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ChannelSourcePort} that issues one HTTP GET per channel against an image archive.
 * <p><strong>Why:</strong> The archive (Helioviewer by default) returns the image nearest the requested instant and
 * names the file after its true capture time in {@code Content-Disposition}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; the shared {@link OkHttpClient} pools connections across a
 * wave.</p>
 *
 * <p>The URL template must contain {@code {date}} (replaced with {@code yyyy-MM-ddTHH:mm:ssZ}) and
 * {@code {sourceId}} (replaced with the channel id).</p>
 *
 * @since 0.1.0
 */
public final class OkHttpChannelSource implements ChannelSourcePort {
  private static final Logger log = LoggerFactory.getLogger(OkHttpChannelSource.class);

  private final String urlTemplate;
  private final OkHttpClient client;

  /**
   * Creates a source with its own client.
   *
   * @param urlTemplate URL template with {@code {date}} and {@code {sourceId}} placeholders
   * @param connectTimeout connect timeout
   * @param readTimeout read timeout
   */
  public OkHttpChannelSource(String urlTemplate, Duration connectTimeout, Duration readTimeout) {
    this(urlTemplate, new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .addInterceptor(new TimingInterceptor())
        .build());
  }

  OkHttpChannelSource(String urlTemplate, OkHttpClient client) {
    this.urlTemplate = Strings.requireTemplate("sourceUrl", urlTemplate, "{date}", "{sourceId}");
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public FetchedImage fetch(ChannelRequest request) throws TransportException {
    int channelId = request.channelId();
    HttpUrl url = resolve(request);
    Request httpRequest = new Request.Builder().url(url).get().build();
    try (Response response = client.newCall(httpRequest).execute()) {
      if (!response.isSuccessful()) {
        throw new TransportException(channelId, "HTTP " + response.code() + " from " + url.host());
      }
      ResponseBody body = response.body();
      byte[] bytes = body == null ? new byte[0] : body.bytes();
      if (bytes.length == 0) {
        throw new TransportException(channelId, "empty response body from " + url.host());
      }
      Optional<String> filename = filenameFrom(response.header("Content-Disposition"));
      return new FetchedImage(channelId, bytes, filename);
    } catch (IOException ex) {
      throw new TransportException(channelId, "request to " + url.host() + " failed: " + ex.getMessage(), ex);
    }
  }

  HttpUrl resolve(ChannelRequest request) throws TransportException {
    String date = URLEncoder.encode(CaptureTimestamps.formatQuery(request.nominalTimestamp()), StandardCharsets.UTF_8);
    String raw = urlTemplate
        .replace("{date}", date)
        .replace("{sourceId}", Integer.toString(request.channelId()));
    HttpUrl url = HttpUrl.parse(raw);
    if (url == null) {
      throw new TransportException(request.channelId(), "invalid source URL: " + raw);
    }
    return url;
  }

  /**
   * Extracts the filename parameter of a {@code Content-Disposition} header.
   *
   * <p>Prefers the RFC 5987 {@code filename*} form; strips quotes and percent-decodes. A literal {@code +} is kept
   * as-is.</p>
   *
   * @param header header value, possibly {@code null}
   * @return decoded filename, or empty when absent
   */
  static Optional<String> filenameFrom(String header) {
    if (header == null || header.isBlank()) {
      return Optional.empty();
    }
    String plain = null;
    String extended = null;
    for (String part : header.split(";")) {
      String token = part.trim();
      int eq = token.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      String name = token.substring(0, eq).trim().toLowerCase(Locale.ROOT);
      String value = token.substring(eq + 1).trim();
      if (name.equals("filename*")) {
        int quote = value.indexOf("''");
        extended = quote >= 0 ? value.substring(quote + 2) : value;
      } else if (name.equals("filename")) {
        plain = value;
      }
    }
    String chosen = extended != null ? extended : plain;
    if (chosen == null) {
      return Optional.empty();
    }
    chosen = unquote(chosen);
    try {
      chosen = URLDecoder.decode(chosen.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      log.debug("Content-Disposition filename '{}' is not percent-encoded; using it verbatim", chosen);
    }
    return chosen.isBlank() ? Optional.empty() : Optional.of(chosen);
  }

  private static String unquote(String value) {
    String trimmed = value.trim();
    if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
      return trimmed.substring(1, trimmed.length() - 1);
    }
    return trimmed;
  }
}
