package nl.adgroot.pdftojpeg.fetch;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

import nl.adgroot.pdftojpeg.config.AppConfig;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OkHttpRemoteFetcher implements RemoteFetcher {

  private static final Logger LOG = LoggerFactory.getLogger(OkHttpRemoteFetcher.class);

  private final OkHttpClient http;
  private final long maxBytes;

  public OkHttpRemoteFetcher(AppConfig.FetchConfig cfg) {
    Duration t = Duration.ofSeconds(cfg.timeoutSeconds);

    this.http = new OkHttpClient.Builder()
        .connectTimeout(t)
        .readTimeout(t)
        .writeTimeout(t)
        .callTimeout(t)
        .followRedirects(true)
        .build();
    this.maxBytes = cfg.maxBytes;
  }

  /** Blocking GET; callers run it on a worker thread. */
  @Override
  public byte[] fetch(String url) throws FetchException {
    HttpUrl httpUrl = HttpUrl.parse(url);
    if (httpUrl == null) {
      throw new FetchException("Not an http(s) URL: " + url);
    }

    Request request = new Request.Builder().url(httpUrl).get().build();
    long startNs = System.nanoTime();

    try (Response r = http.newCall(request).execute()) {
      if (!r.isSuccessful()) {
        throw new FetchException("GET " + httpUrl.redact() + " failed: " + r.code() + " " + r.message());
      }

      ResponseBody body = r.body();
      if (body == null) {
        throw new FetchException("GET " + httpUrl.redact() + " returned no body");
      }
      long declared = body.contentLength();
      if (declared > maxBytes) {
        throw new FetchException("GET " + httpUrl.redact() + " body of " + declared
            + " bytes exceeds limit of " + maxBytes);
      }

      // chunked bodies declare no length; buffer at most one byte past the limit
      BufferedSource source = body.source();
      if (source.request(maxBytes + 1)) {
        throw new FetchException("GET " + httpUrl.redact() + " body exceeds limit of " + maxBytes);
      }
      byte[] bytes = source.readByteArray();

      LOG.debug("Fetched {} bytes from {} in {}ms", bytes.length, httpUrl.redact(),
          (System.nanoTime() - startNs) / 1_000_000);
      return bytes;
    } catch (InterruptedIOException e) {
      throw new FetchException("GET " + httpUrl.redact() + " timed out", e);
    } catch (IOException e) {
      throw new FetchException("GET " + httpUrl.redact() + " failed: " + e.getMessage(), e);
    }
  }
}
