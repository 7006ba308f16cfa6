package com.starscape.memora.features.metadata.infra;

import com.starscape.memora.common.config.MetadataProperties;
import com.starscape.memora.features.metadata.app.MetadataExtractor;
import com.starscape.memora.features.metadata.app.MetadataResolver;
import com.starscape.memora.features.metadata.domain.LinkMetadata;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Locale;

/**
 * Fetches a bookmarked page with a bounded timeout and hands the HTML to
 * {@link MetadataExtractor}. Any network, status, content-type or parse
 * failure degrades to {@link LinkMetadata#empty()}.
 */
@Service
public class HttpMetadataResolver implements MetadataResolver {

    private static final Logger log = LoggerFactory.getLogger(HttpMetadataResolver.class);

    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,"
            + "image/avif,image/webp,*/*;q=0.8";

    private final OkHttpClient httpClient;
    private final MetadataExtractor extractor;
    private final MetadataProperties properties;

    public HttpMetadataResolver(
            OkHttpClient metadataHttpClient,
            MetadataExtractor extractor,
            MetadataProperties properties) {
        this.httpClient = metadataHttpClient;
        this.extractor = extractor;
        this.properties = properties;
    }

    @Override
    public LinkMetadata resolve(String url) {
        HttpUrl target = url == null ? null : HttpUrl.parse(url.trim());
        if (target == null) {
            log.debug("Skipping metadata fetch for non-http URL: {}", url);
            return LinkMetadata.empty();
        }

        Request request = new Request.Builder()
                .url(target)
                .get()
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", ACCEPT)
                .header("Accept-Language", "en")
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.debug("Metadata fetch for {} returned HTTP {}", url, response.code());
                return LinkMetadata.empty();
            }

            String contentType = response.header("Content-Type", "");
            if (!contentType.toLowerCase(Locale.ROOT).contains("html")) {
                log.debug("Metadata fetch for {} returned non-HTML content: {}", url, contentType);
                return LinkMetadata.empty();
            }

            ResponseBody body = response.body();
            if (body == null) {
                return LinkMetadata.empty();
            }

            byte[] bytes = readBounded(body);
            // Resolve relative references against where we ended up after redirects
            String finalUrl = response.request().url().toString();
            return extractor.extract(bytes, declaredCharset(body), finalUrl);
        } catch (IOException e) {
            log.warn("Metadata fetch failed for {}: {}", url, e.getMessage());
            return LinkMetadata.empty();
        } catch (RuntimeException e) {
            log.warn("Metadata extraction failed for {}", url, e);
            return LinkMetadata.empty();
        }
    }

    private byte[] readBounded(ResponseBody body) throws IOException {
        int limit = (int) Math.min(Integer.MAX_VALUE - 8, properties.getMaxBodyBytes());
        try (InputStream in = body.byteStream()) {
            return in.readNBytes(limit);
        }
    }

    /**
     * Charset from the Content-Type header, or null to let the parser detect it from the document.
     */
    private static String declaredCharset(ResponseBody body) {
        MediaType mediaType = body.contentType();
        Charset charset = mediaType == null ? null : mediaType.charset();
        return charset == null ? null : charset.name();
    }
}
