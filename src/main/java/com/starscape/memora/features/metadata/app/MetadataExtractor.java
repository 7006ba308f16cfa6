package com.starscape.memora.features.metadata.app;

import com.starscape.memora.features.metadata.domain.ExtractionRule;
import com.starscape.memora.features.metadata.domain.LinkMetadata;
import com.starscape.memora.features.metadata.domain.MetadataSource;
import okhttp3.HttpUrl;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static com.starscape.memora.features.metadata.domain.ExtractionRule.attr;
import static com.starscape.memora.features.metadata.domain.ExtractionRule.text;

/**
 * Pure HTML-to-metadata extraction. Has no I/O; the fetch step lives in
 * {@link com.starscape.memora.features.metadata.infra.HttpMetadataResolver}.
 */
@Component
public class MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    public static final int MAX_TITLE_LENGTH = 255;
    public static final int MAX_DESCRIPTION_LENGTH = 1024;

    static final List<ExtractionRule> TITLE_RULES = List.of(
        attr(MetadataSource.OPEN_GRAPH, "meta[property=\"og:title\"]", "content"),
        attr(MetadataSource.NAMED_META, "meta[name=\"og:title\"]", "content"),
        attr(MetadataSource.TWITTER_CARD, "meta[name=\"twitter:title\"]", "content"),
        text(MetadataSource.FALLBACK, "title")
    );

    static final List<ExtractionRule> DESCRIPTION_RULES = List.of(
        attr(MetadataSource.OPEN_GRAPH, "meta[property=\"og:description\"]", "content"),
        attr(MetadataSource.NAMED_META, "meta[name=\"og:description\"]", "content"),
        attr(MetadataSource.TWITTER_CARD, "meta[name=\"twitter:description\"]", "content"),
        attr(MetadataSource.FALLBACK, "meta[name=\"description\"]", "content")
    );

    static final List<ExtractionRule> IMAGE_RULES = List.of(
        attr(MetadataSource.OPEN_GRAPH, "meta[property=\"og:image\"]", "content"),
        attr(MetadataSource.NAMED_META, "meta[name=\"og:image\"]", "content"),
        attr(MetadataSource.TWITTER_CARD, "meta[name=\"twitter:image\"]", "content"),
        attr(MetadataSource.TWITTER_CARD, "meta[name=\"twitter:image:src\"]", "content"),
        attr(MetadataSource.FALLBACK, "meta[itemprop=\"image\"]", "content"),
        attr(MetadataSource.FALLBACK, "link[rel=\"image_src\"]", "href"),
        attr(MetadataSource.FALLBACK, "link[rel=\"icon\"]", "href"),
        attr(MetadataSource.FALLBACK, "link[rel=\"shortcut icon\"]", "href")
    );

    /**
     * Extract title, description and preview image from an HTML document.
     *
     * @param html    raw document
     * @param baseUrl final URL the document was served from, used to absolutize the image
     * @return extracted metadata; fields that cannot be found are null
     */
    public LinkMetadata extract(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return LinkMetadata.empty();
        }

        return extract(Jsoup.parse(html, baseUrl == null ? "" : baseUrl), baseUrl);
    }

    /**
     * Extract from raw response bytes. With a null {@code charsetName} the encoding is
     * detected from a BOM or {@code <meta charset>} in the document, defaulting to UTF-8.
     */
    public LinkMetadata extract(byte[] body, String charsetName, String baseUrl) {
        if (body == null || body.length == 0) {
            return LinkMetadata.empty();
        }
        try {
            return extract(Jsoup.parse(new ByteArrayInputStream(body), charsetName, baseUrl == null ? "" : baseUrl),
                    baseUrl);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode document from " + baseUrl, e);
        }
    }

    private LinkMetadata extract(Document document, String baseUrl) {
        String title = truncate(firstMatch(document, TITLE_RULES), MAX_TITLE_LENGTH);
        String description = truncate(firstMatch(document, DESCRIPTION_RULES), MAX_DESCRIPTION_LENGTH);
        String rawImage = firstMatch(document, IMAGE_RULES);
        String imageUrl = rawImage == null ? null : resolveAgainst(baseUrl, rawImage);

        return new LinkMetadata(title, description, imageUrl);
    }

    private String firstMatch(Document document, List<ExtractionRule> rules) {
        for (ExtractionRule rule : rules) {
            Element element = document.selectFirst(rule.selector());
            if (element == null) {
                continue;
            }
            String value = rule.readsText() ? element.text() : element.attr(rule.attribute());
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    /**
     * Resolve a possibly relative reference to an absolute http(s) URL, percent-encoding
     * characters such as spaces. Returns null when the reference cannot be resolved.
     */
    static String resolveAgainst(String baseUrl, String reference) {
        HttpUrl base = baseUrl == null ? null : HttpUrl.parse(baseUrl);
        HttpUrl resolved = base != null ? base.resolve(reference.trim()) : HttpUrl.parse(reference.trim());
        if (resolved == null) {
            log.debug("Dropping unresolvable image reference '{}' against '{}'", reference, baseUrl);
            return null;
        }
        return resolved.toString();
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
