package com.gs.ep.pagetranslator.model.translation;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

/**
 * The public Google web translate endpoint ({@code client=gtx}). Languages are addressed by
 * code; some targets answer under a regional code, so one instance is created per convention.
 */
public class GoogleWebProvider extends HttpTranslationProvider {

    public static final String DEFAULT_URL = "https://translate.googleapis.com/translate_a/single";

    private final HttpUrl endpoint;
    private final String sourceCode;
    private final String targetCode;

    public GoogleWebProvider(String url, String sourceCode, String targetCode, int timeoutSeconds) {
        super(timeoutSeconds);
        this.endpoint = parseUrl(url);
        this.sourceCode = sourceCode;
        this.targetCode = targetCode;
    }

    GoogleWebProvider(OkHttpClient httpClient, String url, String sourceCode, String targetCode) {
        super(httpClient);
        this.endpoint = parseUrl(url);
        this.sourceCode = sourceCode;
        this.targetCode = targetCode;
    }

    private static HttpUrl parseUrl(String url) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Google translate URL: " + url);
        }
        return parsed;
    }

    @Override
    public String name() {
        return "google:" + targetCode;
    }

    @Override
    protected Request buildRequest(String text) {
        HttpUrl url = endpoint.newBuilder()
                .addQueryParameter("client", "gtx")
                .addQueryParameter("sl", sourceCode)
                .addQueryParameter("tl", targetCode)
                .addQueryParameter("dt", "t")
                .addQueryParameter("q", text)
                .build();
        return new Request.Builder().url(url).get().build();
    }

    /**
     * The body is a nested array whose first element lists {@code [translated, source, ...]}
     * segments; the translation is their concatenation.
     */
    @Override
    protected String parseResponse(String sourceText, JsonNode root) {
        JsonNode segments = root.path(0);
        if (!segments.isArray()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode segment : segments) {
            JsonNode translated = segment.path(0);
            if (translated.isTextual()) {
                sb.append(translated.asText());
            }
        }
        return sb.toString();
    }
}
