package com.gs.ep.pagetranslator.model.translation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

public class LibreTranslateProvider extends HttpTranslationProvider {

    public static final String NAME = "libre";

    private static final MediaType JSON = MediaType.parse("application/json");

    private final String url;
    private final String apiKey;
    private final String sourceCode;
    private final String targetCode;

    public LibreTranslateProvider(String baseUrl, String apiKey, String sourceCode, String targetCode,
                                  int timeoutSeconds) {
        super(timeoutSeconds);
        this.url = translateUrl(baseUrl);
        this.apiKey = apiKey;
        this.sourceCode = sourceCode;
        this.targetCode = targetCode;
    }

    LibreTranslateProvider(OkHttpClient httpClient, String baseUrl, String apiKey, String sourceCode,
                           String targetCode) {
        super(httpClient);
        this.url = translateUrl(baseUrl);
        this.apiKey = apiKey;
        this.sourceCode = sourceCode;
        this.targetCode = targetCode;
    }

    static String translateUrl(String baseUrl) {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return trimmed.endsWith("/translate") ? trimmed : trimmed + "/translate";
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Request buildRequest(String text) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("q", text);
        body.put("source", sourceCode);
        body.put("target", targetCode);
        body.put("format", "text");
        if (apiKey != null && !apiKey.isEmpty()) {
            body.put("api_key", apiKey);
        }
        return new Request.Builder()
                .url(url)
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                .build();
    }

    @Override
    protected String parseResponse(String sourceText, JsonNode root) {
        JsonNode translated = root.path("translatedText");
        return translated.isTextual() ? translated.asText() : null;
    }
}
