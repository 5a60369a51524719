package com.gs.ep.pagetranslator.model.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Shared plumbing for providers reached over HTTP: one {@link OkHttpClient} per provider, JSON
 * bodies through Jackson and the mapping of transport and HTTP failures onto {@link ProviderError}.
 */
public abstract class HttpTranslationProvider implements TranslationProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTranslationProvider.class);

    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected HttpTranslationProvider(int timeoutSeconds) {
        this(new OkHttpClient.Builder()
                .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build());
    }

    protected HttpTranslationProvider(OkHttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public ProviderResult translate(String text) {
        Request request;
        try {
            request = buildRequest(text);
        } catch (IOException | IllegalArgumentException e) {
            return ProviderResult.failure(ProviderError.fatal(name(), "Cannot build request: " + e.getMessage(), e));
        }
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                return ProviderResult.failure(httpError(response.code(), payload));
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(payload);
            } catch (IOException e) {
                return ProviderResult.failure(ProviderError.fatal(name(), "Unparseable response body", e));
            }
            String translated = parseResponse(text, root);
            if (translated == null) {
                return ProviderResult.failure(ProviderError.fatal(name(), "Response carries no translation", null));
            }
            return ProviderResult.success(translated, name());
        } catch (IOException e) {
            LOGGER.debug("{} call failed: {}", name(), e.toString());
            return ProviderResult.failure(ProviderError.transientError(name(), e.toString(), e));
        }
    }

    ProviderError httpError(int code, String payload) {
        String message = "HTTP " + code + ": " + abbreviate(payload);
        if (code == 429 || code >= 500) {
            return ProviderError.transientError(name(), message, null);
        }
        return ProviderError.fatal(name(), message, null);
    }

    protected abstract Request buildRequest(String text) throws IOException;

    /**
     * @return translated text, or {@code null} when the body has no usable translation
     */
    protected abstract String parseResponse(String sourceText, JsonNode root);

    static String abbreviate(String payload) {
        if (payload == null) {
            return "";
        }
        return payload.length() > 200 ? payload.substring(0, 200) + "..." : payload;
    }
}
