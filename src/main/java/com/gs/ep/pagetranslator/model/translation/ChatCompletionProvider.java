package com.gs.ep.pagetranslator.model.translation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client for an OpenAI compatible chat completions endpoint (SiliconFlow by default).
 * The target language is addressed by its English name, e.g. {@code Swahili}.
 */
public class ChatCompletionProvider extends HttpTranslationProvider {

    public static final String NAME = "chat";

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Pattern SECTION_NUMBER = Pattern.compile("^(\\d+(?:\\.\\d+)*\\.|\\d+(?:\\.\\d+)+)\\s+\\S");
    private static final String[] FILLER_PREFIXES = {"Translation:", "Result:", "Translated text:"};

    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final String sourceLanguage;
    private final String targetLanguage;

    public ChatCompletionProvider(String apiUrl, String apiKey, String model, String sourceLanguage,
                                  String targetLanguage, int timeoutSeconds) {
        super(timeoutSeconds);
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.sourceLanguage = sourceLanguage;
        this.targetLanguage = targetLanguage;
    }

    ChatCompletionProvider(OkHttpClient httpClient, String apiUrl, String apiKey, String model,
                           String sourceLanguage, String targetLanguage) {
        super(httpClient);
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.sourceLanguage = sourceLanguage;
        this.targetLanguage = targetLanguage;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Request buildRequest(String text) throws JsonProcessingException {
        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("model", model);
        requestBody.put("temperature", 0.0);
        ArrayNode messages = requestBody.putArray("messages");
        messages.addObject().put("role", "system").put("content",
                "You are a professional translation engine for technical/official documents. "
                        + "Return ONLY the translated text. NO explanation. NO introductory text. NO quotes. "
                        + "Preserve section numbers (e.g., 1., 1.1., 6.1.2.), list markers (e.g., (a), (b), (1)) "
                        + "and line breaks exactly as they appear.");
        messages.addObject().put("role", "user").put("content", userPrompt(text));

        return new Request.Builder()
                .url(apiUrl)
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(objectMapper.writeValueAsString(requestBody), JSON))
                .build();
    }

    private String userPrompt(String text) {
        if (sourceLanguage == null || sourceLanguage.isEmpty() || "auto".equalsIgnoreCase(sourceLanguage)) {
            return "Translate into " + targetLanguage + ":\n" + text;
        }
        return "Translate from " + sourceLanguage + " into " + targetLanguage + ":\n" + text;
    }

    @Override
    protected String parseResponse(String sourceText, JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            return null;
        }
        String cleaned = normalize(stripConversationalFiller(content.asText()));
        return preserveSectionNumber(sourceText, cleaned);
    }

    /**
     * Strips quotes and "Translation:" style prefixes a model adds despite the instructions.
     */
    static String stripConversationalFiller(String text) {
        String t = text.trim();
        for (String prefix : FILLER_PREFIXES) {
            if (t.toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT))) {
                t = t.substring(prefix.length()).trim();
            }
        }
        if (t.length() > 2 && ((t.startsWith("\"") && t.endsWith("\"")) || (t.startsWith("“") && t.endsWith("”")))) {
            t = t.substring(1, t.length() - 1);
        }
        return t.trim();
    }

    /**
     * Restores a leading section number ({@code 1.}, {@code 6.1.2.}, {@code 4.2}) the model dropped.
     * Plain leading numbers such as years or quantities are not section numbers, and a number the
     * translation already carries anywhere is not added again.
     */
    static String preserveSectionNumber(String source, String translated) {
        Matcher matcher = SECTION_NUMBER.matcher(source.trim());
        if (!matcher.find()) {
            return translated;
        }
        String sectionNumber = matcher.group(1);
        String trimmedTranslated = translated.trim();
        if (trimmedTranslated.isEmpty() || trimmedTranslated.contains(sectionNumber)) {
            return translated;
        }
        return sectionNumber + " " + trimmedTranslated;
    }

    private static String normalize(String text) {
        return text.replace("\r", "").trim();
    }
}
