package mail.digest.app.service.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.SummaryProvenance;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Secondary tier: Google Gemini {@code generateContent} over REST.
 */
@Slf4j
public class GeminiSummaryProvider extends RemoteSummaryProvider {
    private static final String GEMINI_API_URL = "https://generativelanguage.googleapis.com/v1beta/models/%s:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;

    public GeminiSummaryProvider(RestTemplate restTemplate, ObjectMapper objectMapper, String apiKey, String model,
                                 int rateLimitRetries, Duration backoffCap) {
        super(rateLimitRetries, backoffCap);
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        if (!isConfigured()) {
            log.warn("Gemini API key not configured. Set gemini.api.key to enable the secondary summarizer.");
        }
    }

    @Override
    public SummaryProvenance tier() {
        return SummaryProvenance.SECONDARY;
    }

    @Override
    protected boolean isConfigured() {
        return apiKey != null && !apiKey.isEmpty() && !apiKey.startsWith("${");
    }

    @Override
    protected String providerName() {
        return "Gemini";
    }

    @Override
    protected String complete(String prompt, int maxLength) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> part = new HashMap<>();
        part.put("text", prompt);
        Map<String, Object> contents = new HashMap<>();
        contents.put("parts", List.of(part));
        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("maxOutputTokens", Math.max(64, maxLength / 3));
        generationConfig.put("temperature", 0.2);
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("contents", List.of(contents));
        requestBody.put("generationConfig", generationConfig);

        String url = String.format(GEMINI_API_URL, model) + "?key=" + apiKey;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    url, new HttpEntity<>(requestBody, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw ProviderErrors.fromStatus(providerName(), response.getStatusCode().value(),
                        response.getBody(), null, null);
            }
            return extractText(response.getBody());
        } catch (HttpStatusCodeException e) {
            throw ProviderErrors.fromStatus(providerName(), e.getStatusCode().value(),
                    e.getResponseBodyAsString(), retryAfter(e.getResponseHeaders()), e);
        } catch (ResourceAccessException e) {
            throw new TransientException("Gemini network failure: " + e.getMessage(), e);
        }
    }

    private String extractText(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
            if (parts.isArray() && parts.size() > 0 && parts.get(0).has("text")) {
                return parts.get(0).get("text").asText();
            }
            String blockReason = root.path("promptFeedback").path("blockReason").asText("");
            throw new UnusableException("Unexpected Gemini response format" 
                    + (blockReason.isEmpty() ? "" : " (blocked: " + blockReason + ")"), null);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new UnusableException("Unparseable Gemini response: " + e.getOriginalMessage(), e);
        }
    }

    private static Duration retryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
