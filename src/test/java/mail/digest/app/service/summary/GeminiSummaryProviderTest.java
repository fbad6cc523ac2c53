package mail.digest.app.service.summary;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GeminiSummaryProviderTest {
    private static final String REPLY = "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Team offsite moved to May.\"}]}}]}";

    @Mock
    private RestTemplate restTemplate;

    private GeminiSummaryProvider provider;

    @BeforeEach
    void setUp() {
        provider = new GeminiSummaryProvider(restTemplate, new ObjectMapper(), "test-key", "gemini-1.5-flash",
                0, Duration.ofSeconds(4));
    }

    @Test
    void summarize_WithValidReply_ShouldReturnCandidateText() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.ok(REPLY));

        // When
        String result = provider.summarize(new SummaryRequest("Offsite", "The offsite is now in May.", 200));

        // Then
        assertEquals("Team offsite moved to May.", result);
        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        verify(restTemplate).postForEntity(url.capture(), any(HttpEntity.class), eq(String.class));
        assertTrue(url.getValue().contains("models/gemini-1.5-flash:generateContent?key=test-key"));
    }

    @Test
    void summarize_WhenHttp429_ShouldBeRateLimitedWithRetryAfter() {
        // Given
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "12");
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenThrow(HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests",
                        headers, "{}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));

        // When
        SummaryProvider.RateLimitedException e = assertThrows(SummaryProvider.RateLimitedException.class,
                () -> provider.summarize(new SummaryRequest("s", "b", 200)));

        // Then
        assertEquals(FailureKind.RATE_LIMITED, e.getKind());
        assertEquals(Duration.ofSeconds(12), e.getRetryAfter());
    }

    @Test
    void summarize_WhenHttp503_ShouldBeTransient() {
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenThrow(HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE, "Unavailable",
                        new HttpHeaders(), new byte[0], StandardCharsets.UTF_8));

        assertThrows(SummaryProvider.TransientException.class,
                () -> provider.summarize(new SummaryRequest("s", "b", 200)));
    }

    @Test
    void summarize_WhenQuotaMessageInBadRequest_ShouldBeRateLimited() {
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenThrow(HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "Bad Request", new HttpHeaders(),
                        "{\"error\":{\"status\":\"RESOURCE_EXHAUSTED\"}}".getBytes(StandardCharsets.UTF_8),
                        StandardCharsets.UTF_8));

        assertThrows(SummaryProvider.RateLimitedException.class,
                () -> provider.summarize(new SummaryRequest("s", "b", 200)));
    }

    @Test
    void summarize_WhenNetworkFails_ShouldBeTransient() {
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new ResourceAccessException("Connection reset"));

        assertThrows(SummaryProvider.TransientException.class,
                () -> provider.summarize(new SummaryRequest("s", "b", 200)));
    }

    @Test
    void summarize_WhenReplyEchoesPrompt_ShouldBeUnusable() {
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.ok(
                        "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Summarize the following email in 200 characters\"}]}}]}"));

        assertThrows(SummaryProvider.UnusableException.class,
                () -> provider.summarize(new SummaryRequest("s", "b", 200)));
    }

    @Test
    void summarize_WithoutApiKey_ShouldBeUnusableWithoutCallingApi() {
        GeminiSummaryProvider unconfigured = new GeminiSummaryProvider(restTemplate, new ObjectMapper(), "",
                "gemini-1.5-flash", 0, Duration.ofSeconds(4));

        assertThrows(SummaryProvider.UnusableException.class,
                () -> unconfigured.summarize(new SummaryRequest("s", "b", 200)));
        verifyNoInteractions(restTemplate);
    }
}
