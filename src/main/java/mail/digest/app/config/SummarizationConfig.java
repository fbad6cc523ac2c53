package mail.digest.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.SummaryProvenance;
import mail.digest.app.service.summary.GeminiSummaryProvider;
import mail.digest.app.service.summary.HeuristicSummaryProvider;
import mail.digest.app.service.summary.LocalExtractiveSummaryProvider;
import mail.digest.app.service.summary.OpenAiSummaryProvider;
import mail.digest.app.service.summary.SummarizationChain;
import mail.digest.app.service.summary.SummaryProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Wires the summary providers into a chain ordered by {@code summary.providers}.
 * The heuristic tier is always appended last so the chain can always produce text.
 */
@Slf4j
@Configuration
public class SummarizationConfig {
    private static final int EXTRACTIVE_SENTENCES = 3;

    @Value("${summary.rate-limit-retries:2}")
    private int rateLimitRetries;

    @Value("${summary.rate-limit-backoff-cap:PT4S}")
    private Duration rateLimitBackoffCap;

    @Bean
    public RestTemplate summaryRestTemplate(RestTemplateBuilder builder,
                                            @Value("${summary.provider-timeout:PT10S}") Duration timeout) {
        return builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
    }

    @Bean
    public OpenAiSummaryProvider openAiSummaryProvider(@Value("${openai.api.key:}") String apiKey,
                                                       @Value("${openai.model:gpt-3.5-turbo}") String model,
                                                       @Value("${summary.provider-timeout:PT10S}") Duration timeout) {
        OpenAiService openAiService = apiKey.isBlank() ? null : new OpenAiService(apiKey, timeout);
        return new OpenAiSummaryProvider(openAiService, model, rateLimitRetries, rateLimitBackoffCap);
    }

    @Bean
    public GeminiSummaryProvider geminiSummaryProvider(@Qualifier("summaryRestTemplate") RestTemplate restTemplate,
                                                       ObjectMapper objectMapper,
                                                       @Value("${gemini.api.key:}") String apiKey,
                                                       @Value("${gemini.model:gemini-1.5-flash}") String model) {
        return new GeminiSummaryProvider(restTemplate, objectMapper, apiKey, model, rateLimitRetries, rateLimitBackoffCap);
    }

    @Bean
    public SummarizationChain summarizationChain(OpenAiSummaryProvider primary,
                                                 GeminiSummaryProvider secondary,
                                                 @Qualifier("summaryProviderExecutor") Executor executor,
                                                 Clock clock,
                                                 @Value("${summary.providers:primary,secondary,local,heuristic}") List<String> order,
                                                 @Value("${summary.provider-timeout:PT10S}") Duration providerTimeout,
                                                 @Value("${summary.transient-retry-backoff:PT1S}") Duration retryBackoff) {
        Map<SummaryProvenance, SummaryProvider> available = new EnumMap<>(SummaryProvenance.class);
        available.put(SummaryProvenance.PRIMARY, primary);
        available.put(SummaryProvenance.SECONDARY, secondary);
        available.put(SummaryProvenance.LOCAL, new LocalExtractiveSummaryProvider(EXTRACTIVE_SENTENCES));
        available.put(SummaryProvenance.HEURISTIC, new HeuristicSummaryProvider(EXTRACTIVE_SENTENCES));

        List<SummaryProvider> providers = new ArrayList<>();
        for (String code : order) {
            if (code.isBlank()) {
                continue;
            }
            SummaryProvider provider = available.remove(SummaryProvenance.fromCode(code));
            if (provider != null) {
                providers.add(provider);
            }
        }
        SummaryProvider heuristic = available.remove(SummaryProvenance.HEURISTIC);
        if (heuristic != null) {
            providers.add(heuristic);
        }
        log.info("Summary provider order: {}", providers.stream().map(p -> p.tier().code()).toList());
        return new SummarizationChain(providers, executor, providerTimeout, retryBackoff, clock);
    }
}
