package mail.digest.app.service.summary;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.SummaryProvenance;

import java.time.Duration;
import java.util.List;

/**
 * Primary tier: OpenAI chat completion.
 */
@Slf4j
public class OpenAiSummaryProvider extends RemoteSummaryProvider {
    private static final String SYSTEM_PROMPT = "You are a helpful assistant that summarizes emails.";

    private final OpenAiService openAiService;
    private final String model;

    public OpenAiSummaryProvider(OpenAiService openAiService, String model, int rateLimitRetries, Duration backoffCap) {
        super(rateLimitRetries, backoffCap);
        this.openAiService = openAiService;
        this.model = model;
        if (openAiService == null) {
            log.warn("OpenAI API key not configured. Set openai.api.key to enable the primary summarizer.");
        }
    }

    @Override
    public SummaryProvenance tier() {
        return SummaryProvenance.PRIMARY;
    }

    @Override
    protected boolean isConfigured() {
        return openAiService != null;
    }

    @Override
    protected String providerName() {
        return "OpenAI";
    }

    @Override
    protected String complete(String prompt, int maxLength) {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(model)
                .messages(List.of(new ChatMessage("system", SYSTEM_PROMPT), new ChatMessage("user", prompt)))
                // roughly four characters per token, with headroom
                .maxTokens(Math.max(64, maxLength / 3))
                .temperature(0.2)
                .build();
        try {
            ChatCompletionResult result = openAiService.createChatCompletion(request);
            if (result.getChoices() == null || result.getChoices().isEmpty()) {
                throw new UnusableException("OpenAI returned no choices", null);
            }
            return result.getChoices().get(0).getMessage().getContent();
        } catch (OpenAiHttpException e) {
            throw ProviderErrors.fromStatus(providerName(), e.statusCode, e.code + " " + e.getMessage(), null, e);
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ProviderErrors.fromException(providerName(), e);
        }
    }
}
