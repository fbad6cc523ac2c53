package mail.digest.app.service.summary;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicSummaryProviderTest {
    private final HeuristicSummaryProvider provider = new HeuristicSummaryProvider(3);

    @Test
    void summarize_ShouldReturnLeadingSentences() {
        String summary = provider.summarize(new SummaryRequest("Update",
                "One. Two is here. Three follows. Four is dropped.", 500));

        assertEquals("One. Two is here. Three follows.", summary);
    }

    @Test
    void summarize_WithEmptyBody_ShouldUseSubject() {
        assertEquals("Invoice #42", provider.summarize(new SummaryRequest("Invoice #42", "  ", 500)));
    }

    @Test
    void summarize_WithNothingAtAll_ShouldReturnPlaceholder() {
        assertEquals(HeuristicSummaryProvider.NO_CONTENT, provider.summarize(new SummaryRequest(null, null, 500)));
    }
}
