package mail.digest.app.service.summary;

import mail.digest.app.model.SummaryProvenance;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LocalExtractiveSummaryProviderTest {
    private final LocalExtractiveSummaryProvider provider = new LocalExtractiveSummaryProvider(3);

    @Test
    void summarize_ShouldKeepHighestScoringSentencesInSourceOrder() {
        // Given
        String body = "The budget review is scheduled. Lunch was nice. The budget needs approval from finance. "
                + "Weather is sunny. Finance wants the budget numbers.";

        // When
        String summary = provider.summarize(new SummaryRequest("Budget", body, 500));

        // Then
        assertEquals("The budget review is scheduled. The budget needs approval from finance. "
                + "Finance wants the budget numbers.", summary);
        assertEquals(SummaryProvenance.LOCAL, provider.tier());
    }

    @Test
    void summarize_WithFewSentences_ShouldReturnThemAll() {
        String summary = provider.summarize(new SummaryRequest("Hi", "Only one sentence here.", 500));

        assertEquals("Only one sentence here.", summary);
    }

    @Test
    void summarize_WithEmptyBody_ShouldBeUnusable() {
        assertThrows(SummaryProvider.UnusableException.class,
                () -> provider.summarize(new SummaryRequest("Subject only", "", 500)));
    }
}
