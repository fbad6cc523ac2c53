package mail.digest.app.service.urgency;

import mail.digest.app.model.MailMessage;
import mail.digest.app.model.SummaryResult;

/**
 * Optional learned scorer. When a trained classifier is available its score replaces the rule-based one.
 */
public interface UrgencyClassifier {
    boolean isTrained();

    /**
     * @return urgency probability in [0, 1]
     */
    double classify(MailMessage message, SummaryResult summary);
}
