package mail.digest.app.config;

import mail.digest.app.service.calendar.CalendarGateway;
import mail.digest.app.service.calendar.DateTimeExtractor;
import mail.digest.app.service.calendar.EventDetector;
import mail.digest.app.service.calendar.PatternDateTimeExtractor;
import mail.digest.app.service.digest.BlockPaginator;
import mail.digest.app.service.digest.DigestBuilder;
import mail.digest.app.service.digest.DigestRenderer;
import mail.digest.app.service.digest.DigestService;
import mail.digest.app.service.digest.DigestSessionManager;
import mail.digest.app.service.mail.MailboxGateway;
import mail.digest.app.service.summary.SummarizationChain;
import mail.digest.app.service.urgency.DeadlineDetector;
import mail.digest.app.service.urgency.UrgencyClassifier;
import mail.digest.app.service.urgency.UrgencyScorer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.Executor;

@Configuration
public class DigestConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId digestZone(@Value("${digest.time-zone:UTC}") String zone) {
        return ZoneId.of(zone);
    }

    @Bean
    public DateTimeExtractor dateTimeExtractor() {
        return new PatternDateTimeExtractor();
    }

    @Bean
    public EventDetector eventDetector(DateTimeExtractor extractor, ZoneId digestZone,
                                       @Value("${digest.calendar.default-duration:PT1H}") Duration defaultDuration,
                                       Clock clock) {
        return new EventDetector(extractor, digestZone, defaultDuration, clock);
    }

    @Bean
    public UrgencyScorer urgencyScorer(DateTimeExtractor extractor,
                                       ObjectProvider<UrgencyClassifier> classifier,
                                       @Value("${urgency.keywords}") List<String> keywords,
                                       @Value("${urgency.thread-activity-threshold:3}") int threadActivityThreshold,
                                       ZoneId digestZone, Clock clock) {
        return new UrgencyScorer(keywords, new DeadlineDetector(extractor), classifier.getIfAvailable(),
                threadActivityThreshold, digestZone, clock);
    }

    @Bean
    public DigestBuilder digestBuilder(SummarizationChain summarizationChain, UrgencyScorer urgencyScorer,
                                       EventDetector eventDetector,
                                       @Qualifier("digestExecutor") Executor executor, Clock clock,
                                       @Value("${digest.item-char-cap:500}") int itemCharCap,
                                       @Value("${digest.combined-char-cap:1000}") int combinedCharCap,
                                       @Value("${digest.grouping-threshold:2}") int groupingThreshold,
                                       @Value("${digest.ordering-window:PT72H}") Duration orderingWindow) {
        return new DigestBuilder(summarizationChain, urgencyScorer, eventDetector, executor, clock,
                itemCharCap, combinedCharCap, groupingThreshold, orderingWindow);
    }

    @Bean
    public DigestRenderer digestRenderer(ZoneId digestZone) {
        return new DigestRenderer(digestZone);
    }

    @Bean
    public DigestSessionManager digestSessionManager(MailboxGateway mailbox, CalendarGateway calendar,
                                                     DigestRenderer digestRenderer, Clock clock,
                                                     @Value("${digest.max-block-chars:4096}") int maxBlockChars,
                                                     @Value("${digest.session-ttl:PT2H}") Duration sessionTtl,
                                                     @Value("${digest.forward-address:}") String forwardAddress,
                                                     @Value("${digest.calendar.add-on-next:false}") boolean addOnNext) {
        return new DigestSessionManager(mailbox, calendar, digestRenderer,
                new BlockPaginator(maxBlockChars), clock, sessionTtl, forwardAddress, addOnNext);
    }

    @Bean
    public DigestService digestService(MailboxGateway mailbox, CalendarGateway calendar, DigestBuilder builder,
                                       DigestSessionManager sessionManager, Clock clock,
                                       @Value("${digest.max-unread:50}") int maxUnread,
                                       @Value("${digest.calendar.lookahead:P14D}") Duration lookahead) {
        return new DigestService(mailbox, calendar, builder, sessionManager, clock, maxUnread, lookahead);
    }
}
