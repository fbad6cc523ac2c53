package mail.digest.app.repository;

import mail.digest.app.entity.ConversationSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface ConversationSettingsRepository extends JpaRepository<ConversationSettings, String> {
    List<ConversationSettings> findByNextDigestAtLessThanEqual(Instant now);

    List<ConversationSettings> findByNotificationsEnabledTrue();

    // only moves the schedule if nobody changed it since it was read
    @Modifying
    @Transactional
    @Query("UPDATE ConversationSettings s SET s.nextDigestAt = :next "
            + "WHERE s.conversationId = :id AND s.nextDigestAt = :expected")
    int advanceNextDigestAt(@Param("id") String conversationId, @Param("expected") Instant expected,
                            @Param("next") Instant next);

    @Modifying
    @Transactional
    @Query("UPDATE ConversationSettings s SET s.lastAlertCheckAt = :checkedAt WHERE s.conversationId = :id")
    int updateLastAlertCheckAt(@Param("id") String conversationId, @Param("checkedAt") Instant checkedAt);
}
