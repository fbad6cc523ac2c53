package mail.digest.app.repository;

import mail.digest.app.entity.ImportantSender;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ImportantSenderRepository extends JpaRepository<ImportantSender, String> {
}
