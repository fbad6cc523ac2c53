package mail.digest.app.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "important_senders")
@Data
@NoArgsConstructor
public class ImportantSender {
    @Id
    private String address; // lower-case sender address

    private Instant markedAt;

    public ImportantSender(String address, Instant markedAt) {
        this.address = address;
        this.markedAt = markedAt;
    }
}
