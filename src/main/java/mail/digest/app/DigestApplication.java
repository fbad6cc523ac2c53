package mail.digest.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class DigestApplication {

    public static void main(String[] args) {
        SpringApplication.run(DigestApplication.class, args);
    }

}
