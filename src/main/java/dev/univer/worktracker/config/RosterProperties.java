package dev.univer.worktracker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "roster")
@Getter @Setter
public class RosterProperties {
    private Migration migration = new Migration();
    private Submission submission = new Submission();
    private Report report = new Report();
    private Telegram telegram = new Telegram();

    @Getter @Setter
    public static class Migration {
        private boolean enabled = true;
    }

    @Getter @Setter
    public static class Submission {
        // whole-batch attempts when a concurrent writer wins the same (user, day)
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(50);
    }

    @Getter @Setter
    public static class Report {
        private boolean enabled = true;
        private String cron = "0 0 9 * * MON";
        private String zoneId = "Europe/London";
        private List<Long> chatIds = new ArrayList<>();
    }

    @Getter @Setter
    public static class Telegram {
        private boolean enabled;
        private String username;
        private String token;
    }
}
