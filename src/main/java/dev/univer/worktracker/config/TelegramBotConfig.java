package dev.univer.worktracker.config;

import dev.univer.worktracker.service.TelegramWrapper;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "roster.telegram", name = "enabled", havingValue = "true")
public class TelegramBotConfig {

    private final TelegramWrapper telegramWrapper;

    @Bean
    public TelegramBotsApi telegramBotsApi() throws TelegramApiException {
        return new TelegramBotsApi(DefaultBotSession.class);
    }

    // start polling only once the entry store is migrated
    @Bean
    @DependsOn("migrationRunner")
    public InitializingBean registerBot(TelegramBotsApi api) {
        return () -> {
            try {
                api.registerBot(telegramWrapper);
                telegramWrapper.installCommands();
            } catch (TelegramApiException e) {
                throw new RuntimeException("Failed to register Telegram bot", e);
            }
        };
    }
}
