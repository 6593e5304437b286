package dev.univer.worktracker.service;

import dev.univer.worktracker.config.RosterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeDefault;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Arrays;
import java.util.List;

/**
 * Long-polling endpoint. Updates are re-published as application events and handled by
 * {@link dev.univer.worktracker.bot.RosterBot}.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "roster.telegram", name = "enabled", havingValue = "true")
public class TelegramWrapper extends TelegramLongPollingBot {

    private final RosterProperties props;
    private final ApplicationEventPublisher publisher;

    public TelegramWrapper(RosterProperties props, ApplicationEventPublisher publisher) {
        super(props.getTelegram().getToken());
        this.props = props;
        this.publisher = publisher;
    }

    @Override public String getBotUsername() { return props.getTelegram().getUsername(); }

    @Override
    public void onUpdateReceived(Update update) {
        log.debug("Incoming update: {}", update.getUpdateId());
        publisher.publishEvent(update);
    }

    public void installCommands() {
        List<BotCommand> commands = Arrays.asList(
                new BotCommand("/help", "Help"),
                new BotCommand("/week", "Roster for a week"),
                new BotCommand("/me", "One person's week"),
                new BotCommand("/who", "Known people"),
                new BotCommand("/report", "Last week's office days")
                                                 );
        SetMyCommands set = new SetMyCommands();
        set.setCommands(commands);
        set.setScope(new BotCommandScopeDefault());
        try { execute(set); log.info("Bot commands installed: {}", commands.size()); }
        catch (TelegramApiException e) { log.warn("Failed to set bot commands", e); }
    }
}
