package dev.univer.worktracker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

/**
 * Delivers roster text to a chat. Telegram caps a message at 4096 characters, so longer
 * reports go out as several messages split on line boundaries.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "roster.telegram", name = "enabled", havingValue = "true")
public class TelegramSender {
    static final int MAX_MESSAGE_LENGTH = 4096;

    private final TelegramWrapper wrapper;

    public void send(Long chatId, String text) throws TelegramApiException {
        List<String> parts = split(text, MAX_MESSAGE_LENGTH);
        if (parts.size() > 1) log.debug("Report for chat {} split into {} messages", chatId, parts.size());
        for (String part : parts) {
            wrapper.execute(SendMessage.builder()
                    .chatId(chatId.toString())
                    .text(part)
                    .build());
        }
    }

    static List<String> split(String text, int limit) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            // a single line over the limit is cut hard
            while (line.length() > limit) {
                flush(current, parts);
                parts.add(line.substring(0, limit));
                line = line.substring(limit);
            }
            int needed = current.length() == 0 ? line.length() : current.length() + 1 + line.length();
            if (needed > limit) flush(current, parts);
            if (current.length() > 0) current.append('\n');
            current.append(line);
        }
        flush(current, parts);
        if (parts.isEmpty()) parts.add(text);
        return parts;
    }

    private static void flush(StringBuilder current, List<String> parts) {
        if (current.length() > 0) {
            parts.add(current.toString());
            current.setLength(0);
        }
    }
}
