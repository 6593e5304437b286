package dev.univer.worktracker.service;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TelegramSenderTest {

    @Test
    void shortReportGoesOutAsOneMessage() throws Exception {
        TelegramWrapper wrapper = mock(TelegramWrapper.class);
        new TelegramSender(wrapper).send(42L, "Weekly report\nAnn: 3");

        ArgumentCaptor<SendMessage> sent = ArgumentCaptor.forClass(SendMessage.class);
        verify(wrapper).execute(sent.capture());
        assertThat(sent.getValue().getChatId()).isEqualTo("42");
        assertThat(sent.getValue().getText()).isEqualTo("Weekly report\nAnn: 3");
    }

    @Test
    void longReportIsSplitOnLineBoundaries() throws Exception {
        String line = "x".repeat(3000);
        TelegramWrapper wrapper = mock(TelegramWrapper.class);
        new TelegramSender(wrapper).send(7L, line + "\n" + line + "\n" + "tail");

        ArgumentCaptor<SendMessage> sent = ArgumentCaptor.forClass(SendMessage.class);
        verify(wrapper, times(2)).execute(sent.capture());
        assertThat(sent.getAllValues()).extracting(SendMessage::getText)
                .containsExactly(line, line + "\ntail");
    }

    @Test
    void overlongLineIsCutAtTheLimit() {
        List<String> parts = TelegramSender.split("a".repeat(10) + "\nb", 4);
        assertThat(parts).containsExactly("aaaa", "aaaa", "aa\nb");
    }
}
