package me.golemcore.estate.infrastructure.i18n;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageServiceTest {

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    @Test
    void shouldFormatArguments() {
        assertEquals("📍 Found 7 properties! Gathering location details...",
                messageService.getMessage("turn.gathering", 7));
    }

    @Test
    void shouldFormatTextArguments() {
        assertEquals("I'm having trouble reaching the property search service right now. "
                + "Please try again in a moment.",
                messageService.getMessage("turn.unavailable", messageService.getMessage("worker.search")));
    }

    @Test
    void shouldFormatArgumentsInSelectedLanguage() {
        messageService.setLanguage(MessageService.LANG_RU);

        assertEquals("Сервис (поиск недвижимости) сейчас недоступен. Пожалуйста, попробуйте ещё раз чуть позже.",
                messageService.getMessage("turn.unavailable", messageService.getMessage("worker.search")));
    }

    @Test
    void shouldUnescapeQuotesWithoutArguments() {
        assertTrue(messageService.getMessage("turn.fallback").startsWith("Sorry, I didn't quite get that."));
    }

    @Test
    void shouldReturnKeyForMissingMessage() {
        assertEquals("no.such.key", messageService.getMessage("no.such.key"));
    }

    @Test
    void shouldSwitchLanguage() {
        messageService.setLanguage(MessageService.LANG_RU);

        assertEquals("ru", messageService.getLanguage());
        assertFalse(messageService.getMessage("turn.processing").contains("Processing"));
        assertTrue(messageService.isSupported("en"));
        assertThrows(IllegalArgumentException.class, () -> messageService.setLanguage("de"));
    }
}
