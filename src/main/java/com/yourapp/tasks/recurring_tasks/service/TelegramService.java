package com.yourapp.tasks.recurring_tasks.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;

/**
 * Operator alerts over the Telegram bot API. Disabled unless {@code telegram.enabled=true}.
 */
@Service
public class TelegramService {
    private static final Logger logger = LoggerFactory.getLogger(TelegramService.class);

    private final boolean enabled;
    private final String botToken;
    private final String chatId;
    private final RestTemplate rest;

    @Autowired
    public TelegramService(@Value("${telegram.enabled:false}") boolean enabled,
                           @Value("${telegram.bot-token:}") String botToken,
                           @Value("${telegram.chat-id:}") String chatId) {
        this(enabled, botToken, chatId, new RestTemplate());
    }

    TelegramService(boolean enabled, String botToken, String chatId, RestTemplate rest) {
        this.enabled = enabled;
        this.botToken = botToken;
        this.chatId = chatId;
        this.rest = rest;
    }

    public boolean isEnabled() {
        return enabled && !botToken.isBlank() && !chatId.isBlank();
    }

    /**
     * Sends an HTML-formatted alert. Delivery failures are logged, never thrown.
     *
     * @return true if the message was accepted by the API
     */
    public boolean sendAlert(String text) {
        if (!isEnabled()) {
            logger.debug("Telegram alerts disabled, dropping alert: {}", text);
            return false;
        }

        String url = "https://api.telegram.org/bot" + botToken + "/sendMessage";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("chat_id", chatId);
        form.add("text", text);
        form.add("parse_mode", "HTML");

        try {
            ResponseEntity<String> response = rest.postForEntity(url, new HttpEntity<>(form, headers), String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            logger.warn("Failed to send Telegram alert: {}", e.getMessage());
            return false;
        }
    }
}
