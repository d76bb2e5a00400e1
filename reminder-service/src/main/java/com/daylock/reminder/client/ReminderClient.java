package com.daylock.reminder.client;

import com.daylock.reminder.model.RoomReminder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fetches every configured room reminder, with its room, from the reminders API.
 *
 * <p>All errors are absorbed with an empty list so that the scheduling loop never stalls
 * if the API is unreachable; the next tick simply tries again.
 */
@Component
public class ReminderClient {

    private static final Logger log = LoggerFactory.getLogger(ReminderClient.class);

    private static final ParameterizedTypeReference<List<RoomReminder>> REMINDER_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient remindersClient;

    public ReminderClient(WebClient remindersClient) {
        this.remindersClient = remindersClient;
    }

    /**
     * @return all reminders; an empty list when none exist or on any error
     */
    public Mono<List<RoomReminder>> fetchAll() {
        return remindersClient.get()
            .uri("/api/v1/reminders")
            .retrieve()
            .bodyToMono(REMINDER_LIST)
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("Reminder fetch failed, treating as no reminders. reason={}", e.getMessage());
                return Mono.just(List.of());
            });
    }
}
