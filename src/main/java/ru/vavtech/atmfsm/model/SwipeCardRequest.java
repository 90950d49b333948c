package ru.vavtech.atmfsm.model;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Запрос от карт-ридера: карта вставлена.
 */
@Value
@Builder
@Jacksonized
public class SwipeCardRequest {
    
    /**
     * Дайджест правильного PIN, записанный на карте
     */
    @NotNull(message = "Дайджест PIN обязателен")
    Long pinDigest;
}
