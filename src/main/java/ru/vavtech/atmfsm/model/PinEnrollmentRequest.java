package ru.vavtech.atmfsm.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Запрос на вычисление дайджеста PIN при выпуске карты.
 */
@Value
@Builder
@Jacksonized
public class PinEnrollmentRequest {
    
    @NotBlank(message = "PIN обязателен")
    @Pattern(regexp = "[1-4]+", message = "PIN может содержать только цифры 1-4")
    String pin;
}
