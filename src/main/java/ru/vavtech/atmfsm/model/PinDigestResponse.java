package ru.vavtech.atmfsm.model;

/**
 * Дайджест PIN для записи на карту
 */
public record PinDigestResponse(long pinDigest) {
}
