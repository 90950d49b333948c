package ru.vavtech.atmfsm.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.vavtech.atmfsm.service.AtmSessionService;

/**
 * Конфигурация банкомата.
 * Загружает начальную сумму наличных при старте приложения.
 */
@Slf4j
@Configuration
public class ATMConfiguration {
    
    @Bean
    public CommandLineRunner initializeATM(AtmSessionService atmSessionService,
                                           @Value("${atm.initial-cash:10}") long initialCash) {
        return args -> {
            log.info("Инициализация банкомата...");
            atmSessionService.initialize(initialCash);
            log.info("Банкомат готов к работе");
        };
    }
}
