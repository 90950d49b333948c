package ru.vavtech.atmfsm.service;

import lombok.Builder;
import lombok.Value;
import ru.vavtech.atmfsm.engine.TransitionOutcome;
import ru.vavtech.atmfsm.model.AuthPhase;

import java.time.LocalDateTime;

/**
 * Состояние банкомата после обработки события, в виде для внешнего клиента.
 * Набранные клавиши не раскрываются: только их количество и строка экрана.
 */
@Value
@Builder
public class SessionResult {
    
    /**
     * Причина перехода (null для простого запроса состояния)
     */
    TransitionOutcome outcome;
    
    AuthPhase.Stage phase;
    
    /**
     * Наличные в банкомате после перехода
     */
    long cashInside;
    
    /**
     * Выданная сумма
     */
    long dispensedAmount;
    
    int bufferedKeys;
    
    /**
     * Текст на экране банкомата
     */
    String display;
    
    /**
     * Идентификатор сессии обслуживания карты (null, если карты нет)
     */
    String sessionId;
    
    LocalDateTime timestamp;
}
