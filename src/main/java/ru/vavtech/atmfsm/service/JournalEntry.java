package ru.vavtech.atmfsm.service;

import lombok.Builder;
import lombok.Value;
import ru.vavtech.atmfsm.engine.TransitionOutcome;
import ru.vavtech.atmfsm.model.AtmEvent;
import ru.vavtech.atmfsm.model.AuthPhase;

import java.time.LocalDateTime;

/**
 * Запись журнала переходов банкомата.
 * Не содержит ни нажатых клавиш, ни дайджестов PIN.
 */
@Value
@Builder
public class JournalEntry {
    
    long sequence;
    
    String sessionId;
    
    AtmEvent.Type eventType;
    
    TransitionOutcome outcome;
    
    AuthPhase.Stage phaseBefore;
    
    AuthPhase.Stage phaseAfter;
    
    long cashBefore;
    
    long cashAfter;
    
    LocalDateTime timestamp;
}
