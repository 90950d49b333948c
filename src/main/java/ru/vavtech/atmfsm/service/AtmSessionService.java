package ru.vavtech.atmfsm.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.vavtech.atmfsm.engine.AtmStateMachine;
import ru.vavtech.atmfsm.engine.PinHasher;
import ru.vavtech.atmfsm.engine.Transition;
import ru.vavtech.atmfsm.engine.TransitionOutcome;
import ru.vavtech.atmfsm.model.AtmEvent;
import ru.vavtech.atmfsm.model.Key;
import ru.vavtech.atmfsm.model.KeypadDisplay;
import ru.vavtech.atmfsm.model.MachineState;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Сервис обслуживания банкомата.
 * 
 * Хранит единственное актуальное состояние автомата и подает в него события
 * от карт-ридера и клавиатуры. Сам автомат чистый, поэтому вся синхронизация здесь:
 * - запись состояния под write lock, чтение под read lock
 * - одно событие - один переход
 * 
 * Дополнительно ведет журнал переходов ограниченного размера
 * и идентификатор сессии для трассировки в логах.
 */
@Slf4j
@Service
public class AtmSessionService {
    
    private final AtmStateMachine stateMachine;
    private final PinHasher pinHasher;
    private final int journalCapacity;
    
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Deque<JournalEntry> journal = new ArrayDeque<>();
    
    private MachineState currentState = MachineState.initial(0);
    private String sessionId;
    private long sequence;
    
    public AtmSessionService(AtmStateMachine stateMachine,
                             PinHasher pinHasher,
                             @Value("${atm.journal-capacity:100}") int journalCapacity) {
        if (journalCapacity <= 0) {
            throw new IllegalArgumentException("Размер журнала должен быть положительным");
        }
        this.stateMachine = stateMachine;
        this.pinHasher = pinHasher;
        this.journalCapacity = journalCapacity;
    }
    
    /**
     * Сброс банкомата: ожидание карты, указанная сумма наличных, пустой журнал
     */
    public void initialize(long initialCash) {
        lock.writeLock().lock();
        try {
            currentState = MachineState.initial(initialCash);
            sessionId = null;
            sequence = 0;
            journal.clear();
            log.info("Банкомат инициализирован, наличных: {}", initialCash);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    public SessionResult swipeCard(long pinDigest) {
        return submit(AtmEvent.swipeCard(pinDigest));
    }
    
    public SessionResult pressKey(Key key) {
        return submit(AtmEvent.pressKey(key));
    }
    
    /**
     * Применение одного события к текущему состоянию
     * 
     * @param event событие от карт-ридера или клавиатуры
     * @return новое состояние и причина перехода
     */
    public SessionResult submit(AtmEvent event) {
        lock.writeLock().lock();
        try {
            MachineState before = currentState;
            Transition transition = stateMachine.apply(before, event);
            currentState = transition.state();
            
            if (transition.outcome() == TransitionOutcome.CARD_ACCEPTED) {
                sessionId = UUID.randomUUID().toString();
            }
            String eventSessionId = sessionId;
            appendJournal(event, before, transition, eventSessionId);
            logTransition(transition, eventSessionId);
            if (transition.outcome().endsSession()) {
                sessionId = null;
            }
            
            return toResult(transition.state(), transition, eventSessionId);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Текущее состояние банкомата для экрана и мониторинга
     */
    public SessionResult getCurrentResult() {
        lock.readLock().lock();
        try {
            return toResult(currentState, null, sessionId);
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public MachineState getCurrentState() {
        lock.readLock().lock();
        try {
            return currentState;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public long getCashInside() {
        return getCurrentState().cashInside();
    }
    
    /**
     * Копия журнала переходов, от старых записей к новым
     */
    public List<JournalEntry> getJournal() {
        lock.readLock().lock();
        try {
            return List.copyOf(journal);
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Дайджест PIN, который записывается на карту при выпуске.
     * 
     * @param pin строка из цифр 1-4, например "1234"
     * @return дайджест, совпадающий с хешем набора этих клавиш
     * @throws IllegalArgumentException если PIN пустой или содержит недопустимые символы
     */
    public long enrollPin(String pin) {
        if (pin == null || pin.isEmpty()) {
            throw new IllegalArgumentException("PIN не может быть пустым");
        }
        List<Key> keys = new ArrayList<>(pin.length());
        for (char c : pin.toCharArray()) {
            Key key = Key.fromLabel(String.valueOf(c));
            if (!key.isDigit()) {
                throw new IllegalArgumentException("PIN может содержать только цифры 1-4");
            }
            keys.add(key);
        }
        return pinHasher.hash(keys);
    }
    
    private void appendJournal(AtmEvent event, MachineState before, Transition transition, String eventSessionId) {
        if (journal.size() >= journalCapacity) {
            journal.removeFirst();
        }
        journal.addLast(JournalEntry.builder()
                .sequence(++sequence)
                .sessionId(eventSessionId)
                .eventType(event.type())
                .outcome(transition.outcome())
                .phaseBefore(before.phase().stage())
                .phaseAfter(transition.state().phase().stage())
                .cashBefore(before.cashInside())
                .cashAfter(transition.state().cashInside())
                .timestamp(LocalDateTime.now())
                .build());
    }
    
    // Цифры PIN и дайджесты в лог не попадают
    private void logTransition(Transition transition, String eventSessionId) {
        switch (transition.outcome()) {
            case CARD_ACCEPTED -> log.info("Карта принята, сессия {}", eventSessionId);
            case CARD_RESWIPED -> log.info("Повторная вставка карты в сессии {}", eventSessionId);
            case PIN_ACCEPTED -> log.info("PIN подтвержден для сессии {}", eventSessionId);
            case PIN_REJECTED -> log.warn("Неверный PIN, сессия {} завершена", eventSessionId);
            case CASH_DISPENSED -> log.info("Выдано {} для сессии {}, остаток {}",
                    transition.dispensed(), eventSessionId, transition.state().cashInside());
            case INSUFFICIENT_FUNDS -> log.warn("Недостаточно средств в банкомате: остаток {}, сессия {} завершена",
                    transition.state().cashInside(), eventSessionId);
            case KEY_IGNORED -> log.debug("Нажатие клавиши без карты проигнорировано");
            case KEY_BUFFERED -> log.debug("Клавиша принята в сессии {}, в буфере {}",
                    eventSessionId, transition.state().keystrokes().size());
        }
    }
    
    private SessionResult toResult(MachineState state, Transition transition, String resultSessionId) {
        return SessionResult.builder()
                .outcome(transition != null ? transition.outcome() : null)
                .phase(state.phase().stage())
                .cashInside(state.cashInside())
                .dispensedAmount(transition != null ? transition.dispensed() : 0)
                .bufferedKeys(state.keystrokes().size())
                .display(KeypadDisplay.render(state))
                .sessionId(resultSessionId)
                .timestamp(LocalDateTime.now())
                .build();
    }
}
