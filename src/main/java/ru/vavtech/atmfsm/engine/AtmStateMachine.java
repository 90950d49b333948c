package ru.vavtech.atmfsm.engine;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.vavtech.atmfsm.model.AtmEvent;
import ru.vavtech.atmfsm.model.AuthPhase;
import ru.vavtech.atmfsm.model.Key;
import ru.vavtech.atmfsm.model.MachineState;

/**
 * Функция переходов банкомата.
 * 
 * Банкомат проходит три фазы:
 * 1. WAITING - карты нет, нажатия клавиш игнорируются
 * 2. AUTHENTICATING - карта вставлена, клиент набирает PIN и нажимает Enter
 * 3. AUTHENTICATED - PIN верный, клиент набирает сумму и нажимает Enter
 * 
 * Обе неудачи (неверный PIN, нехватка наличных) возвращают банкомат в WAITING
 * с пустым буфером. Причину видно только в {@link TransitionOutcome}, состояние ее не хранит.
 * 
 * Автомат не имеет изменяемого состояния: каждый вызов получает снимок
 * и возвращает новый снимок. Сериализация вызовов - забота вызывающей стороны.
 */
@Component
@RequiredArgsConstructor
public class AtmStateMachine implements StateMachine<MachineState, AtmEvent> {
    
    private final PinHasher pinHasher;
    
    @Override
    public MachineState nextState(MachineState state, AtmEvent event) {
        return apply(state, event).state();
    }
    
    /**
     * Один шаг автомата вместе с причиной перехода.
     * 
     * @param state текущее состояние
     * @param event событие от карт-ридера или клавиатуры
     * @return новое состояние и причина перехода; для любой пары результат определен
     */
    public Transition apply(MachineState state, AtmEvent event) {
        return switch (event.type()) {
            case SWIPE_CARD -> swipeCard(state, ((AtmEvent.SwipeCard) event).pinDigest());
            case PRESS_KEY -> pressKey(state, ((AtmEvent.PressKey) event).key());
        };
    }
    
    /**
     * Повторная вставка карты во время ввода PIN не теряет уже набранные цифры.
     * В остальных фазах начинается новая сессия с пустым буфером.
     */
    private Transition swipeCard(MachineState state, long pinDigest) {
        AuthPhase authenticating = AuthPhase.authenticating(pinDigest);
        if (state.phase().stage() == AuthPhase.Stage.AUTHENTICATING) {
            return Transition.of(
                    new MachineState(state.cashInside(), authenticating, state.keystrokes()),
                    TransitionOutcome.CARD_RESWIPED);
        }
        return Transition.of(state.withPhase(authenticating), TransitionOutcome.CARD_ACCEPTED);
    }
    
    private Transition pressKey(MachineState state, Key key) {
        return switch (state.phase().stage()) {
            case WAITING -> Transition.of(state.withPhase(AuthPhase.WAITING), TransitionOutcome.KEY_IGNORED);
            case AUTHENTICATING -> key == Key.ENTER
                    ? verifyPin(state, ((AuthPhase.Authenticating) state.phase()).pinDigest())
                    : Transition.of(state.withKey(key), TransitionOutcome.KEY_BUFFERED);
            case AUTHENTICATED -> key == Key.ENTER
                    ? withdraw(state)
                    : Transition.of(state.withKey(key), TransitionOutcome.KEY_BUFFERED);
        };
    }
    
    /**
     * Сравнение хеша набранных клавиш (без Enter) с дайджестом с карты.
     * Счетчика попыток нет: неверный PIN просто завершает сессию.
     */
    private Transition verifyPin(MachineState state, long expectedDigest) {
        long actualDigest = pinHasher.hash(state.keystrokes());
        if (actualDigest == expectedDigest) {
            return Transition.of(state.withPhase(AuthPhase.AUTHENTICATED), TransitionOutcome.PIN_ACCEPTED);
        }
        return Transition.of(state.withPhase(AuthPhase.WAITING), TransitionOutcome.PIN_REJECTED);
    }
    
    /**
     * Выдача суммы, набранной до Enter.
     * Запрос больше остатка отклоняется без изменения наличных.
     */
    private Transition withdraw(MachineState state) {
        long amount = WithdrawalAmountParser.parse(state.keystrokes());
        MachineState waiting = state.withPhase(AuthPhase.WAITING);
        if (state.cashInside() >= amount) {
            return new Transition(
                    waiting.withCash(state.cashInside() - amount),
                    TransitionOutcome.CASH_DISPENSED,
                    amount);
        }
        return Transition.of(waiting, TransitionOutcome.INSUFFICIENT_FUNDS);
    }
}
