package ru.vavtech.atmfsm.engine;

/**
 * Детерминированный конечный автомат.
 *
 * @param <S> состояние
 * @param <E> событие
 */
public interface StateMachine<S, E> {
    
    /**
     * Вычисляет следующее состояние. Не меняет переданное состояние.
     */
    S nextState(S state, E event);
}
