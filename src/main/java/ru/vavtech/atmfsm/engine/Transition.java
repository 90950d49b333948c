package ru.vavtech.atmfsm.engine;

import ru.vavtech.atmfsm.model.MachineState;

import java.util.Objects;

/**
 * Результат одного шага автомата.
 *
 * @param state     новое состояние
 * @param outcome   причина перехода
 * @param dispensed выданная сумма (0, если выдачи не было)
 */
public record Transition(MachineState state, TransitionOutcome outcome, long dispensed) {
    
    public Transition {
        Objects.requireNonNull(state, "Состояние не может быть null");
        Objects.requireNonNull(outcome, "Причина перехода не может быть null");
    }
    
    static Transition of(MachineState state, TransitionOutcome outcome) {
        return new Transition(state, outcome, 0);
    }
}
