package ru.vavtech.atmfsm.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Полное состояние банкомата.
 * Неизменяемо: каждый переход автомата возвращает новый экземпляр.
 *
 * @param cashInside наличные в банкомате
 * @param phase      фаза аутентификации
 * @param keystrokes клавиши, набранные в текущей фазе
 */
public record MachineState(
        long cashInside,
        AuthPhase phase,
        List<Key> keystrokes
) {
    
    public MachineState {
        if (cashInside < 0) {
            throw new IllegalArgumentException("Сумма в банкомате не может быть отрицательной");
        }
        Objects.requireNonNull(phase, "Фаза не может быть null");
        keystrokes = List.copyOf(Objects.requireNonNull(keystrokes, "Буфер клавиш не может быть null"));
    }
    
    /**
     * Начальное состояние: карты нет, буфер пуст
     */
    public static MachineState initial(long cashInside) {
        return new MachineState(cashInside, AuthPhase.WAITING, List.of());
    }
    
    /**
     * Смена фазы всегда очищает буфер клавиш
     */
    public MachineState withPhase(AuthPhase newPhase) {
        return new MachineState(cashInside, newPhase, List.of());
    }
    
    public MachineState withKey(Key key) {
        List<Key> buffer = new ArrayList<>(keystrokes.size() + 1);
        buffer.addAll(keystrokes);
        buffer.add(key);
        return new MachineState(cashInside, phase, buffer);
    }
    
    public MachineState withCash(long newCashInside) {
        return new MachineState(newCashInside, phase, keystrokes);
    }
}
