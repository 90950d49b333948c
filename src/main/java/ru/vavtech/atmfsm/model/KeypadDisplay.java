package ru.vavtech.atmfsm.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Форматирование состояния банкомата для экрана.
 * Цифры PIN никогда не выводятся в открытом виде.
 */
public final class KeypadDisplay {
    
    static final String INSERT_CARD = "Вставьте карту";
    static final String ENTER_PIN = "Введите PIN: ";
    static final String ENTER_AMOUNT = "Введите сумму: ";
    
    private KeypadDisplay() {
    }
    
    public static String render(MachineState state) {
        return switch (state.phase().stage()) {
            case WAITING -> INSERT_CARD;
            case AUTHENTICATING -> ENTER_PIN + "*".repeat(state.keystrokes().size());
            case AUTHENTICATED -> ENTER_AMOUNT + join(state.keystrokes(), "");
        };
    }
    
    /**
     * Склеивает текстовые представления клавиш через разделитель
     */
    public static String join(List<Key> keys, String delimiter) {
        return keys.stream()
                .map(Key::getLabel)
                .collect(Collectors.joining(delimiter));
    }
}
