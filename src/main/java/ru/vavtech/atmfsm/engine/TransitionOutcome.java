package ru.vavtech.atmfsm.engine;

/**
 * Причина перехода. Передается отдельно от состояния:
 * само состояние после отказа и после успешной выдачи одинаково выглядит как ожидание карты.
 */
public enum TransitionOutcome {
    CARD_ACCEPTED("Карта принята"),
    CARD_RESWIPED("Карта вставлена повторно, набранные цифры сохранены"),
    KEY_IGNORED("Нажатие без карты проигнорировано"),
    KEY_BUFFERED("Клавиша принята"),
    PIN_ACCEPTED("PIN подтвержден"),
    PIN_REJECTED("Неверный PIN"),
    CASH_DISPENSED("Наличные выданы"),
    INSUFFICIENT_FUNDS("Недостаточно средств в банкомате");
    
    private final String description;
    
    TransitionOutcome(String description) {
        this.description = description;
    }
    
    public String getDescription() {
        return description;
    }
    
    /**
     * Сессия закончилась и банкомат вернулся к ожиданию карты
     */
    public boolean endsSession() {
        return this == PIN_REJECTED || this == CASH_DISPENSED || this == INSUFFICIENT_FUNDS;
    }
}
