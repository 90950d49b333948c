package ru.vavtech.atmfsm.engine;

import ru.vavtech.atmfsm.model.Key;

import java.util.List;

/**
 * Разбор суммы снятия из набранных клавиш.
 * Старшая цифра первая, пустой ввод дает 0, Enter завершает разбор.
 */
public final class WithdrawalAmountParser {
    
    private WithdrawalAmountParser() {
    }
    
    /**
     * @param keys набранные клавиши
     * @return неотрицательная сумма; при переполнении Long.MAX_VALUE
     */
    public static long parse(List<Key> keys) {
        long amount = 0;
        for (Key key : keys) {
            if (!key.isDigit()) {
                break;
            }
            if (amount > (Long.MAX_VALUE - key.getDigit()) / 10) {
                return Long.MAX_VALUE;
            }
            amount = amount * 10 + key.getDigit();
        }
        return amount;
    }
}
