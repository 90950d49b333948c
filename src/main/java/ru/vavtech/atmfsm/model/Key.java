package ru.vavtech.atmfsm.model;

/**
 * Клавиши клавиатуры банкомата.
 * Набор закрыт: четыре цифровые клавиши и клавиша подтверждения.
 */
public enum Key {
    
    ONE("1", 1),
    TWO("2", 2),
    THREE("3", 3),
    FOUR("4", 4),
    ENTER("Enter", 0);
    
    private final String label;
    private final int digit;
    
    Key(String label, int digit) {
        this.label = label;
        this.digit = digit;
    }
    
    /**
     * Каноническое текстовое представление клавиши.
     * Используется только для хеширования и отображения.
     */
    public String getLabel() {
        return label;
    }
    
    /**
     * Цифровое значение клавиши (0 для Enter)
     */
    public int getDigit() {
        return digit;
    }
    
    public boolean isDigit() {
        return this != ENTER;
    }
    
    /**
     * Разбор текстового представления клавиши, пришедшего от драйвера клавиатуры.
     *
     * @param label "1".."4" или "Enter" (регистр для Enter не важен)
     * @return клавиша
     * @throws IllegalArgumentException если такой клавиши нет
     */
    public static Key fromLabel(String label) {
        if (label != null) {
            for (Key key : values()) {
                if (key.label.equalsIgnoreCase(label.trim())) {
                    return key;
                }
            }
        }
        throw new IllegalArgumentException("Неизвестная клавиша: " + label);
    }
    
    @Override
    public String toString() {
        return label;
    }
}
