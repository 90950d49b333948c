package ru.vavtech.atmfsm.model;

import java.util.Objects;

/**
 * Внешнее событие, поступающее в банкомат.
 * Каждый переход автомата вызывается ровно одним событием.
 */
public sealed interface AtmEvent permits AtmEvent.SwipeCard, AtmEvent.PressKey {
    
    /**
     * Тип события, по которому автомат выполняет исчерпывающий switch
     */
    Type type();
    
    enum Type {
        SWIPE_CARD,
        PRESS_KEY
    }
    
    static AtmEvent swipeCard(long pinDigest) {
        return new SwipeCard(pinDigest);
    }
    
    static AtmEvent pressKey(Key key) {
        return new PressKey(key);
    }
    
    /**
     * Карта вставлена. Несет дайджест правильного PIN, записанный на карте.
     */
    record SwipeCard(long pinDigest) implements AtmEvent {
        
        @Override
        public Type type() {
            return Type.SWIPE_CARD;
        }
    }
    
    /**
     * Нажатие одной клавиши
     */
    record PressKey(Key key) implements AtmEvent {
        
        public PressKey {
            Objects.requireNonNull(key, "Клавиша не может быть null");
        }
        
        @Override
        public Type type() {
            return Type.PRESS_KEY;
        }
    }
}
