package ru.vavtech.atmfsm.engine;

import ru.vavtech.atmfsm.model.Key;

import java.util.List;

/**
 * Необратимая функция хеширования последовательности клавиш.
 * Результат сравнивается только на равенство с дайджестом с карты,
 * поэтому функция обязана быть детерминированной и учитывать порядок клавиш.
 */
public interface PinHasher {
    
    long hash(List<Key> keys);
}
