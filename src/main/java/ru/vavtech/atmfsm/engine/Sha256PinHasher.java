package ru.vavtech.atmfsm.engine;

import org.springframework.stereotype.Component;
import ru.vavtech.atmfsm.model.Key;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Хеширование PIN через SHA-256.
 * Каждая клавиша кодируется своим текстовым представлением и разделителем,
 * дайджестом считаются первые 8 байт результата (big-endian).
 */
@Component
public class Sha256PinHasher implements PinHasher {
    
    private static final String ALGORITHM = "SHA-256";
    private static final char SEPARATOR = '\u001F';
    
    @Override
    public long hash(List<Key> keys) {
        MessageDigest digest = newDigest();
        StringBuilder canonical = new StringBuilder();
        for (Key key : keys) {
            canonical.append(key.getLabel()).append(SEPARATOR);
        }
        byte[] hash = digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(hash, 0, Long.BYTES).getLong();
    }
    
    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 обязателен для любой реализации JDK
            throw new IllegalStateException("Алгоритм " + ALGORITHM + " недоступен", e);
        }
    }
}
