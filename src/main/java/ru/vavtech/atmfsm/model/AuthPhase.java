package ru.vavtech.atmfsm.model;

/**
 * Фаза аутентификации клиента.
 */
public sealed interface AuthPhase
        permits AuthPhase.Waiting, AuthPhase.Authenticating, AuthPhase.Authenticated {
    
    AuthPhase WAITING = new Waiting();
    AuthPhase AUTHENTICATED = new Authenticated();
    
    Stage stage();
    
    enum Stage {
        WAITING,
        AUTHENTICATING,
        AUTHENTICATED
    }
    
    static AuthPhase authenticating(long pinDigest) {
        return new Authenticating(pinDigest);
    }
    
    /**
     * Карты нет, банкомат ждет клиента
     */
    record Waiting() implements AuthPhase {
        
        @Override
        public Stage stage() {
            return Stage.WAITING;
        }
    }
    
    /**
     * Карта вставлена, клиент вводит PIN.
     * pinDigest - дайджест правильного PIN с карты, а не того, что набрано.
     */
    record Authenticating(long pinDigest) implements AuthPhase {
        
        @Override
        public Stage stage() {
            return Stage.AUTHENTICATING;
        }
    }
    
    /**
     * PIN подтвержден, клиент вводит сумму снятия
     */
    record Authenticated() implements AuthPhase {
        
        @Override
        public Stage stage() {
            return Stage.AUTHENTICATED;
        }
    }
}
