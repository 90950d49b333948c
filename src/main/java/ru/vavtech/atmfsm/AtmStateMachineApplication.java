package ru.vavtech.atmfsm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AtmStateMachineApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(AtmStateMachineApplication.class, args);
    }
}
