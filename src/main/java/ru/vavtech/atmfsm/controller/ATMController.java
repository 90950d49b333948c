package ru.vavtech.atmfsm.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.vavtech.atmfsm.model.Key;
import ru.vavtech.atmfsm.model.PinDigestResponse;
import ru.vavtech.atmfsm.model.PinEnrollmentRequest;
import ru.vavtech.atmfsm.model.SwipeCardRequest;
import ru.vavtech.atmfsm.service.AtmSessionService;
import ru.vavtech.atmfsm.service.JournalEntry;
import ru.vavtech.atmfsm.service.SessionResult;

import java.util.List;

/**
 * REST контроллер банкомата.
 * Играет роль драйвера карт-ридера и клавиатуры: каждое обращение - одно событие автомата.
 */
@RestController
@RequestMapping("/api/atm")
@RequiredArgsConstructor
public class ATMController {
    
    private final AtmSessionService atmSessionService;
    
    /**
     * Вставка карты
     */
    @PostMapping("/card")
    public ResponseEntity<SessionResult> swipeCard(@RequestBody @Valid SwipeCardRequest request) {
        return ResponseEntity.ok(atmSessionService.swipeCard(request.getPinDigest()));
    }
    
    /**
     * Вычисление дайджеста PIN для новой карты
     */
    @PostMapping("/card/digest")
    public ResponseEntity<PinDigestResponse> enrollPin(@RequestBody @Valid PinEnrollmentRequest request) {
        return ResponseEntity.ok(new PinDigestResponse(atmSessionService.enrollPin(request.getPin())));
    }
    
    /**
     * Нажатие клавиши: 1, 2, 3, 4 или Enter
     */
    @PostMapping("/keys/{label}")
    public ResponseEntity<SessionResult> pressKey(@PathVariable("label") String label) {
        return ResponseEntity.ok(atmSessionService.pressKey(Key.fromLabel(label)));
    }
    
    @GetMapping("/state")
    public ResponseEntity<SessionResult> getState() {
        return ResponseEntity.ok(atmSessionService.getCurrentResult());
    }
    
    /**
     * Журнал последних переходов (для мониторинга)
     */
    @GetMapping("/journal")
    public ResponseEntity<List<JournalEntry>> getJournal() {
        return ResponseEntity.ok(atmSessionService.getJournal());
    }
    
    /**
     * Проверка работоспособности банкомата
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
