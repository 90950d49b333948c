package ru.vavtech.atmfsm.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import ru.vavtech.atmfsm.model.AtmEvent;
import ru.vavtech.atmfsm.model.AuthPhase;
import ru.vavtech.atmfsm.model.Key;
import ru.vavtech.atmfsm.model.MachineState;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit тесты функции переходов банкомата
 */
@DisplayName("Тесты автомата банкомата")
class AtmStateMachineTest {

    private final PinHasher pinHasher = new Sha256PinHasher();

    private AtmStateMachine stateMachine;

    private long pinDigest;

    @BeforeEach
    void setUp() {
        stateMachine = new AtmStateMachine(pinHasher);
        pinDigest = pinHasher.hash(List.of(Key.ONE, Key.TWO, Key.THREE, Key.FOUR));
    }

    @Test
    @DisplayName("Вставка карты в режиме ожидания начинает ввод PIN")
    void swipeCard_WhileWaiting() {
        // Given
        MachineState start = MachineState.initial(10);

        // When
        MachineState end = stateMachine.nextState(start, AtmEvent.swipeCard(1234));

        // Then
        assertThat(end).isEqualTo(new MachineState(10, AuthPhase.authenticating(1234), List.of()));
    }

    @Test
    @DisplayName("Повторная вставка карты сохраняет набранные цифры")
    void swipeCard_AgainPartWayThrough_KeepsKeystrokes() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.authenticating(1234), List.of(Key.ONE, Key.THREE));

        // When
        Transition transition = stateMachine.apply(start, AtmEvent.swipeCard(1234));

        // Then
        assertThat(transition.state()).isEqualTo(start);
        assertThat(transition.outcome()).isEqualTo(TransitionOutcome.CARD_RESWIPED);
    }

    @Test
    @DisplayName("Повторная вставка другой карты меняет дайджест, но не буфер")
    void swipeCard_DifferentDigestWhileAuthenticating() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.authenticating(1234), List.of(Key.TWO));

        // When
        MachineState end = stateMachine.nextState(start, AtmEvent.swipeCard(5678));

        // Then
        assertThat(end.phase()).isEqualTo(AuthPhase.authenticating(5678));
        assertThat(end.keystrokes()).containsExactly(Key.TWO);
    }

    @Test
    @DisplayName("Вставка карты после аутентификации начинает новую сессию с пустым буфером")
    void swipeCard_WhileAuthenticated_ClearsBuffer() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.AUTHENTICATED, List.of(Key.ONE));

        // When
        Transition transition = stateMachine.apply(start, AtmEvent.swipeCard(42));

        // Then
        assertThat(transition.state()).isEqualTo(new MachineState(10, AuthPhase.authenticating(42), List.of()));
        assertThat(transition.outcome()).isEqualTo(TransitionOutcome.CARD_ACCEPTED);
    }

    @ParameterizedTest
    @EnumSource(Key.class)
    @DisplayName("Нажатия клавиш до вставки карты игнорируются")
    void pressKey_BeforeSwipe_IsIgnored(Key key) {
        // Given
        MachineState start = MachineState.initial(10);

        // When
        Transition transition = stateMachine.apply(start, AtmEvent.pressKey(key));

        // Then
        assertThat(transition.state()).isEqualTo(start);
        assertThat(transition.outcome()).isEqualTo(TransitionOutcome.KEY_IGNORED);
    }

    @Test
    @DisplayName("Цифры PIN накапливаются в буфере")
    void pressKey_PinDigits_AreBuffered() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.authenticating(1234), List.of());

        // When
        MachineState afterOne = stateMachine.nextState(start, AtmEvent.pressKey(Key.ONE));
        MachineState afterTwo = stateMachine.nextState(afterOne, AtmEvent.pressKey(Key.TWO));

        // Then
        assertThat(afterOne).isEqualTo(new MachineState(10, AuthPhase.authenticating(1234), List.of(Key.ONE)));
        assertThat(afterTwo).isEqualTo(
                new MachineState(10, AuthPhase.authenticating(1234), List.of(Key.ONE, Key.TWO)));
        // Исходный снимок не изменился
        assertThat(start.keystrokes()).isEmpty();
    }

    @Test
    @DisplayName("Неверный PIN возвращает банкомат в ожидание")
    void enterWrongPin() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.authenticating(pinDigest),
                List.of(Key.THREE, Key.THREE, Key.THREE, Key.THREE));

        // When
        Transition transition = stateMachine.apply(start, AtmEvent.pressKey(Key.ENTER));

        // Then
        assertThat(transition.state()).isEqualTo(MachineState.initial(10));
        assertThat(transition.outcome()).isEqualTo(TransitionOutcome.PIN_REJECTED);
    }

    @Test
    @DisplayName("PIN с переставленными цифрами не принимается")
    void enterPinInWrongOrder() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.authenticating(pinDigest),
                List.of(Key.FOUR, Key.THREE, Key.TWO, Key.ONE));

        // When
        MachineState end = stateMachine.nextState(start, AtmEvent.pressKey(Key.ENTER));

        // Then
        assertThat(end.phase()).isEqualTo(AuthPhase.WAITING);
    }

    @Test
    @DisplayName("Верный PIN переводит в аутентифицированное состояние")
    void enterCorrectPin() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.authenticating(pinDigest),
                List.of(Key.ONE, Key.TWO, Key.THREE, Key.FOUR));

        // When
        Transition transition = stateMachine.apply(start, AtmEvent.pressKey(Key.ENTER));

        // Then
        assertThat(transition.state()).isEqualTo(new MachineState(10, AuthPhase.AUTHENTICATED, List.of()));
        assertThat(transition.outcome()).isEqualTo(TransitionOutcome.PIN_ACCEPTED);
    }

    @Test
    @DisplayName("Цифры суммы накапливаются в буфере")
    void enterWithdrawalDigits() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.AUTHENTICATED, List.of(Key.ONE));

        // When
        MachineState end = stateMachine.nextState(start, AtmEvent.pressKey(Key.FOUR));

        // Then
        assertThat(end).isEqualTo(new MachineState(10, AuthPhase.AUTHENTICATED, List.of(Key.ONE, Key.FOUR)));
    }

    @Test
    @DisplayName("Запрос больше остатка отклоняется без изменения наличных")
    void withdrawTooMuch() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.AUTHENTICATED, List.of(Key.ONE, Key.FOUR));

        // When
        Transition transition = stateMachine.apply(start, AtmEvent.pressKey(Key.ENTER));

        // Then
        assertThat(transition.state()).isEqualTo(MachineState.initial(10));
        assertThat(transition.outcome()).isEqualTo(TransitionOutcome.INSUFFICIENT_FUNDS);
        assertThat(transition.dispensed()).isZero();
    }

    @Test
    @DisplayName("Допустимая сумма выдается")
    void withdrawAcceptableAmount() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.AUTHENTICATED, List.of(Key.ONE));

        // When
        Transition transition = stateMachine.apply(start, AtmEvent.pressKey(Key.ENTER));

        // Then
        assertThat(transition.state()).isEqualTo(MachineState.initial(9));
        assertThat(transition.outcome()).isEqualTo(TransitionOutcome.CASH_DISPENSED);
        assertThat(transition.dispensed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Можно снять все наличные до нуля")
    void withdrawExactlyAllCash() {
        // Given
        MachineState start = new MachineState(12, AuthPhase.AUTHENTICATED, List.of(Key.ONE, Key.TWO));

        // When
        MachineState end = stateMachine.nextState(start, AtmEvent.pressKey(Key.ENTER));

        // Then
        assertThat(end).isEqualTo(MachineState.initial(0));
    }

    @Test
    @DisplayName("Enter без суммы снимает ноль и завершает сессию")
    void withdrawEmptyAmount() {
        // Given
        MachineState start = new MachineState(10, AuthPhase.AUTHENTICATED, List.of());

        // When
        Transition transition = stateMachine.apply(start, AtmEvent.pressKey(Key.ENTER));

        // Then
        assertThat(transition.state()).isEqualTo(MachineState.initial(10));
        assertThat(transition.outcome()).isEqualTo(TransitionOutcome.CASH_DISPENSED);
        assertThat(transition.dispensed()).isZero();
    }

    @Test
    @DisplayName("Полный сценарий: карта, PIN, отказ, повторная сессия и выдача")
    void fullScenario() {
        // Given
        MachineState state = MachineState.initial(10);

        // When - вставка карты
        state = stateMachine.nextState(state, AtmEvent.swipeCard(pinDigest));

        // Then
        assertThat(state).isEqualTo(new MachineState(10, AuthPhase.authenticating(pinDigest), List.of()));

        // When - ввод PIN 1234
        state = press(state, Key.ONE, Key.TWO, Key.THREE, Key.FOUR, Key.ENTER);

        // Then
        assertThat(state).isEqualTo(new MachineState(10, AuthPhase.AUTHENTICATED, List.of()));

        // When - запрос 14 при остатке 10
        state = press(state, Key.ONE, Key.FOUR, Key.ENTER);

        // Then
        assertThat(state).isEqualTo(MachineState.initial(10));

        // When - новая сессия и запрос 1
        state = stateMachine.nextState(state, AtmEvent.swipeCard(pinDigest));
        state = press(state, Key.ONE, Key.TWO, Key.THREE, Key.FOUR, Key.ENTER);
        state = press(state, Key.ONE, Key.ENTER);

        // Then
        assertThat(state).isEqualTo(MachineState.initial(9));
    }

    private MachineState press(MachineState state, Key... keys) {
        MachineState current = state;
        for (Key key : keys) {
            current = stateMachine.nextState(current, AtmEvent.pressKey(key));
        }
        return current;
    }
}
