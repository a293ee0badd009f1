package com.phillippitts.granupose.service.engine.watchdog;

import com.phillippitts.granupose.config.engine.EngineWatchdogProperties;
import com.phillippitts.granupose.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EngineWatchdogTest {

    private EngineWatchdogProperties props;
    private MutableClock clock;
    private EngineWatchdog watchdog;

    @BeforeEach
    void setUp() {
        props = new EngineWatchdogProperties();
        props.setRestartBaseDelayMs(1000);
        props.setRestartMaxDelayMs(30000);
        props.setRestartMaxAttempts(5);
        props.setRestartBackoffResetMs(120000);
        clock = new MutableClock();
        watchdog = new EngineWatchdog(props, clock);
    }

    @Test
    void delaysDoubleAndCapAtMax() {
        assertThat(watchdog.delayForAttempt(1)).isEqualTo(1000);
        assertThat(watchdog.delayForAttempt(2)).isEqualTo(2000);
        assertThat(watchdog.delayForAttempt(3)).isEqualTo(4000);
        assertThat(watchdog.delayForAttempt(5)).isEqualTo(16000);
        assertThat(watchdog.delayForAttempt(6)).isEqualTo(30000);
        assertThat(watchdog.delayForAttempt(200)).isEqualTo(30000);
    }

    @Test
    void consecutiveExitsWalkTheBackoffSchedule() {
        EngineWatchdog.RestartDecision first = watchdog.onUnexpectedExit();
        clock.advanceMillis(5000);
        EngineWatchdog.RestartDecision second = watchdog.onUnexpectedExit();

        assertThat(first).isEqualTo(new EngineWatchdog.RestartDecision(false, 1, 1000));
        assertThat(second).isEqualTo(new EngineWatchdog.RestartDecision(false, 2, 2000));
        assertThat(watchdog.attempts()).isEqualTo(2);
    }

    @Test
    void exhaustsAfterMaxAttemptsWithoutIncrementingFurther() {
        for (int i = 1; i <= 5; i++) {
            assertThat(watchdog.onUnexpectedExit().exhausted()).isFalse();
            clock.advanceMillis(1000);
        }

        EngineWatchdog.RestartDecision decision = watchdog.onUnexpectedExit();

        assertThat(decision.exhausted()).isTrue();
        assertThat(decision.attempt()).isEqualTo(5);
        assertThat(decision.delayMs()).isZero();
        assertThat(watchdog.attempts()).isEqualTo(5);
    }

    @Test
    void quietPeriodLongerThanResetWindowStartsOver() {
        watchdog.onUnexpectedExit();
        watchdog.onUnexpectedExit();
        clock.advanceMillis(120001);

        EngineWatchdog.RestartDecision decision = watchdog.onUnexpectedExit();

        assertThat(decision.attempt()).isEqualTo(1);
        assertThat(decision.delayMs()).isEqualTo(1000);
    }

    @Test
    void gapExactlyAtResetWindowKeepsCounting() {
        watchdog.onUnexpectedExit();
        clock.advanceMillis(120000);

        assertThat(watchdog.onUnexpectedExit().attempt()).isEqualTo(2);
    }

    @Test
    void resetClearsCounter() {
        watchdog.onUnexpectedExit();
        watchdog.onUnexpectedExit();

        watchdog.reset();

        assertThat(watchdog.attempts()).isZero();
        assertThat(watchdog.onUnexpectedExit().attempt()).isEqualTo(1);
    }

    @Test
    void propertiesAreClampedIntoSafeRanges() {
        props.setRestartBaseDelayMs(1);
        props.setRestartMaxDelayMs(10_000_000);
        props.setRestartMaxAttempts(0);
        props.setRestartBackoffResetMs(5);

        assertThat(props.getRestartBaseDelayMs()).isEqualTo(250);
        assertThat(props.getRestartMaxDelayMs()).isEqualTo(300_000);
        assertThat(props.getRestartMaxAttempts()).isEqualTo(1);
        assertThat(props.getRestartBackoffResetMs()).isEqualTo(10_000);
    }
}
