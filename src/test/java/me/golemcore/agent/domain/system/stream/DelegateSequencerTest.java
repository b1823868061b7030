package me.golemcore.agent.domain.system.stream;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DelegateSequencerTest {

    @Test
    void shouldEmitPhasesInChainOrderEvenWhenFirstIsSlower() {
        DelegateSequencer<String> sequencer = new DelegateSequencer<>();
        sequencer.chain(Flux.just("a1", "a2").delayElements(Duration.ofMillis(30)));
        sequencer.chain(Flux.just("b1"));
        sequencer.done();

        StepVerifier.create(sequencer.sequence())
                .expectNext("a1", "a2", "b1")
                .verifyComplete();
    }

    @Test
    void shouldAcceptPhasesChainedAfterSubscription() {
        DelegateSequencer<Integer> sequencer = new DelegateSequencer<>();
        sequencer.chain(Flux.just(1, 2));

        StepVerifier.create(sequencer.sequence())
                .expectNext(1, 2)
                .then(() -> sequencer.chain(Flux.just(3)))
                .expectNext(3)
                .expectNoEvent(Duration.ofMillis(50))
                .then(sequencer::done)
                .verifyComplete();
    }

    @Test
    void shouldNotCompleteBeforeDone() {
        DelegateSequencer<Integer> sequencer = new DelegateSequencer<>();
        sequencer.chain(Flux.just(1));

        StepVerifier.create(sequencer.sequence())
                .expectNext(1)
                .expectNoEvent(Duration.ofMillis(50))
                .thenCancel()
                .verify();
        assertFalse(sequencer.isDone());
    }

    @Test
    void shouldCompleteEmptyWhenDoneWithoutPhases() {
        DelegateSequencer<String> sequencer = new DelegateSequencer<>();
        sequencer.done();

        StepVerifier.create(sequencer.sequence()).verifyComplete();
    }

    @Test
    void shouldRejectChainAfterDone() {
        DelegateSequencer<String> sequencer = new DelegateSequencer<>();
        sequencer.done();

        assertThrows(IllegalStateException.class, () -> sequencer.chain(Flux.just("late")));
    }

    @Test
    void shouldTreatRepeatedDoneAsNoOp() {
        DelegateSequencer<String> sequencer = new DelegateSequencer<>();
        sequencer.chain(Flux.just("x"));
        sequencer.done();
        sequencer.done();

        assertTrue(sequencer.isDone());
        StepVerifier.create(sequencer.sequence())
                .expectNext("x")
                .verifyComplete();
    }

    @Test
    void shouldTerminateOnPhaseErrorWithoutSubscribingLaterPhases() {
        DelegateSequencer<String> sequencer = new DelegateSequencer<>();
        boolean[] laterSubscribed = new boolean[1];
        sequencer.chain(Flux.just("first"));
        sequencer.chain(Flux.error(new IllegalArgumentException("boom")));
        sequencer.chain(Flux.just("never").doOnSubscribe(s -> laterSubscribed[0] = true));
        sequencer.done();

        StepVerifier.create(sequencer.sequence())
                .expectNext("first")
                .expectErrorMessage("boom")
                .verify();
        assertFalse(laterSubscribed[0]);
    }
}
