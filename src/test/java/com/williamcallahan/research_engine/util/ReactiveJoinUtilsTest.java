package com.williamcallahan.research_engine.util;

import com.williamcallahan.research_engine.util.ReactiveJoinUtils.JoinOutcome;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReactiveJoinUtilsTest {

    @Test
    void joinAll_keepsSubmissionOrderAndIsolatesFailures() {
        Mono<String> slow = Mono.just("slow").delayElement(Duration.ofMillis(50));
        Mono<String> failing = Mono.error(new IllegalStateException("provider down"));
        Mono<String> empty = Mono.empty();

        StepVerifier.create(ReactiveJoinUtils.joinAll(List.of("slow", "failing", "empty"), List.of(slow, failing, empty)))
            .assertNext(outcomes -> {
                assertThat(outcomes).extracting(JoinOutcome::taskName).containsExactly("slow", "failing", "empty");
                assertThat(outcomes.get(0).isSuccess()).isTrue();
                assertThat(outcomes.get(0).value()).isEqualTo("slow");
                assertThat(outcomes.get(1).isSuccess()).isFalse();
                assertThat(outcomes.get(1).error()).hasMessage("provider down");
                assertThat(outcomes.get(2).isSuccess()).isTrue();
                assertThat(outcomes.get(2).valueOr("fallback")).isEqualTo("fallback");
            })
            .verifyComplete();
    }

    @Test
    void joinBoth_siblingFailureDoesNotCancelOtherTask() {
        AtomicBoolean completed = new AtomicBoolean();
        Mono<Integer> slow = Mono.just(42).delayElement(Duration.ofMillis(30)).doOnSuccess(v -> completed.set(true));
        Mono<String> failing = Mono.error(new RuntimeException("boom"));

        StepVerifier.create(ReactiveJoinUtils.joinBoth("slow", slow, "failing", failing))
            .assertNext(both -> {
                assertThat(both.getT1().valueOr(0)).isEqualTo(42);
                assertThat(both.getT2().isSuccess()).isFalse();
            })
            .verifyComplete();
        assertThat(completed).isTrue();
    }

    @Test
    void joinAll_emptyAndMismatchedInputs() {
        StepVerifier.create(ReactiveJoinUtils.<String>joinAll(List.of(), List.of()))
            .assertNext(outcomes -> assertThat(outcomes).isEmpty())
            .verifyComplete();

        assertThatThrownBy(() -> ReactiveJoinUtils.joinAll(List.of("a"), List.<Mono<String>>of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
