/**
 * Join helpers for fanning out independent reactive tasks
 * Every task runs to completion or failure; one failure never cancels its siblings
 *
 * @author William Callahan
 */

package com.williamcallahan.research_engine.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.util.ArrayList;
import java.util.List;

public final class ReactiveJoinUtils {

    private static final Logger logger = LoggerFactory.getLogger(ReactiveJoinUtils.class);

    private ReactiveJoinUtils() {
    }

    /**
     * Outcome of one task in a join: either a value (possibly {@code null} for an empty source) or an error.
     */
    public record JoinOutcome<T>(String taskName, T value, Throwable error) {

        public static <T> JoinOutcome<T> success(String taskName, T value) {
            return new JoinOutcome<>(taskName, value, null);
        }

        public static <T> JoinOutcome<T> failure(String taskName, Throwable error) {
            return new JoinOutcome<>(taskName, null, error);
        }

        public boolean isSuccess() {
            return error == null;
        }

        public T valueOr(T fallback) {
            return isSuccess() && value != null ? value : fallback;
        }
    }

    /**
     * Wraps a task so it always completes with exactly one {@link JoinOutcome}.
     */
    public static <T> Mono<JoinOutcome<T>> capture(String taskName, Mono<T> task) {
        return Mono.defer(() -> task)
            .map(value -> JoinOutcome.success(taskName, value))
            .defaultIfEmpty(JoinOutcome.success(taskName, null))
            .onErrorResume(e -> {
                logger.debug("Task '{}' failed inside join: {}", taskName, e.getMessage());
                return Mono.just(JoinOutcome.failure(taskName, e));
            });
    }

    /**
     * Runs two heterogeneous tasks concurrently and waits for both.
     */
    public static <A, B> Mono<Tuple2<JoinOutcome<A>, JoinOutcome<B>>> joinBoth(String firstName, Mono<A> first,
                                                                                String secondName, Mono<B> second) {
        return Mono.zip(capture(firstName, first), capture(secondName, second));
    }

    /**
     * Runs every task concurrently and emits their outcomes in submission order once all have settled.
     */
    public static <T> Mono<List<JoinOutcome<T>>> joinAll(List<String> names, List<Mono<T>> tasks) {
        if (names.size() != tasks.size()) {
            throw new IllegalArgumentException("Each joined task needs a name");
        }
        if (tasks.isEmpty()) {
            return Mono.just(List.of());
        }
        List<Mono<JoinOutcome<T>>> captured = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            captured.add(capture(names.get(i), tasks.get(i)));
        }
        return Flux.mergeSequential(captured).collectList();
    }
}
