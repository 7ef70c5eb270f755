package com.ryuqq.workflow.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Transition의 출발 상태.
 *
 * <p>Source는 두 가지 경우 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Specific}: 선언된 하나 이상의 상태</li>
 *   <li>{@link Any}: 와일드카드 (모든 상태에서 출발 가능)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 와일드카드를 문자열 sentinel 없이 표현합니다.
 * 와일드카드는 출발 상태로만 사용되며 도착 상태가 될 수 없습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Source draft = Source.of("draft");
 * Source reviewable = Source.of("draft", "submitted");
 * Source anywhere = Source.any();
 *
 * draft.matches("draft");        // true
 * anywhere.matches("completed"); // true
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public sealed interface Source permits Source.Specific, Source.Any {

    /**
     * 주어진 상태가 이 Source와 일치하는지 확인.
     *
     * @param state 현재 상태
     * @return 와일드카드이거나, 상태가 Source에 포함되면 true
     */
    boolean matches(String state);

    /**
     * 와일드카드 여부.
     *
     * @return 와일드카드이면 true
     */
    default boolean isAny() {
        return this instanceof Any;
    }

    /**
     * 특정 상태들로 Source 생성.
     *
     * @param states 출발 상태 (1개 이상)
     * @return Specific Source
     * @throws IllegalArgumentException states가 비어있거나 null 요소를 포함하는 경우
     */
    static Source of(String... states) {
        if (states == null) {
            throw new IllegalArgumentException("states cannot be null");
        }
        return new Specific(Arrays.asList(states));
    }

    /**
     * 와일드카드 Source.
     *
     * @return Any Source
     */
    static Source any() {
        return Any.INSTANCE;
    }

    /**
     * 선언된 상태 집합 (선언 순서 유지).
     *
     * @param states 출발 상태 집합
     */
    record Specific(Set<String> states) implements Source {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException states가 null이거나 비어있거나 빈 상태명을 포함하는 경우
         */
        public Specific {
            if (states == null || states.isEmpty()) {
                throw new IllegalArgumentException("states cannot be null or empty");
            }
            for (String state : states) {
                if (state == null || state.isBlank()) {
                    throw new IllegalArgumentException("source state cannot be null or blank");
                }
            }
            states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        }

        /**
         * 컬렉션으로부터 생성.
         *
         * @param states 출발 상태
         */
        public Specific(Collection<String> states) {
            this(states == null ? null : new LinkedHashSet<>(states));
        }

        @Override
        public boolean matches(String state) {
            return states.contains(state);
        }

        @Override
        public String toString() {
            return states.size() == 1 ? states.iterator().next() : states.toString();
        }
    }

    /**
     * 와일드카드 (모든 상태와 일치).
     */
    record Any() implements Source {

        private static final Any INSTANCE = new Any();

        @Override
        public boolean matches(String state) {
            return true;
        }

        @Override
        public String toString() {
            return "*";
        }
    }
}
