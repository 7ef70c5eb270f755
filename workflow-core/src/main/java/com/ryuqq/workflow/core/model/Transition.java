package com.ryuqq.workflow.core.model;

import java.util.Optional;

/**
 * Workflow에 선언된 하나의 전이 (불변 record).
 *
 * <p>하나 이상의 출발 상태(또는 와일드카드)에서 하나의 도착 상태로 향하는 이름 있는 간선입니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>name:</strong> 전이 이름 (Workflow 내 고유)</li>
 *   <li><strong>source:</strong> 출발 상태 ({@link Source.Specific} 또는 {@link Source.Any})</li>
 *   <li><strong>destination:</strong> 도착 상태 (와일드카드 불가)</li>
 *   <li><strong>dateField:</strong> 전이 시각을 기록할 Subject 필드명 (선택, null 가능)</li>
 *   <li><strong>label:</strong> UI 표시용 라벨 (선택, null 가능)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Transition submit = Transition.named("submit")
 *     .from("draft")
 *     .to("submitted")
 *     .dateField("submittedAt")
 *     .build();
 *
 * Transition reject = Transition.named("reject").fromAny().to("rejected").build();
 * </pre>
 *
 * @param name 전이 이름
 * @param source 출발 상태
 * @param destination 도착 상태
 * @param dateField 전이 시각 기록 필드 (null 가능)
 * @param label 라벨 (null 가능)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Transition(
    String name,
    Source source,
    String destination,
    String dateField,
    String label
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name, source, destination이 null이거나 빈 문자열인 경우
     */
    public Transition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null (transition: " + name + ")");
        }
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank (transition: " + name + ")");
        }
        if (dateField != null && dateField.isBlank()) {
            throw new IllegalArgumentException("dateField cannot be blank (transition: " + name + ")");
        }
        // label은 null 허용
    }

    /**
     * 단일 출발 상태 전이 생성.
     *
     * @param name 전이 이름
     * @param source 출발 상태
     * @param destination 도착 상태
     * @return Transition 인스턴스
     */
    public static Transition of(String name, String source, String destination) {
        return new Transition(name, Source.of(source), destination, null, null);
    }

    /**
     * 와일드카드 출발 전이 생성.
     *
     * @param name 전이 이름
     * @param destination 도착 상태
     * @return Transition 인스턴스
     */
    public static Transition fromAny(String name, String destination) {
        return new Transition(name, Source.any(), destination, null, null);
    }

    /**
     * Builder 시작.
     *
     * @param name 전이 이름
     * @return Builder
     */
    public static Builder named(String name) {
        return new Builder(name);
    }

    /**
     * 현재 상태에서 이 전이를 시작할 수 있는지 확인.
     *
     * @param state 현재 상태
     * @return source가 와일드카드이거나 state를 포함하면 true
     */
    public boolean matchesSource(String state) {
        return source.matches(state);
    }

    /**
     * dateField 조회.
     *
     * @return dateField (없으면 empty)
     */
    public Optional<String> dateFieldOptional() {
        return Optional.ofNullable(dateField);
    }

    /**
     * label 조회.
     *
     * @return label (없으면 empty)
     */
    public Optional<String> labelOptional() {
        return Optional.ofNullable(label);
    }

    /**
     * Transition Builder.
     */
    public static final class Builder {

        private final String name;
        private Source source;
        private String destination;
        private String dateField;
        private String label;

        private Builder(String name) {
            this.name = name;
        }

        public Builder from(String... states) {
            this.source = Source.of(states);
            return this;
        }

        public Builder fromAny() {
            this.source = Source.any();
            return this;
        }

        public Builder to(String destination) {
            this.destination = destination;
            return this;
        }

        public Builder dateField(String dateField) {
            this.dateField = dateField;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        /**
         * Transition 생성.
         *
         * @return Transition 인스턴스
         * @throws IllegalArgumentException 필수 필드가 누락된 경우
         */
        public Transition build() {
            return new Transition(name, source, destination, dateField, label);
        }
    }
}
