package com.ryuqq.workflow.testkit.subject;

import com.ryuqq.workflow.core.spi.StateAccessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemorySubject 테스트.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@DisplayName("InMemorySubject 테스트")
class InMemorySubjectTest {

    @Test
    @DisplayName("persist() 는 현재 상태 필드를 스냅샷한다")
    void persist_스냅샷() {
        // given
        InMemorySubject subject = new InMemorySubject("s-1", "draft");

        // when
        subject.persist();
        subject.setState("submitted");

        // then
        assertThat(subject.getPersistedState()).isEqualTo("draft");
        assertThat(subject.isDirty()).isTrue();
        assertThat(subject.getPersistCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("이름 있는 상태 필드는 독립적으로 읽고 쓴다")
    void 이름_있는_상태_필드() {
        // given
        InMemorySubject subject = new InMemorySubject("s-1", "draft");
        StateAccessor<InMemorySubject> review = InMemorySubject.accessor("reviewState");

        // when
        review.write(subject, "approved");

        // then
        assertThat(review.fieldName()).isEqualTo("reviewState");
        assertThat(review.read(subject)).isEqualTo("approved");
        assertThat(InMemorySubject.accessor().read(subject)).isEqualTo("draft");
    }

    @Test
    @DisplayName("stampDate() 로 날짜 필드를 기록한다")
    void stampDate_기록() {
        // given
        InMemorySubject subject = new InMemorySubject("s-1", "draft");
        Instant at = Instant.parse("2024-05-01T00:00:00Z");

        // when
        subject.stampDate("submittedAt", at);

        // then
        assertThat(subject.getDate("submittedAt")).contains(at);
        assertThat(subject.getDate("completedAt")).isEmpty();
    }

    @Test
    @DisplayName("id가 비어있으면 생성할 수 없다")
    void 빈_id_거부() {
        assertThatThrownBy(() -> new InMemorySubject(" ", "draft"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
