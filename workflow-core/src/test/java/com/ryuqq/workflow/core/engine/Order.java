package com.ryuqq.workflow.core.engine;

import com.ryuqq.workflow.core.spi.Subject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 테스트용 Subject.
 *
 * <p>상태 변경 후 persist() 호출 여부를 {@code saved}로 확인할 수 있으며,
 * 훅 호출 순서는 {@code calls}에 기록됩니다.</p>
 */
class Order implements Subject {

    private String state;
    boolean saved = true;
    int persistCount;

    boolean allowSubmit = true;
    boolean allowLeavingDraft = true;
    boolean allowEnteringSubmitted = true;

    final List<String> calls = new ArrayList<>();
    final Map<String, Instant> dates = new HashMap<>();

    Order() {
        this("draft");
    }

    Order(String state) {
        this.state = state;
    }

    String getState() {
        return state;
    }

    void setState(String state) {
        this.saved = false;
        this.state = state;
    }

    @Override
    public void persist() {
        saved = true;
        persistCount++;
        calls.add("persist");
    }

    @Override
    public void stampDate(String dateField, Instant at) {
        dates.put(dateField, at);
    }
}
