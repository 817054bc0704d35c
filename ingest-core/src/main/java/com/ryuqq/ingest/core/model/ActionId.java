package com.ryuqq.ingest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.UUID;

/**
 * Unique identifier of one indexing action.
 *
 * <p>The search backend uses it as the document id. A fresh ActionId is
 * generated for every publish and is never reused, so publishing the same
 * document twice yields two independently indexed documents.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class ActionId {

    private final UUID value;

    private ActionId(UUID value) {
        if (value == null) {
            throw new IllegalArgumentException("ActionId cannot be null");
        }
        this.value = value;
    }

    /**
     * 새 ActionId 생성 (random UUID).
     *
     * @return 새 ActionId
     */
    public static ActionId generate() {
        return new ActionId(UUID.randomUUID());
    }

    /**
     * UUID로부터 ActionId 생성.
     *
     * @param value UUID 값
     * @return ActionId 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static ActionId of(UUID value) {
        return new ActionId(value);
    }

    /**
     * 문자열로부터 ActionId 생성.
     *
     * @param value UUID 문자열
     * @return ActionId 인스턴스
     * @throws IllegalArgumentException null, blank 또는 UUID 형식이 아닌 경우
     */
    @JsonCreator
    public static ActionId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ActionId cannot be null or blank");
        }
        try {
            return new ActionId(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("ActionId must be a UUID (current: " + value + ")", e);
        }
    }

    public UUID getValue() {
        return value;
    }

    @JsonValue
    public String asString() {
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionId actionId = (ActionId) o;
        return value.equals(actionId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ActionId{" + value + '}';
    }
}
