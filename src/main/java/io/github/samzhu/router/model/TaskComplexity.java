package io.github.samzhu.router.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任務複雜度分類
 *
 * @see io.github.samzhu.router.service.TaskClassifier
 */
public enum TaskComplexity {
    SIMPLE,
    REASONING,
    COMPLEX,
    MULTIMODAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
