package io.github.samzhu.router.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.github.samzhu.router.model.TaskComplexity;

class TaskClassifierTest {

    private final TaskClassifier classifier = new TaskClassifier();

    @ParameterizedTest
    @CsvSource({
        "'Draw a diagram of the login flow', MULTIMODAL",
        "'Please review this module', COMPLEX",
        "'Help me debug this stack trace', REASONING",
        "'What is a monad', SIMPLE",
        "'Refactor this chart renderer', MULTIMODAL",
        "'Write a unit test and refactor the class', COMPLEX"
    })
    void keywordsDecideInPriorityOrder(String prompt, TaskComplexity expected) {
        assertThat(classifier.classify(prompt, 10)).isEqualTo(expected);
    }

    @Test
    void keywordMatchingIgnoresCase() {
        assertThat(classifier.classify("OPTIMIZE the QUERY", 5)).isEqualTo(TaskComplexity.COMPLEX);
    }

    @Test
    void tokenEstimateDecidesWhenNoKeywordMatches() {
        assertThat(classifier.classify("hello there", 10_001)).isEqualTo(TaskComplexity.COMPLEX);
        assertThat(classifier.classify("hello there", 5_001)).isEqualTo(TaskComplexity.REASONING);
    }

    @Test
    void lengthDecidesLast() {
        assertThat(classifier.classify("hello there", 3)).isEqualTo(TaskComplexity.SIMPLE);
        assertThat(classifier.classify("a".repeat(200), 50)).isEqualTo(TaskComplexity.REASONING);
        assertThat(classifier.classify("a".repeat(600), 150)).isEqualTo(TaskComplexity.COMPLEX);
    }

    @Test
    void missingPromptIsSimple() {
        assertThat(classifier.classify(null, 0)).isEqualTo(TaskComplexity.SIMPLE);
    }
}
