package io.github.samzhu.router.service;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import io.github.samzhu.router.model.TaskComplexity;

/**
 * 任務複雜度分類（關鍵字啟發式，不呼叫模型）
 *
 * <p>判斷順序：
 * <ol>
 *   <li>關鍵字（不分大小寫，子字串比對）：multimodal → complex → reasoning → simple</li>
 *   <li>概估 Token 數：&gt; 10000 為 complex，&gt; 5000 為 reasoning</li>
 *   <li>Prompt 長度：&lt; 100 字元為 simple，&lt; 500 為 reasoning，其餘為 complex</li>
 * </ol>
 */
@Component
public class TaskClassifier {

    private static final List<String> MULTIMODAL_TERMS = List.of(
        "visualize", "diagram", "chart", "image", "screenshot");
    private static final List<String> COMPLEX_TERMS = List.of(
        "review", "architecture", "design pattern", "refactor", "optimize", "comprehensive");
    private static final List<String> REASONING_TERMS = List.of(
        "debug", "test", "unit test", "algorithm", "logic", "calculate");
    private static final List<String> SIMPLE_TERMS = List.of(
        "what is", "explain briefly", "todo", "list", "simple", "quick");

    private static final int COMPLEX_TOKEN_THRESHOLD = 10_000;
    private static final int REASONING_TOKEN_THRESHOLD = 5_000;
    private static final int SIMPLE_LENGTH_LIMIT = 100;
    private static final int REASONING_LENGTH_LIMIT = 500;

    public TaskComplexity classify(String prompt, int approxTokens) {
        String text = prompt == null ? "" : prompt.toLowerCase(Locale.ROOT);

        if (containsAny(text, MULTIMODAL_TERMS)) {
            return TaskComplexity.MULTIMODAL;
        }
        if (containsAny(text, COMPLEX_TERMS)) {
            return TaskComplexity.COMPLEX;
        }
        if (containsAny(text, REASONING_TERMS)) {
            return TaskComplexity.REASONING;
        }
        if (containsAny(text, SIMPLE_TERMS)) {
            return TaskComplexity.SIMPLE;
        }

        if (approxTokens > COMPLEX_TOKEN_THRESHOLD) {
            return TaskComplexity.COMPLEX;
        }
        if (approxTokens > REASONING_TOKEN_THRESHOLD) {
            return TaskComplexity.REASONING;
        }

        if (text.length() < SIMPLE_LENGTH_LIMIT) {
            return TaskComplexity.SIMPLE;
        }
        if (text.length() < REASONING_LENGTH_LIMIT) {
            return TaskComplexity.REASONING;
        }
        return TaskComplexity.COMPLEX;
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
