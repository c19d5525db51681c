package io.github.samzhu.router.model;

/**
 * 評分後的候選後端
 */
public record ScoredBackend(
    BackendProfile backend,
    double score
) {
    public String name() {
        return backend.name();
    }
}
