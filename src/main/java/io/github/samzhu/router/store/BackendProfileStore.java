package io.github.samzhu.router.store;

import java.util.List;
import java.util.Optional;

import io.github.samzhu.router.model.BackendProfile;

/**
 * 後端設定檔持久層（外部協作者）
 */
public interface BackendProfileStore {

    List<BackendProfile> findAll();

    Optional<BackendProfile> findByName(String name);
}
