package com.example.giveaway_system.repository;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

/**
 * 워크스페이스별 JSON 문서 저장소.
 * 문서는 항상 통째로 읽고 씁니다.
 */
public interface ModuleDataStore {

    <T> T load(String fileKey, String workspaceId, String namespace, TypeReference<T> type, T defaultValue);

    void save(String fileKey, String workspaceId, String namespace, Object value);

    List<String> listWorkspacesWithData(String namespace);
}
