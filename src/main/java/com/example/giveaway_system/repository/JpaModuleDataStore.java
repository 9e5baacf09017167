package com.example.giveaway_system.repository;

import com.example.giveaway_system.domain.ModuleData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaModuleDataStore implements ModuleDataStore {

    private final ModuleDataRepository moduleDataRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public <T> T load(String fileKey, String workspaceId, String namespace, TypeReference<T> type, T defaultValue) {
        return moduleDataRepository.findByNamespaceAndWorkspaceIdAndFileKey(namespace, workspaceId, fileKey)
                .map(data -> readPayload(data, type))
                .orElse(defaultValue);
    }

    @Override
    @Transactional
    public void save(String fileKey, String workspaceId, String namespace, Object value) {
        String payload = writePayload(fileKey, workspaceId, value);

        moduleDataRepository.findByNamespaceAndWorkspaceIdAndFileKey(namespace, workspaceId, fileKey)
                .ifPresentOrElse(
                        data -> data.overwrite(payload), // 더티 체킹으로 반영
                        () -> moduleDataRepository.save(new ModuleData(namespace, workspaceId, fileKey, payload))
                );
        log.debug("### 모듈 데이터 저장: {}/{}/{}", namespace, workspaceId, fileKey);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> listWorkspacesWithData(String namespace) {
        return moduleDataRepository.findWorkspaceIdsByNamespace(namespace);
    }

    private <T> T readPayload(ModuleData data, TypeReference<T> type) {
        try {
            return objectMapper.readValue(data.getPayload(), type);
        } catch (JsonProcessingException e) {
            log.error("### 모듈 데이터 파싱 실패: {}/{}/{}", data.getNamespace(), data.getWorkspaceId(), data.getFileKey(), e);
            throw new ModuleDataException("저장된 데이터를 읽을 수 없습니다: " + data.getFileKey(), e);
        }
    }

    private String writePayload(String fileKey, String workspaceId, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ModuleDataException("데이터 직렬화 실패: " + workspaceId + "/" + fileKey, e);
        }
    }
}
