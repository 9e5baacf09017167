package com.example.giveaway_system.repository;

import com.example.giveaway_system.domain.ModuleData;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ModuleDataRepository extends JpaRepository<ModuleData, Long> {

    Optional<ModuleData> findByNamespaceAndWorkspaceIdAndFileKey(String namespace, String workspaceId, String fileKey);

    // 해당 모듈의 데이터를 가진 워크스페이스 목록 (시작 시 복구용)
    @Query("SELECT DISTINCT m.workspaceId FROM ModuleData m WHERE m.namespace = :namespace")
    List<String> findWorkspaceIdsByNamespace(@Param("namespace") String namespace);
}
