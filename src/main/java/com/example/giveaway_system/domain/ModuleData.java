package com.example.giveaway_system.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 모듈/워크스페이스/파일 단위의 JSON 문서 한 건.
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA용 기본 생성자
@Table(name = "module_data",
        uniqueConstraints = @UniqueConstraint(name = "uk_module_workspace_file",
                columnNames = {"namespace", "workspaceId", "fileKey"}),
        indexes = @Index(name = "idx_module_namespace", columnList = "namespace"))
public class ModuleData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String namespace;

    @Column(nullable = false, length = 64)
    private String workspaceId;

    @Column(nullable = false, length = 128)
    private String fileKey;

    @Column(nullable = false, columnDefinition = "LONGTEXT")
    private String payload;

    private LocalDateTime updatedAt;

    public ModuleData(String namespace, String workspaceId, String fileKey, String payload) {
        if (namespace == null || workspaceId == null || fileKey == null) {
            throw new IllegalArgumentException("namespace, workspaceId, fileKey는 필수값입니다.");
        }
        this.namespace = namespace;
        this.workspaceId = workspaceId;
        this.fileKey = fileKey;
        this.payload = payload;
        this.updatedAt = LocalDateTime.now();
    }

    public void overwrite(String payload) {
        this.payload = payload;
        this.updatedAt = LocalDateTime.now();
    }
}
