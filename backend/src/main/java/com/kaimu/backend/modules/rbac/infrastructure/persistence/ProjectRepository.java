package com.kaimu.backend.modules.rbac.infrastructure.persistence;

import java.util.UUID;

import com.kaimu.backend.modules.rbac.domain.Project;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<Project, UUID> {
}
