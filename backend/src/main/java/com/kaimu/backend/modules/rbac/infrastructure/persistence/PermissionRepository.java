package com.kaimu.backend.modules.rbac.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.kaimu.backend.modules.rbac.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    List<Permission> findAllByOrderByResourceTypeAscCodeAsc();

    List<Permission> findByCodeIn(Collection<String> codes);
}
