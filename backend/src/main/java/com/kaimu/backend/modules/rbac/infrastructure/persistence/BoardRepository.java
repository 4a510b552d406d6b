package com.kaimu.backend.modules.rbac.infrastructure.persistence;

import java.util.UUID;

import com.kaimu.backend.modules.rbac.domain.Board;

import org.springframework.data.jpa.repository.JpaRepository;

public interface BoardRepository extends JpaRepository<Board, UUID> {
}
