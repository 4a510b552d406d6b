package com.kaimu.backend.modules.rbac.application;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.rbac.domain.AuthorizationError;
import com.kaimu.backend.modules.rbac.domain.Board;
import com.kaimu.backend.modules.rbac.domain.Permission;
import com.kaimu.backend.modules.rbac.domain.Project;
import com.kaimu.backend.modules.rbac.domain.ResourceType;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.BoardRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.OrganizationMemberRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.ProjectMemberRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.ProjectRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.RoleRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves what a principal may do on an organization, project or board.
 * <p>
 * Organization scope reads the membership role, falling back to the legacy role string.
 * A project role, when present, replaces the organization role for that project; the two sets are never merged.
 * Boards resolve through their project.
 */
@Service
@Transactional(readOnly = true)
public class PermissionService {

    private final PermissionRepository permissionRepository;
    private final RoleRepository roleRepository;
    private final OrganizationMemberRepository organizationMemberRepository;
    private final ProjectMemberRepository projectMemberRepository;
    private final ProjectRepository projectRepository;
    private final BoardRepository boardRepository;

    public PermissionService(
            PermissionRepository permissionRepository,
            RoleRepository roleRepository,
            OrganizationMemberRepository organizationMemberRepository,
            ProjectMemberRepository projectMemberRepository,
            ProjectRepository projectRepository,
            BoardRepository boardRepository
    ) {
        this.permissionRepository = permissionRepository;
        this.roleRepository = roleRepository;
        this.organizationMemberRepository = organizationMemberRepository;
        this.projectMemberRepository = projectMemberRepository;
        this.projectRepository = projectRepository;
        this.boardRepository = boardRepository;
    }

    public List<Permission> listPermissions() {
        return permissionRepository.findAllByOrderByResourceTypeAscCodeAsc();
    }

    public Set<String> effectivePermissions(UUID userId, ResourceType resourceType, UUID resourceId) {
        return switch (resourceType) {
            case ORGANIZATION -> organizationPermissions(userId, resourceId);
            case PROJECT -> projectPermissions(userId, resourceId);
            case BOARD -> projectPermissions(userId, loadBoard(resourceId).getProjectId());
        };
    }

    public boolean hasPermission(UUID userId, ResourceType resourceType, UUID resourceId, String permissionCode) {
        return effectivePermissions(userId, resourceType, resourceId).contains(permissionCode);
    }

    /**
     * Empty when the principal is not a member. Non-membership is not an error.
     */
    public Set<String> organizationPermissions(UUID userId, UUID organizationId) {
        return organizationMemberRepository.findByOrganizationIdAndUserId(organizationId, userId)
                .map(member -> codesOf(member.effectiveRoleId()))
                .orElse(Collections.emptySet());
    }

    public Set<String> projectPermissions(UUID userId, UUID projectId) {
        Project project = loadProject(projectId);
        return projectMemberRepository.findByProjectIdAndUserId(projectId, userId)
                .filter(member -> !member.inheritsOrganizationRole())
                .map(member -> codesOf(member.getRoleId()))
                .orElseGet(() -> organizationPermissions(userId, project.getOrganizationId()));
    }

    public void requireOrganizationPermission(UUID userId, UUID organizationId, String permissionCode) {
        if (!organizationPermissions(userId, organizationId).contains(permissionCode)) {
            throw new ProblemException(AuthorizationError.PERMISSION_DENIED, "Missing permission " + permissionCode);
        }
    }

    public void requireProjectPermission(UUID userId, UUID projectId, String permissionCode) {
        if (!projectPermissions(userId, projectId).contains(permissionCode)) {
            throw new ProblemException(AuthorizationError.PERMISSION_DENIED, "Missing permission " + permissionCode);
        }
    }

    private Project loadProject(UUID projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new ProblemException(AuthorizationError.RESOURCE_NOT_FOUND, "Project not found"));
    }

    private Board loadBoard(UUID boardId) {
        return boardRepository.findById(boardId)
                .orElseThrow(() -> new ProblemException(AuthorizationError.RESOURCE_NOT_FOUND, "Board not found"));
    }

    private Set<String> codesOf(UUID roleId) {
        return new TreeSet<>(roleRepository.findPermissionCodesByRoleId(roleId));
    }
}
