package com.kaimu.backend.modules.rbac.application;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.audit.application.AuditLogService;
import com.kaimu.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.kaimu.backend.modules.audit.domain.AuditAction;
import com.kaimu.backend.modules.rbac.domain.AuthorizationError;
import com.kaimu.backend.modules.rbac.domain.Permission;
import com.kaimu.backend.modules.rbac.domain.Role;
import com.kaimu.backend.modules.rbac.domain.SystemRoles;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.OrganizationMemberRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.OrganizationRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.ProjectMemberRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.RoleRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Custom role management. System roles are rejected before any permission check
 * so the answer does not depend on who is asking.
 */
@Service
@Transactional
public class RoleService {

    private static final String RESOURCE_TYPE = "role";

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final OrganizationRepository organizationRepository;
    private final OrganizationMemberRepository organizationMemberRepository;
    private final ProjectMemberRepository projectMemberRepository;
    private final PermissionService permissionService;
    private final AuditLogService auditLogService;

    public RoleService(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            OrganizationRepository organizationRepository,
            OrganizationMemberRepository organizationMemberRepository,
            ProjectMemberRepository projectMemberRepository,
            PermissionService permissionService,
            AuditLogService auditLogService
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.organizationRepository = organizationRepository;
        this.organizationMemberRepository = organizationMemberRepository;
        this.projectMemberRepository = projectMemberRepository;
        this.permissionService = permissionService;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public List<RoleView> listRoles(UUID actorId, UUID organizationId) {
        permissionService.requireOrganizationPermission(actorId, organizationId, PermissionCodes.ORG_VIEW);
        return roleRepository.findAvailableForOrganization(organizationId).stream()
                .map(RoleView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public RoleView getRole(UUID actorId, UUID roleId) {
        Role role = roleRepository.findWithPermissionsById(roleId)
                .orElseThrow(() -> new ProblemException(AuthorizationError.ROLE_NOT_FOUND));
        if (!role.isSystem()) {
            permissionService.requireOrganizationPermission(actorId, role.getOrganizationId(), PermissionCodes.ORG_VIEW);
        }
        return RoleView.from(role);
    }

    public RoleView createRole(UUID actorId, UUID organizationId, CreateRoleCommand command) {
        if (!organizationRepository.existsById(organizationId)) {
            throw new ProblemException(AuthorizationError.RESOURCE_NOT_FOUND, "Organization not found");
        }
        permissionService.requireOrganizationPermission(actorId, organizationId, PermissionCodes.ORG_MANAGE_ROLES);

        Set<Permission> permissions = resolvePermissions(command.permissionCodes());
        String name = command.name().trim();
        if (roleRepository.existsByOrganizationIdAndNameIgnoreCase(organizationId, name)) {
            throw new ProblemException(AuthorizationError.ROLE_NAME_CONFLICT);
        }

        Role role = Role.custom(organizationId, name, command.description());
        role.replacePermissions(permissions);
        try {
            role = roleRepository.saveAndFlush(role);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(AuthorizationError.ROLE_NAME_CONFLICT, null, ex);
        }

        Map<String, Object> detail = new HashMap<>();
        detail.put("organizationId", organizationId.toString());
        detail.put("name", role.getName());
        detail.put("permissions", role.permissionCodes());
        auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_CREATED, RESOURCE_TYPE, role.getId(), actorId, detail));
        return RoleView.from(role);
    }

    /**
     * Null fields are left unchanged. A non-null permission list replaces the whole set,
     * and every code is validated before anything is written.
     */
    public RoleView updateRole(UUID actorId, UUID roleId, UpdateRoleCommand command) {
        Role role = loadMutableRole(roleId);
        permissionService.requireOrganizationPermission(actorId, role.getOrganizationId(), PermissionCodes.ORG_MANAGE_ROLES);

        Set<Permission> permissions = command.permissionCodes() != null
                ? resolvePermissions(command.permissionCodes())
                : null;
        String name = command.name() != null ? command.name().trim() : null;
        if (name != null && !name.equalsIgnoreCase(role.getName())
                && roleRepository.existsByOrganizationIdAndNameIgnoreCaseAndIdNot(role.getOrganizationId(), name, roleId)) {
            throw new ProblemException(AuthorizationError.ROLE_NAME_CONFLICT);
        }

        if (name != null) {
            role.setName(name);
        }
        if (command.description() != null) {
            role.setDescription(command.description());
        }
        if (permissions != null) {
            role.replacePermissions(permissions);
        }
        try {
            role = roleRepository.saveAndFlush(role);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(AuthorizationError.ROLE_NAME_CONFLICT, null, ex);
        }

        Map<String, Object> detail = new HashMap<>();
        detail.put("name", role.getName());
        detail.put("permissions", role.permissionCodes());
        auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_UPDATED, RESOURCE_TYPE, roleId, actorId, detail));
        return RoleView.from(role);
    }

    /**
     * Members holding the role fall back: organization members to Viewer,
     * project members to their organization role.
     */
    public void deleteRole(UUID actorId, UUID roleId) {
        Role role = loadMutableRole(roleId);
        permissionService.requireOrganizationPermission(actorId, role.getOrganizationId(), PermissionCodes.ORG_MANAGE_ROLES);

        Map<String, Object> detail = new HashMap<>();
        detail.put("organizationId", role.getOrganizationId().toString());
        detail.put("name", role.getName());

        int orgAssignments = organizationMemberRepository.reassignRole(roleId, SystemRoles.VIEWER_ID);
        int projectAssignments = projectMemberRepository.clearRole(roleId);
        roleRepository.deleteById(roleId);

        detail.put("clearedAssignments", orgAssignments + projectAssignments);
        auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_DELETED, RESOURCE_TYPE, roleId, actorId, detail));
    }

    private Role loadMutableRole(UUID roleId) {
        Role role = roleRepository.findByIdForUpdate(roleId)
                .orElseThrow(() -> new ProblemException(AuthorizationError.ROLE_NOT_FOUND));
        if (role.isSystem()) {
            throw new ProblemException(AuthorizationError.CANNOT_MODIFY_SYSTEM_ROLE);
        }
        return role;
    }

    private Set<Permission> resolvePermissions(List<String> codes) {
        if (codes == null || codes.isEmpty()) {
            return new LinkedHashSet<>();
        }
        Set<String> requested = new LinkedHashSet<>(codes);
        List<Permission> found = permissionRepository.findByCodeIn(requested);
        if (found.size() != requested.size()) {
            Set<String> known = found.stream().map(Permission::getCode).collect(Collectors.toSet());
            String unknown = requested.stream()
                    .filter(code -> !known.contains(code))
                    .collect(Collectors.joining(", "));
            throw new ProblemException(AuthorizationError.INVALID_PERMISSION_CODE, "Unknown permission codes: " + unknown);
        }
        return new LinkedHashSet<>(found);
    }

    public record CreateRoleCommand(String name, String description, List<String> permissionCodes) {
    }

    public record UpdateRoleCommand(String name, String description, List<String> permissionCodes) {
    }
}
