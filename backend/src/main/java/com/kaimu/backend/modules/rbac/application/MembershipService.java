package com.kaimu.backend.modules.rbac.application;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.global.jpa.AbstractTimestampedEntity;
import com.kaimu.backend.modules.audit.application.AuditLogService;
import com.kaimu.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.kaimu.backend.modules.audit.domain.AuditAction;
import com.kaimu.backend.modules.auth.domain.User;
import com.kaimu.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.kaimu.backend.modules.rbac.domain.AuthorizationError;
import com.kaimu.backend.modules.rbac.domain.OrganizationMember;
import com.kaimu.backend.modules.rbac.domain.Project;
import com.kaimu.backend.modules.rbac.domain.ProjectMember;
import com.kaimu.backend.modules.rbac.domain.Role;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.OrganizationMemberRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.OrganizationRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.ProjectMemberRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.ProjectRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import static com.kaimu.backend.modules.rbac.domain.SystemRoles.LEGACY_OWNER;
import static com.kaimu.backend.modules.rbac.domain.SystemRoles.OWNER_ID;

/**
 * Role assignment and member removal. Every mutation locks the organization row first,
 * so owner counting and the change it guards commit as one step.
 */
@Service
@Transactional
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private final OrganizationRepository organizationRepository;
    private final OrganizationMemberRepository organizationMemberRepository;
    private final ProjectMemberRepository projectMemberRepository;
    private final ProjectRepository projectRepository;
    private final RoleRepository roleRepository;
    private final UserRepository userRepository;
    private final PermissionService permissionService;
    private final AuditLogService auditLogService;

    public MembershipService(
            OrganizationRepository organizationRepository,
            OrganizationMemberRepository organizationMemberRepository,
            ProjectMemberRepository projectMemberRepository,
            ProjectRepository projectRepository,
            RoleRepository roleRepository,
            UserRepository userRepository,
            PermissionService permissionService,
            AuditLogService auditLogService
    ) {
        this.organizationRepository = organizationRepository;
        this.organizationMemberRepository = organizationMemberRepository;
        this.projectMemberRepository = projectMemberRepository;
        this.projectRepository = projectRepository;
        this.roleRepository = roleRepository;
        this.userRepository = userRepository;
        this.permissionService = permissionService;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public List<MemberView> listOrganizationMembers(UUID actorId, UUID organizationId) {
        permissionService.requireOrganizationPermission(actorId, organizationId, PermissionCodes.ORG_VIEW);
        List<OrganizationMember> members = organizationMemberRepository.findByOrganizationIdOrderByCreatedAtAsc(organizationId);
        Map<UUID, User> users = usersById(members.stream().map(OrganizationMember::getUserId).toList());
        Map<UUID, Role> roles = rolesById(members.stream().map(OrganizationMember::effectiveRoleId).toList());
        return members.stream()
                .map(member -> toView(member.getUserId(), member.effectiveRoleId(), false, member, users, roles))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<MemberView> listProjectMembers(UUID actorId, UUID projectId) {
        permissionService.requireProjectPermission(actorId, projectId, PermissionCodes.PROJECT_VIEW);
        List<ProjectMember> members = projectMemberRepository.findByProjectIdOrderByCreatedAtAsc(projectId);
        Map<UUID, User> users = usersById(members.stream().map(ProjectMember::getUserId).toList());
        Map<UUID, Role> roles = rolesById(members.stream().map(ProjectMember::getRoleId).filter(Objects::nonNull).toList());
        return members.stream()
                .map(member -> toView(member.getUserId(), member.getRoleId(), member.inheritsOrganizationRole(), member, users, roles))
                .toList();
    }

    public MemberView assignOrganizationRole(UUID actorId, UUID organizationId, UUID userId, UUID roleId) {
        lockOrganization(organizationId);
        permissionService.requireOrganizationPermission(actorId, organizationId, PermissionCodes.ORG_MANAGE_ROLES);

        OrganizationMember member = loadOrganizationMember(organizationId, userId);
        Role role = loadAssignableRole(organizationId, roleId);

        boolean demotingOwner = member.isOwner() && !role.isOwner();
        boolean grantingOwner = !member.isOwner() && role.isOwner();
        if (grantingOwner && !isOwner(actorId, organizationId)) {
            throw new ProblemException(AuthorizationError.PERMISSION_DENIED, "Only an owner can grant the owner role");
        }
        if (demotingOwner) {
            requireActingOwner(actorId, organizationId);
            ensureAnotherOwnerRemains(organizationId, userId);
        }

        UUID previousRoleId = member.effectiveRoleId();
        member.assignRole(role.getId());
        organizationMemberRepository.save(member);

        Map<String, Object> detail = new HashMap<>();
        detail.put("userId", userId.toString());
        detail.put("previousRoleId", previousRoleId.toString());
        detail.put("roleId", role.getId().toString());
        auditLogService.record(AuditLogCommand.of(AuditAction.ORG_ROLE_ASSIGNED, "organization", organizationId, actorId, detail));

        Map<UUID, User> users = usersById(List.of(userId));
        return toView(userId, role.getId(), false, member, users, Map.of(role.getId(), role));
    }

    /**
     * Project memberships of the removed principal inside this organization go with it.
     */
    public void removeOrganizationMember(UUID actorId, UUID organizationId, UUID userId) {
        lockOrganization(organizationId);
        permissionService.requireOrganizationPermission(actorId, organizationId, PermissionCodes.ORG_REMOVE_MEMBERS);

        OrganizationMember member = loadOrganizationMember(organizationId, userId);
        if (member.isOwner()) {
            requireActingOwner(actorId, organizationId);
            ensureAnotherOwnerRemains(organizationId, userId);
        }

        UUID roleId = member.effectiveRoleId();
        organizationMemberRepository.delete(member);
        int projectMemberships = projectMemberRepository.deleteByUserIdWithinOrganization(userId, organizationId);

        Map<String, Object> detail = new HashMap<>();
        detail.put("userId", userId.toString());
        detail.put("roleId", roleId.toString());
        detail.put("removedProjectMemberships", projectMemberships);
        auditLogService.record(AuditLogCommand.of(AuditAction.ORG_MEMBER_REMOVED, "organization", organizationId, actorId, detail));
    }

    /**
     * A null role clears the project override so the organization role applies again.
     */
    public MemberView assignProjectRole(UUID actorId, UUID projectId, UUID userId, UUID roleId) {
        Project project = loadProject(projectId);
        UUID organizationId = project.getOrganizationId();
        lockOrganization(organizationId);
        permissionService.requireProjectPermission(actorId, projectId, PermissionCodes.PROJECT_MANAGE_MEMBERS);

        if (organizationMemberRepository.findByOrganizationIdAndUserId(organizationId, userId).isEmpty()) {
            throw new ProblemException(AuthorizationError.MEMBERSHIP_NOT_FOUND, "User is not a member of the organization");
        }

        Role role = null;
        if (roleId != null) {
            role = loadAssignableRole(organizationId, roleId);
            if (role.isOwner() && !isOwner(actorId, organizationId)) {
                throw new ProblemException(AuthorizationError.PERMISSION_DENIED, "Only an owner can grant the owner role");
            }
        }

        ProjectMember member = projectMemberRepository.findByProjectIdAndUserId(projectId, userId)
                .orElseGet(() -> ProjectMember.of(projectId, userId, null));
        UUID previousRoleId = member.getRoleId();
        member.setRoleId(roleId);
        member = projectMemberRepository.save(member);

        Map<String, Object> detail = new HashMap<>();
        detail.put("userId", userId.toString());
        detail.put("previousRoleId", previousRoleId != null ? previousRoleId.toString() : "inherit");
        detail.put("roleId", roleId != null ? roleId.toString() : "inherit");
        auditLogService.record(AuditLogCommand.of(AuditAction.PROJECT_ROLE_ASSIGNED, "project", projectId, actorId, detail));

        Map<UUID, User> users = usersById(List.of(userId));
        Map<UUID, Role> roles = role != null ? Map.of(role.getId(), role) : Map.of();
        return toView(userId, roleId, roleId == null, member, users, roles);
    }

    public void removeProjectMember(UUID actorId, UUID projectId, UUID userId) {
        Project project = loadProject(projectId);
        lockOrganization(project.getOrganizationId());
        permissionService.requireProjectPermission(actorId, projectId, PermissionCodes.PROJECT_MANAGE_MEMBERS);

        ProjectMember member = projectMemberRepository.findByProjectIdAndUserId(projectId, userId)
                .orElseThrow(() -> new ProblemException(AuthorizationError.MEMBERSHIP_NOT_FOUND));
        projectMemberRepository.delete(member);

        Map<String, Object> detail = new HashMap<>();
        detail.put("userId", userId.toString());
        auditLogService.record(AuditLogCommand.of(AuditAction.PROJECT_MEMBER_REMOVED, "project", projectId, actorId, detail));
    }

    private void ensureAnotherOwnerRemains(UUID organizationId, UUID userId) {
        long owners = organizationMemberRepository.countOwners(organizationId, OWNER_ID, LEGACY_OWNER);
        if (owners <= 1) {
            log.warn("Rejected change that would leave organization {} without an owner (target user {})", organizationId, userId);
            throw new ProblemException(AuthorizationError.LAST_OWNER_VIOLATION);
        }
    }

    private void requireActingOwner(UUID actorId, UUID organizationId) {
        if (!isOwner(actorId, organizationId)) {
            throw new ProblemException(AuthorizationError.CANNOT_DELETE_OWNER_ASSIGNMENT);
        }
    }

    private boolean isOwner(UUID userId, UUID organizationId) {
        return organizationMemberRepository.findByOrganizationIdAndUserId(organizationId, userId)
                .map(OrganizationMember::isOwner)
                .orElse(false);
    }

    private void lockOrganization(UUID organizationId) {
        organizationRepository.findByIdForUpdate(organizationId)
                .orElseThrow(() -> new ProblemException(AuthorizationError.RESOURCE_NOT_FOUND, "Organization not found"));
    }

    private Project loadProject(UUID projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new ProblemException(AuthorizationError.RESOURCE_NOT_FOUND, "Project not found"));
    }

    private OrganizationMember loadOrganizationMember(UUID organizationId, UUID userId) {
        return organizationMemberRepository.findByOrganizationIdAndUserId(organizationId, userId)
                .orElseThrow(() -> new ProblemException(AuthorizationError.MEMBERSHIP_NOT_FOUND));
    }

    private Role loadAssignableRole(UUID organizationId, UUID roleId) {
        return roleRepository.findById(roleId)
                .filter(role -> role.isAssignableIn(organizationId))
                .orElseThrow(() -> new ProblemException(AuthorizationError.ROLE_NOT_FOUND));
    }

    private Map<UUID, User> usersById(Collection<UUID> ids) {
        return userRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
    }

    private Map<UUID, Role> rolesById(Collection<UUID> ids) {
        return roleRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Role::getId, Function.identity()));
    }

    private static MemberView toView(
            UUID userId,
            UUID roleId,
            boolean inherited,
            AbstractTimestampedEntity membership,
            Map<UUID, User> users,
            Map<UUID, Role> roles
    ) {
        User user = users.get(userId);
        Role role = roleId != null ? roles.get(roleId) : null;
        return new MemberView(
                userId,
                user != null ? user.getUsername() : null,
                user != null ? user.getDisplayName() : null,
                roleId,
                role != null ? role.getName() : null,
                inherited,
                membership.getCreatedAt()
        );
    }
}
