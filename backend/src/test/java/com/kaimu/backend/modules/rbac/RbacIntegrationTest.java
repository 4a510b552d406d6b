package com.kaimu.backend.modules.rbac;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kaimu.backend.modules.rbac.domain.Organization;
import com.kaimu.backend.modules.rbac.domain.OrganizationMember;
import com.kaimu.backend.modules.rbac.domain.Project;
import com.kaimu.backend.modules.rbac.domain.SystemRoles;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.OrganizationMemberRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.OrganizationRepository;
import com.kaimu.backend.modules.rbac.infrastructure.persistence.ProjectRepository;
import com.kaimu.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class RbacIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OrganizationRepository organizationRepository;

    @Autowired
    private OrganizationMemberRepository organizationMemberRepository;

    @Autowired
    private ProjectRepository projectRepository;

    private UUID organizationId;
    private UUID ownerId;
    private String ownerToken;
    private UUID memberId;
    private String memberToken;

    @BeforeEach
    void setUp() throws Exception {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        Organization organization = new Organization();
        organization.setName("Acme " + suffix);
        organization.setSlug("acme-" + suffix);
        organizationId = organizationRepository.save(organization).getId();

        JsonNode owner = register("owner_" + suffix);
        ownerId = UUID.fromString(owner.path("user").path("userId").asText());
        ownerToken = owner.path("tokens").path("accessToken").asText();
        organizationMemberRepository.save(OrganizationMember.of(organizationId, ownerId, SystemRoles.OWNER_ID));

        JsonNode member = register("member_" + suffix);
        memberId = UUID.fromString(member.path("user").path("userId").asText());
        memberToken = member.path("tokens").path("accessToken").asText();
        OrganizationMember legacyMember = OrganizationMember.of(organizationId, memberId, null);
        legacyMember.setLegacyRole("member");
        organizationMemberRepository.save(legacyMember);
    }

    @Test
    void catalogListsSeededPermissions() throws Exception {
        mockMvc.perform(get("/permissions").header("Authorization", bearer(memberToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(21));
    }

    @Test
    void permissionCheckFollowsRoles() throws Exception {
        checkPermission(ownerToken, "organization", organizationId, "org:manage_roles", true);
        checkPermission(memberToken, "organization", organizationId, "org:manage_roles", false);
        checkPermission(memberToken, "organization", organizationId, "card:edit", true);
    }

    @Test
    void soleOwnerCannotDemoteThemselves() throws Exception {
        mockMvc.perform(put("/organizations/{org}/members/{user}/role", organizationId, ownerId)
                        .header("Authorization", bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roleId\": \"%s\"}".formatted(SystemRoles.ADMIN_ID)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("LAST_OWNER_VIOLATION"));

        OrganizationMember owner = organizationMemberRepository.findByOrganizationIdAndUserId(organizationId, ownerId).orElseThrow();
        assertThat(owner.isOwner()).isTrue();
    }

    @Test
    void secondOwnerAllowsDemotion() throws Exception {
        mockMvc.perform(put("/organizations/{org}/members/{user}/role", organizationId, memberId)
                        .header("Authorization", bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roleId\": \"%s\"}".formatted(SystemRoles.OWNER_ID)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roleName").value("Owner"));

        mockMvc.perform(put("/organizations/{org}/members/{user}/role", organizationId, ownerId)
                        .header("Authorization", bearer(memberToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roleId\": \"%s\"}".formatted(SystemRoles.ADMIN_ID)))
                .andExpect(status().isOk());

        assertThat(organizationMemberRepository.countOwners(organizationId, SystemRoles.OWNER_ID, SystemRoles.LEGACY_OWNER))
                .isEqualTo(1L);
    }

    @Test
    void customRoleLifecycle() throws Exception {
        MvcResult created = mockMvc.perform(post("/organizations/{org}/roles", organizationId)
                        .header("Authorization", bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Reviewer", "description": "Reads boards", "permissions": ["card:edit", "board:view"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.system").value(false))
                .andExpect(jsonPath("$.permissions[0]").value("board:view"))
                .andReturn();
        UUID roleId = UUID.fromString(objectMapper.readTree(created.getResponse().getContentAsString()).path("id").asText());

        mockMvc.perform(post("/organizations/{org}/roles", organizationId)
                        .header("Authorization", bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"reviewer\", \"permissions\": []}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ROLE_NAME_CONFLICT"));

        mockMvc.perform(put("/organizations/{org}/members/{user}/role", organizationId, memberId)
                        .header("Authorization", bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roleId\": \"%s\"}".formatted(roleId)))
                .andExpect(status().isOk());
        checkPermission(memberToken, "organization", organizationId, "project:view", false);

        mockMvc.perform(delete("/roles/{id}", roleId).header("Authorization", bearer(ownerToken)))
                .andExpect(status().isNoContent());

        // members of a deleted role are moved to Viewer
        OrganizationMember stored = organizationMemberRepository.findByOrganizationIdAndUserId(organizationId, memberId).orElseThrow();
        assertThat(stored.getRoleId()).isEqualTo(SystemRoles.VIEWER_ID);
        checkPermission(memberToken, "organization", organizationId, "org:view", true);
        checkPermission(memberToken, "organization", organizationId, "card:edit", false);
    }

    @Test
    void deletingCustomRoleNeverRevivesLegacyOwnerString() throws Exception {
        MvcResult created = mockMvc.perform(post("/organizations/{org}/roles", organizationId)
                        .header("Authorization", bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Triage\", \"permissions\": [\"board:view\"]}"))
                .andExpect(status().isCreated())
                .andReturn();
        UUID roleId = UUID.fromString(objectMapper.readTree(created.getResponse().getContentAsString()).path("id").asText());

        JsonNode migrated = register("migrated_" + UUID.randomUUID().toString().substring(0, 8));
        UUID migratedId = UUID.fromString(migrated.path("user").path("userId").asText());
        OrganizationMember migratedMember = OrganizationMember.of(organizationId, migratedId, roleId);
        migratedMember.setLegacyRole(SystemRoles.LEGACY_OWNER);
        organizationMemberRepository.save(migratedMember);

        mockMvc.perform(delete("/roles/{id}", roleId).header("Authorization", bearer(ownerToken)))
                .andExpect(status().isNoContent());

        OrganizationMember stored = organizationMemberRepository.findByOrganizationIdAndUserId(organizationId, migratedId).orElseThrow();
        assertThat(stored.getRoleId()).isEqualTo(SystemRoles.VIEWER_ID);
        assertThat(stored.getLegacyRole()).isNull();
        assertThat(stored.isOwner()).isFalse();
        assertThat(organizationMemberRepository.countOwners(organizationId, SystemRoles.OWNER_ID, SystemRoles.LEGACY_OWNER))
                .isEqualTo(1L);
        checkPermission(migrated.path("tokens").path("accessToken").asText(),
                "organization", organizationId, "org:manage_roles", false);
    }

    @Test
    void systemRolesAreImmutable() throws Exception {
        mockMvc.perform(patch("/roles/{id}", SystemRoles.OWNER_ID)
                        .header("Authorization", bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Boss\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("CANNOT_MODIFY_SYSTEM_ROLE"));
    }

    @Test
    void unknownPermissionCodeIsRejected() throws Exception {
        mockMvc.perform(post("/organizations/{org}/roles", organizationId)
                        .header("Authorization", bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Broken\", \"permissions\": [\"board:teleport\"]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_PERMISSION_CODE"));
    }

    @Test
    void projectRoleReplacesOrganizationRole() throws Exception {
        Project project = new Project();
        project.setOrganizationId(organizationId);
        project.setName("Roadmap");
        project.setKey("RM");
        UUID projectId = projectRepository.save(project).getId();

        checkPermission(memberToken, "project", projectId, "project:create", true);

        mockMvc.perform(put("/projects/{project}/members/{user}/role", projectId, memberId)
                        .header("Authorization", bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roleId\": \"%s\"}".formatted(SystemRoles.VIEWER_ID)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inheritsOrganizationRole").value(false));

        checkPermission(memberToken, "project", projectId, "project:create", false);
        checkPermission(memberToken, "organization", organizationId, "project:create", true);
    }

    @Test
    void nonMemberSeesNothing() throws Exception {
        String outsiderToken = register("outsider_" + UUID.randomUUID().toString().substring(0, 8))
                .path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/permissions/mine")
                        .header("Authorization", bearer(outsiderToken))
                        .param("resourceType", "organization")
                        .param("resourceId", organizationId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.permissions").isEmpty());

        mockMvc.perform(get("/organizations/{org}/members", organizationId).header("Authorization", bearer(outsiderToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PERMISSION_DENIED"));
    }

    private void checkPermission(String token, String resourceType, UUID resourceId, String code, boolean expected) throws Exception {
        mockMvc.perform(get("/permissions/check")
                        .header("Authorization", bearer(token))
                        .param("code", code)
                        .param("resourceType", resourceType)
                        .param("resourceId", resourceId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(expected));
    }

    private JsonNode register(String username) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": "%s", "email": "%s@example.com", "password": "long-enough-password"}
                                """.formatted(username, username)))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}
