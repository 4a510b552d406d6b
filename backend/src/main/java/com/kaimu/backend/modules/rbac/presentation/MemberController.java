package com.kaimu.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.kaimu.backend.global.security.SecurityUtils;
import com.kaimu.backend.modules.rbac.application.MembershipService;
import com.kaimu.backend.modules.rbac.presentation.dto.MemberResponse;
import com.kaimu.backend.modules.rbac.presentation.dto.OrganizationRoleAssignmentRequest;
import com.kaimu.backend.modules.rbac.presentation.dto.ProjectRoleAssignmentRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MemberController {

    private final MembershipService membershipService;

    public MemberController(MembershipService membershipService) {
        this.membershipService = membershipService;
    }

    @GetMapping("/organizations/{organizationId}/members")
    public ResponseEntity<List<MemberResponse>> organizationMembers(@PathVariable("organizationId") UUID organizationId) {
        return ResponseEntity.ok(membershipService.listOrganizationMembers(SecurityUtils.getCurrentUserId(), organizationId)
                .stream()
                .map(MemberResponse::from)
                .toList());
    }

    @Operation(summary = "Assign an organization role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assigned"),
            @ApiResponse(responseCode = "403", description = "PERMISSION_DENIED or CANNOT_DELETE_OWNER_ASSIGNMENT"),
            @ApiResponse(responseCode = "404", description = "MEMBERSHIP_NOT_FOUND or ROLE_NOT_FOUND"),
            @ApiResponse(responseCode = "409", description = "LAST_OWNER_VIOLATION")
    })
    @PutMapping("/organizations/{organizationId}/members/{userId}/role")
    public ResponseEntity<MemberResponse> assignOrganizationRole(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody OrganizationRoleAssignmentRequest request
    ) {
        return ResponseEntity.ok(MemberResponse.from(membershipService.assignOrganizationRole(
                SecurityUtils.getCurrentUserId(), organizationId, userId, request.roleId())));
    }

    @Operation(summary = "Remove an organization member")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Removed"),
            @ApiResponse(responseCode = "409", description = "LAST_OWNER_VIOLATION")
    })
    @DeleteMapping("/organizations/{organizationId}/members/{userId}")
    public ResponseEntity<Void> removeOrganizationMember(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("userId") UUID userId
    ) {
        membershipService.removeOrganizationMember(SecurityUtils.getCurrentUserId(), organizationId, userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/projects/{projectId}/members")
    public ResponseEntity<List<MemberResponse>> projectMembers(@PathVariable("projectId") UUID projectId) {
        return ResponseEntity.ok(membershipService.listProjectMembers(SecurityUtils.getCurrentUserId(), projectId)
                .stream()
                .map(MemberResponse::from)
                .toList());
    }

    @PutMapping("/projects/{projectId}/members/{userId}/role")
    public ResponseEntity<MemberResponse> assignProjectRole(
            @PathVariable("projectId") UUID projectId,
            @PathVariable("userId") UUID userId,
            @RequestBody ProjectRoleAssignmentRequest request
    ) {
        return ResponseEntity.ok(MemberResponse.from(membershipService.assignProjectRole(
                SecurityUtils.getCurrentUserId(), projectId, userId, request.roleId())));
    }

    @DeleteMapping("/projects/{projectId}/members/{userId}")
    public ResponseEntity<Void> removeProjectMember(
            @PathVariable("projectId") UUID projectId,
            @PathVariable("userId") UUID userId
    ) {
        membershipService.removeProjectMember(SecurityUtils.getCurrentUserId(), projectId, userId);
        return ResponseEntity.noContent().build();
    }
}
