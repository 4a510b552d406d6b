package com.kaimu.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.kaimu.backend.global.security.SecurityUtils;
import com.kaimu.backend.modules.rbac.application.RoleService;
import com.kaimu.backend.modules.rbac.application.RoleService.CreateRoleCommand;
import com.kaimu.backend.modules.rbac.application.RoleService.UpdateRoleCommand;
import com.kaimu.backend.modules.rbac.presentation.dto.CreateRoleRequest;
import com.kaimu.backend.modules.rbac.presentation.dto.RoleResponse;
import com.kaimu.backend.modules.rbac.presentation.dto.UpdateRoleRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RoleController {

    private final RoleService roleService;

    public RoleController(RoleService roleService) {
        this.roleService = roleService;
    }

    @GetMapping("/organizations/{organizationId}/roles")
    public ResponseEntity<List<RoleResponse>> list(@PathVariable("organizationId") UUID organizationId) {
        return ResponseEntity.ok(roleService.listRoles(SecurityUtils.getCurrentUserId(), organizationId).stream()
                .map(RoleResponse::from)
                .toList());
    }

    @Operation(summary = "Create a custom role")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "403", description = "PERMISSION_DENIED"),
            @ApiResponse(responseCode = "409", description = "ROLE_NAME_CONFLICT"),
            @ApiResponse(responseCode = "422", description = "INVALID_PERMISSION_CODE")
    })
    @PostMapping("/organizations/{organizationId}/roles")
    public ResponseEntity<RoleResponse> create(
            @PathVariable("organizationId") UUID organizationId,
            @Valid @RequestBody CreateRoleRequest request
    ) {
        CreateRoleCommand command = new CreateRoleCommand(request.name(), request.description(), request.permissions());
        RoleResponse response = RoleResponse.from(roleService.createRole(SecurityUtils.getCurrentUserId(), organizationId, command));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/roles/{roleId}")
    public ResponseEntity<RoleResponse> get(@PathVariable("roleId") UUID roleId) {
        return ResponseEntity.ok(RoleResponse.from(roleService.getRole(SecurityUtils.getCurrentUserId(), roleId)));
    }

    @Operation(summary = "Update a custom role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "403", description = "CANNOT_MODIFY_SYSTEM_ROLE or PERMISSION_DENIED"),
            @ApiResponse(responseCode = "404", description = "ROLE_NOT_FOUND"),
            @ApiResponse(responseCode = "422", description = "INVALID_PERMISSION_CODE")
    })
    @PatchMapping("/roles/{roleId}")
    public ResponseEntity<RoleResponse> update(
            @PathVariable("roleId") UUID roleId,
            @Valid @RequestBody UpdateRoleRequest request
    ) {
        UpdateRoleCommand command = new UpdateRoleCommand(request.name(), request.description(), request.permissions());
        return ResponseEntity.ok(RoleResponse.from(roleService.updateRole(SecurityUtils.getCurrentUserId(), roleId, command)));
    }

    @DeleteMapping("/roles/{roleId}")
    public ResponseEntity<Void> delete(@PathVariable("roleId") UUID roleId) {
        roleService.deleteRole(SecurityUtils.getCurrentUserId(), roleId);
        return ResponseEntity.noContent().build();
    }
}
