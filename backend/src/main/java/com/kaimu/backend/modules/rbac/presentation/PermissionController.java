package com.kaimu.backend.modules.rbac.presentation;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.kaimu.backend.global.security.SecurityUtils;
import com.kaimu.backend.modules.rbac.application.PermissionService;
import com.kaimu.backend.modules.rbac.domain.ResourceType;
import com.kaimu.backend.modules.rbac.presentation.dto.MyPermissionsResponse;
import com.kaimu.backend.modules.rbac.presentation.dto.PermissionCheckResponse;
import com.kaimu.backend.modules.rbac.presentation.dto.PermissionResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/permissions")
public class PermissionController {

    private final PermissionService permissionService;

    public PermissionController(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @GetMapping
    public ResponseEntity<List<PermissionResponse>> catalog() {
        return ResponseEntity.ok(permissionService.listPermissions().stream()
                .map(PermissionResponse::from)
                .toList());
    }

    @Operation(summary = "Check one permission of the caller", description = "Boards resolve through their project.")
    @GetMapping("/check")
    public ResponseEntity<PermissionCheckResponse> check(
            @RequestParam("code") String code,
            @RequestParam("resourceType") String resourceType,
            @RequestParam("resourceId") UUID resourceId
    ) {
        ResourceType type = ResourceType.from(resourceType);
        boolean allowed = permissionService.hasPermission(SecurityUtils.getCurrentUserId(), type, resourceId, code);
        return ResponseEntity.ok(new PermissionCheckResponse(code, type.value(), resourceId, allowed));
    }

    @GetMapping("/mine")
    public ResponseEntity<MyPermissionsResponse> mine(
            @RequestParam("resourceType") String resourceType,
            @RequestParam("resourceId") UUID resourceId
    ) {
        ResourceType type = ResourceType.from(resourceType);
        List<String> codes = new ArrayList<>(permissionService.effectivePermissions(SecurityUtils.getCurrentUserId(), type, resourceId));
        return ResponseEntity.ok(new MyPermissionsResponse(type.value(), resourceId, codes));
    }
}
