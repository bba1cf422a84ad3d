package com.edurange.ctf.modules.audit;

import com.edurange.ctf.modules.lifecycle.LifecycleCoordinator;
import com.edurange.ctf.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/competitions/{groupId}/audit-events")
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Competition activity log")
public class AuditController {

    private final LifecycleCoordinator coordinator;
    private final SecurityUtils securityUtils;

    @GetMapping
    @Operation(summary = "Page through a competition's activity, newest first (instructor)")
    public ResponseEntity<Page<AuditEventDto>> list(@PathVariable UUID groupId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        PageRequest pageable = PageRequest.of(page, Math.min(size, 200));
        return ResponseEntity.ok(coordinator.auditEvents(securityUtils.getCurrentUser(), groupId, pageable));
    }
}
