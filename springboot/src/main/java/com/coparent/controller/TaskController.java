package com.coparent.controller;

import com.coparent.dto.TaskRequest;
import com.coparent.dto.TaskResponse;
import com.coparent.dto.TaskStatsResponse;
import com.coparent.dto.TaskStatusRequest;
import com.coparent.entity.ParentSlot;
import com.coparent.entity.Task;
import com.coparent.service.CurrentUserService;
import com.coparent.service.TaskService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tasks/{familyId}")
@RequiredArgsConstructor
public class TaskController {

    private final CurrentUserService currentUserService;
    private final TaskService taskService;

    @GetMapping
    public ResponseEntity<List<TaskResponse>> list(@PathVariable Long familyId,
                                                   @RequestParam(required = false) Task.Status status,
                                                   @RequestParam(required = false) ParentSlot assignedTo,
                                                   @RequestParam(required = false) Task.Category category,
                                                   Authentication authentication) {
        return ResponseEntity.ok(taskService.list(familyId, currentUserService.resolve(authentication),
                status, assignedTo, category));
    }

    @GetMapping("/stats")
    public ResponseEntity<TaskStatsResponse> stats(@PathVariable Long familyId, Authentication authentication) {
        return ResponseEntity.ok(taskService.stats(familyId, currentUserService.resolve(authentication)));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> get(@PathVariable Long familyId,
                                            @PathVariable Long taskId,
                                            Authentication authentication) {
        return ResponseEntity.ok(taskService.get(familyId, currentUserService.resolve(authentication), taskId));
    }

    @PostMapping
    public ResponseEntity<TaskResponse> create(@PathVariable Long familyId,
                                               @Valid @RequestBody TaskRequest request,
                                               Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(taskService.create(familyId, currentUserService.resolve(authentication), request));
    }

    @PutMapping("/{taskId}")
    public ResponseEntity<TaskResponse> update(@PathVariable Long familyId,
                                               @PathVariable Long taskId,
                                               @Valid @RequestBody TaskRequest request,
                                               Authentication authentication) {
        return ResponseEntity.ok(taskService.update(familyId, currentUserService.resolve(authentication),
                taskId, request));
    }

    @PatchMapping("/{taskId}/status")
    public ResponseEntity<TaskResponse> updateStatus(@PathVariable Long familyId,
                                                     @PathVariable Long taskId,
                                                     @Valid @RequestBody TaskStatusRequest request,
                                                     Authentication authentication) {
        return ResponseEntity.ok(taskService.updateStatus(familyId, currentUserService.resolve(authentication),
                taskId, request.getStatus()));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> delete(@PathVariable Long familyId,
                                       @PathVariable Long taskId,
                                       Authentication authentication) {
        taskService.delete(familyId, currentUserService.resolve(authentication), taskId);
        return ResponseEntity.noContent().build();
    }
}
