package com.coparent.controller;

import com.coparent.dto.CreateCustodyOverrideRequest;
import com.coparent.dto.CustodyOverrideResponse;
import com.coparent.dto.RespondCustodyOverrideRequest;
import com.coparent.entity.CustodyOverride;
import com.coparent.service.CurrentUserService;
import com.coparent.service.CustodyOverrideService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/custody-overrides/{familyId}")
@RequiredArgsConstructor
public class CustodyOverrideController {

    private final CurrentUserService currentUserService;
    private final CustodyOverrideService custodyOverrideService;

    @GetMapping
    public ResponseEntity<List<CustodyOverrideResponse>> list(
            @PathVariable Long familyId,
            @RequestParam(required = false) CustodyOverride.Status status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            Authentication authentication) {
        return ResponseEntity.ok(custodyOverrideService.list(familyId,
                currentUserService.resolve(authentication), status, from, to));
    }

    @GetMapping("/active")
    public ResponseEntity<List<CustodyOverrideResponse>> active(
            @PathVariable Long familyId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            Authentication authentication) {
        return ResponseEntity.ok(custodyOverrideService.active(familyId,
                currentUserService.resolve(authentication), from, to));
    }

    @GetMapping("/{overrideId}")
    public ResponseEntity<CustodyOverrideResponse> get(@PathVariable Long familyId,
                                                       @PathVariable Long overrideId,
                                                       Authentication authentication) {
        return ResponseEntity.ok(custodyOverrideService.get(familyId,
                currentUserService.resolve(authentication), overrideId));
    }

    @PostMapping
    public ResponseEntity<CustodyOverrideResponse> create(@PathVariable Long familyId,
                                                          @Valid @RequestBody CreateCustodyOverrideRequest request,
                                                          Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(custodyOverrideService.create(familyId, currentUserService.resolve(authentication), request));
    }

    @PostMapping("/{overrideId}/respond")
    public ResponseEntity<CustodyOverrideResponse> respond(@PathVariable Long familyId,
                                                           @PathVariable Long overrideId,
                                                           @Valid @RequestBody RespondCustodyOverrideRequest request,
                                                           Authentication authentication) {
        return ResponseEntity.ok(custodyOverrideService.respond(familyId,
                currentUserService.resolve(authentication), overrideId, request));
    }

    @PostMapping("/{overrideId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable Long familyId,
                                       @PathVariable Long overrideId,
                                       Authentication authentication) {
        custodyOverrideService.cancel(familyId, currentUserService.resolve(authentication), overrideId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{overrideId}")
    public ResponseEntity<Void> delete(@PathVariable Long familyId,
                                       @PathVariable Long overrideId,
                                       Authentication authentication) {
        custodyOverrideService.delete(familyId, currentUserService.resolve(authentication), overrideId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Long>> deleteAll(@PathVariable Long familyId,
                                                       Authentication authentication) {
        long deleted = custodyOverrideService.deleteAll(familyId, currentUserService.resolve(authentication));
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }
}
