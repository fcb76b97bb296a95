package com.coparent.controller;

import com.coparent.dto.CounterOfferRequest;
import com.coparent.dto.CounterResponseRequest;
import com.coparent.dto.CreateSwapRequest;
import com.coparent.dto.SwapRequestResponse;
import com.coparent.dto.SwapStatusRequest;
import com.coparent.entity.SwapRequest;
import com.coparent.service.CurrentUserService;
import com.coparent.service.SwapRequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/swap-requests/{familyId}")
@RequiredArgsConstructor
public class SwapRequestController {

    private final CurrentUserService currentUserService;
    private final SwapRequestService swapRequestService;

    @GetMapping
    public ResponseEntity<List<SwapRequestResponse>> list(@PathVariable Long familyId,
                                                          @RequestParam(required = false) SwapRequest.Status status,
                                                          Authentication authentication) {
        return ResponseEntity.ok(swapRequestService.list(familyId, currentUserService.resolve(authentication), status));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<SwapRequestResponse> get(@PathVariable Long familyId,
                                                   @PathVariable Long requestId,
                                                   Authentication authentication) {
        return ResponseEntity.ok(swapRequestService.get(familyId, currentUserService.resolve(authentication), requestId));
    }

    @PostMapping
    public ResponseEntity<SwapRequestResponse> create(@PathVariable Long familyId,
                                                      @Valid @RequestBody CreateSwapRequest request,
                                                      Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(swapRequestService.create(familyId, currentUserService.resolve(authentication), request));
    }

    @PatchMapping("/{requestId}/status")
    public ResponseEntity<SwapRequestResponse> updateStatus(@PathVariable Long familyId,
                                                            @PathVariable Long requestId,
                                                            @Valid @RequestBody SwapStatusRequest request,
                                                            Authentication authentication) {
        return ResponseEntity.ok(swapRequestService.updateStatus(familyId,
                currentUserService.resolve(authentication), requestId, request));
    }

    @PostMapping("/{requestId}/counter")
    public ResponseEntity<SwapRequestResponse> counter(@PathVariable Long familyId,
                                                       @PathVariable Long requestId,
                                                       @Valid @RequestBody CounterOfferRequest request,
                                                       Authentication authentication) {
        return ResponseEntity.ok(swapRequestService.counter(familyId,
                currentUserService.resolve(authentication), requestId, request));
    }

    @PostMapping("/{requestId}/accept-counter")
    public ResponseEntity<SwapRequestResponse> acceptCounter(@PathVariable Long familyId,
                                                             @PathVariable Long requestId,
                                                             @Valid @RequestBody(required = false) CounterResponseRequest request,
                                                             Authentication authentication) {
        return ResponseEntity.ok(swapRequestService.acceptCounter(familyId,
                currentUserService.resolve(authentication), requestId, request));
    }

    @PostMapping("/{requestId}/reject-counter")
    public ResponseEntity<SwapRequestResponse> rejectCounter(@PathVariable Long familyId,
                                                             @PathVariable Long requestId,
                                                             @Valid @RequestBody(required = false) CounterResponseRequest request,
                                                             Authentication authentication) {
        return ResponseEntity.ok(swapRequestService.rejectCounter(familyId,
                currentUserService.resolve(authentication), requestId, request));
    }
}
