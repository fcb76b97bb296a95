package com.coparent.controller;

import com.coparent.dto.CalendarEventRequest;
import com.coparent.dto.CalendarEventResponse;
import com.coparent.dto.CustodyDecisionRequest;
import com.coparent.dto.CustodyScheduleRequest;
import com.coparent.dto.CustodyScheduleResponse;
import com.coparent.entity.CalendarEvent;
import com.coparent.service.CalendarService;
import com.coparent.service.CurrentUserService;
import com.coparent.service.CustodyScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/calendar/{familyId}")
@RequiredArgsConstructor
public class CalendarController {

    private final CurrentUserService currentUserService;
    private final CalendarService calendarService;
    private final CustodyScheduleService custodyScheduleService;

    @GetMapping("/events")
    public ResponseEntity<List<CalendarEventResponse>> listEvents(
            @PathVariable Long familyId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) CalendarEvent.EventType type,
            Authentication authentication) {
        return ResponseEntity.ok(calendarService.list(familyId, currentUserService.resolve(authentication),
                from, to, type));
    }

    @GetMapping("/events/{eventId}")
    public ResponseEntity<CalendarEventResponse> getEvent(@PathVariable Long familyId,
                                                          @PathVariable Long eventId,
                                                          Authentication authentication) {
        return ResponseEntity.ok(calendarService.get(familyId, currentUserService.resolve(authentication), eventId));
    }

    @PostMapping("/events")
    public ResponseEntity<CalendarEventResponse> createEvent(@PathVariable Long familyId,
                                                             @Valid @RequestBody CalendarEventRequest request,
                                                             Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(calendarService.create(familyId, currentUserService.resolve(authentication), request));
    }

    @PutMapping("/events/{eventId}")
    public ResponseEntity<CalendarEventResponse> updateEvent(@PathVariable Long familyId,
                                                             @PathVariable Long eventId,
                                                             @Valid @RequestBody CalendarEventRequest request,
                                                             Authentication authentication) {
        return ResponseEntity.ok(calendarService.update(familyId, currentUserService.resolve(authentication),
                eventId, request));
    }

    @DeleteMapping("/events/{eventId}")
    public ResponseEntity<Void> deleteEvent(@PathVariable Long familyId,
                                            @PathVariable Long eventId,
                                            Authentication authentication) {
        calendarService.delete(familyId, currentUserService.resolve(authentication), eventId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/custody")
    public ResponseEntity<CustodyScheduleResponse> getCustody(@PathVariable Long familyId,
                                                              Authentication authentication) {
        return ResponseEntity.ok(custodyScheduleService.get(familyId, currentUserService.resolve(authentication)));
    }

    @PutMapping("/custody")
    public ResponseEntity<CustodyScheduleResponse> saveCustody(@PathVariable Long familyId,
                                                               @Valid @RequestBody CustodyScheduleRequest request,
                                                               Authentication authentication) {
        return ResponseEntity.ok(custodyScheduleService.save(familyId, currentUserService.resolve(authentication),
                request));
    }

    @PostMapping("/custody/approve")
    public ResponseEntity<CustodyScheduleResponse> respondToCustody(@PathVariable Long familyId,
                                                                    @Valid @RequestBody CustodyDecisionRequest request,
                                                                    Authentication authentication) {
        return ResponseEntity.ok(custodyScheduleService.respond(familyId, currentUserService.resolve(authentication),
                request.getApprove()));
    }

    @PostMapping("/custody/cancel")
    public ResponseEntity<CustodyScheduleResponse> cancelCustodyChange(@PathVariable Long familyId,
                                                                       Authentication authentication) {
        return ResponseEntity.ok(custodyScheduleService.cancelPending(familyId,
                currentUserService.resolve(authentication)));
    }

    @DeleteMapping("/custody")
    public ResponseEntity<Void> deleteCustody(@PathVariable Long familyId, Authentication authentication) {
        custodyScheduleService.delete(familyId, currentUserService.resolve(authentication));
        return ResponseEntity.noContent().build();
    }
}
