package com.droidassist.controller;

import com.droidassist.bridge.DeviceBridgeException;
import com.droidassist.dto.ExtractionDTO;
import com.droidassist.extraction.UiDumpParseException;
import com.droidassist.extraction.ValueKind;
import com.droidassist.service.ScreenValueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/extraction")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Value Extraction", description = "Balance and data allowance extraction from screen text")
public class ExtractionController {

    private final ScreenValueService screenValueService;

    @PostMapping
    @Operation(summary = "Extract the most likely value from an ordered list of screen texts")
    public ResponseEntity<ExtractionDTO.Response> extract(@RequestBody ExtractionDTO.Request request) {
        try {
            return ResponseEntity.ok(screenValueService.extract(request));
        } catch (IllegalArgumentException e) {
            log.debug("Rejected extraction request: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    @GetMapping("/screen/{kind}")
    @Operation(summary = "Dump the device screen and extract a value from it")
    public ResponseEntity<ExtractionDTO.Response> extractFromScreen(
            @PathVariable ValueKind kind,
            @RequestParam(defaultValue = "false") boolean includeCandidates) {
        try {
            return ResponseEntity.ok(screenValueService.extractFromScreen(kind, includeCandidates));
        } catch (DeviceBridgeException e) {
            log.warn("Screen dump failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (UiDumpParseException e) {
            log.warn("Screen dump unreadable: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }
}
