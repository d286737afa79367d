package com.droidassist.controller;

import com.droidassist.dto.CallRecordDTO;
import com.droidassist.service.CallRecordService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/calls")
@RequiredArgsConstructor
@Tag(name = "Call Log", description = "History of auto-answered calls")
public class CallRecordController {

    private final CallRecordService callRecordService;

    @GetMapping
    @Operation(summary = "Most recent call records, newest first")
    public ResponseEntity<List<CallRecordDTO.Response>> getRecent(
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(callRecordService.recent(limit));
    }

    @GetMapping("/stats")
    @Operation(summary = "Call counts")
    public ResponseEntity<CallRecordDTO.Stats> getStats() {
        return ResponseEntity.ok(callRecordService.stats());
    }
}
