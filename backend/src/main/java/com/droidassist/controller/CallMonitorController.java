package com.droidassist.controller;

import com.droidassist.dto.CallMonitorDTO;
import com.droidassist.service.CallMonitorService;
import com.droidassist.service.ScenarioService;
import com.droidassist.service.UnknownScenarioException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/v1/monitor")
@RequiredArgsConstructor
@Tag(name = "Call Monitor", description = "Call monitoring, answer mode and reply scenarios")
public class CallMonitorController {

    private final CallMonitorService callMonitorService;
    private final ScenarioService scenarioService;

    @GetMapping
    @Operation(summary = "Get call monitor status")
    public ResponseEntity<CallMonitorDTO.Status> getStatus() {
        return ResponseEntity.ok(callMonitorService.getStatus());
    }

    @PostMapping("/start")
    @Operation(summary = "Start monitoring incoming calls")
    public ResponseEntity<CallMonitorDTO.Status> start() {
        return ResponseEntity.ok(callMonitorService.enable());
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop monitoring; a reply in progress still completes")
    public ResponseEntity<CallMonitorDTO.Status> stop() {
        return ResponseEntity.ok(callMonitorService.disable());
    }

    @PutMapping("/auto-answer")
    @Operation(summary = "Reply at once with the current scenario, or reply busy after the ring delay")
    public ResponseEntity<CallMonitorDTO.Status> setAutoAnswer(@RequestBody CallMonitorDTO.AutoAnswerRequest request) {
        if (request.getEnabled() == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(callMonitorService.setAutoAnswer(request.getEnabled()));
    }

    @PutMapping("/ring-delay")
    @Operation(summary = "Set how long a call rings before the busy reply when auto-answer is off")
    public ResponseEntity<CallMonitorDTO.Status> setRingDelay(@RequestBody CallMonitorDTO.RingDelayRequest request) {
        if (request.getSeconds() == null) {
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.ok(callMonitorService.setRingDelay(request.getSeconds()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @GetMapping("/scenarios")
    @Operation(summary = "List reply scenarios and their texts")
    public ResponseEntity<Map<String, String>> getScenarios() {
        return ResponseEntity.ok(scenarioService.getResponses());
    }

    @PutMapping("/scenarios/current")
    @Operation(summary = "Select the scenario used for the next call")
    public ResponseEntity<CallMonitorDTO.Status> selectScenario(@RequestBody CallMonitorDTO.ScenarioRequest request) {
        try {
            scenarioService.selectScenario(request.getScenario());
            return ResponseEntity.ok(callMonitorService.getStatus());
        } catch (UnknownScenarioException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PutMapping("/scenarios/{name}")
    @Operation(summary = "Set a scenario's reply text, adding the scenario if new")
    public ResponseEntity<Map<String, String>> setResponse(
            @PathVariable String name,
            @RequestBody CallMonitorDTO.ResponseTextRequest request) {
        try {
            scenarioService.setResponse(name, request.getText());
            return ResponseEntity.ok(Map.of(name.strip(), scenarioService.getResponse(name.strip())));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }
}
