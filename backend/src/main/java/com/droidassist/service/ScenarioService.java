package com.droidassist.service;

import com.droidassist.entity.ScenarioResponse;
import com.droidassist.repository.ScenarioResponseRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named auto-reply texts and the scenario currently in effect.
 *
 * Built-in texts are the starting set; texts saved through {@link #setResponse}
 * are stored and override them after a restart.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScenarioService {

    public static final String FALLBACK_RESPONSE = "系统忙碌，请稍后再试";

    public static final int MAX_NAME_LENGTH = 64;

    static final Map<String, String> DEFAULT_RESPONSES;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("work", "您好，我现在正在工作无法接听电话。请留言或稍后再拨，我会尽快回复您。");
        defaults.put("meeting", "不好意思，我现在正在开会无法接听电话。请留言说明事由，我会尽快联系您。");
        defaults.put("delivery", "您好，如果是外卖配送，请直接放在门口。如有其他事宜，请稍后再拨。谢谢！");
        defaults.put("unknown", "您好，请问您找哪位？请说明来意，我会记录您的留言。");
        defaults.put("busy", "对不起，我现在很忙无法接听电话。请稍后再拨，或发送短信说明事由。谢谢理解。");
        defaults.put("rest", "现在是我的休息时间，无法接听电话。如有紧急事务，请发送短信。");
        defaults.put("driving", "我现在正在开车，为了安全无法接听电话。请稍后再拨或发送短信。");
        defaults.put("study", "我现在正在学习，无法接听电话。请留言或稍后联系，我会尽快回复。");
        defaults.put("hospital", "我现在在安静的环境中，不便接听电话。请发送短信或稍后联系。");
        DEFAULT_RESPONSES = Map.copyOf(defaults);
    }

    private final ScenarioResponseRepository scenarioResponseRepository;
    private final MonitorSettingsService monitorSettingsService;
    private final Clock clock;

    private final Map<String, String> responses = new ConcurrentHashMap<>(DEFAULT_RESPONSES);

    @PostConstruct
    public void loadStoredResponses() {
        try {
            List<ScenarioResponse> stored = scenarioResponseRepository.findAll();
            stored.forEach(response -> responses.put(response.getName(), response.getText()));
            log.info("Loaded {} stored scenario responses", stored.size());
        } catch (Exception e) {
            log.error("Failed to load stored scenario responses, using built-in texts: {}", e.getMessage(), e);
        }
        String current = getCurrentScenario();
        if (current == null || !responses.containsKey(current)) {
            log.warn("Current scenario '{}' has no text, calls will get the fallback reply", current);
        }
    }

    public String getCurrentScenario() {
        return monitorSettingsService.getCurrentScenario();
    }

    public void selectScenario(String scenario) {
        if (scenario == null || !responses.containsKey(scenario)) {
            throw new UnknownScenarioException(scenario);
        }
        String previous = getCurrentScenario();
        monitorSettingsService.setCurrentScenario(scenario);
        log.info("Scenario switched: {} -> {}", previous, scenario);
    }

    /**
     * Text for a scenario, or the generic busy line when the scenario has none.
     */
    public String getResponse(String scenario) {
        return scenario == null ? FALLBACK_RESPONSE : responses.getOrDefault(scenario, FALLBACK_RESPONSE);
    }

    public String getCurrentResponse() {
        return getResponse(getCurrentScenario());
    }

    public void setResponse(String scenario, String text) {
        if (scenario == null || scenario.isBlank()) {
            throw new IllegalArgumentException("Scenario name is required");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Response text is required");
        }
        String name = scenario.strip();
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Scenario name longer than " + MAX_NAME_LENGTH + " characters");
        }
        String value = text.strip();
        responses.put(name, value);
        log.info("Response for scenario '{}' set: {}", name, abbreviate(value));
        try {
            scenarioResponseRepository.save(ScenarioResponse.builder()
                .name(name)
                .text(value)
                .updatedAt(clock.instant())
                .build());
        } catch (Exception e) {
            log.error("Failed to store response for scenario '{}', it applies until restart: {}", name, e.getMessage(), e);
        }
    }

    public Map<String, String> getResponses() {
        return new TreeMap<>(responses);
    }

    public List<String> getScenarioNames() {
        return List.copyOf(new TreeMap<>(responses).keySet());
    }

    private static String abbreviate(String text) {
        return text.length() > 30 ? text.substring(0, 30) + "..." : text;
    }
}
