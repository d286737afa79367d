package com.droidassist.service;

import com.droidassist.bridge.DeviceBridge;
import com.droidassist.dto.ExtractionDTO;
import com.droidassist.extraction.BoundingBox;
import com.droidassist.extraction.ExtractedValue;
import com.droidassist.extraction.TextElement;
import com.droidassist.extraction.UiHierarchyParser;
import com.droidassist.extraction.ValueCandidate;
import com.droidassist.extraction.ValueExtractor;
import com.droidassist.extraction.ValueKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads balances and data allowances, from a supplied text dump or from the device screen.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScreenValueService {

    private final ValueExtractor valueExtractor;
    private final UiHierarchyParser uiHierarchyParser;
    private final DeviceBridge bridge;

    @Value("${droidassist.extraction.dump-timeout-ms:10000}")
    private long dumpTimeoutMs;

    public ExtractionDTO.Response extract(ExtractionDTO.Request request) {
        if (request.getKind() == null) {
            throw new IllegalArgumentException("Value kind is required");
        }
        if (request.getElements() == null) {
            throw new IllegalArgumentException("Element list is required");
        }
        return extract(toElements(request.getElements()), request.getKind(), request.isIncludeCandidates());
    }

    /**
     * Dumps the current screen and extracts from it. Navigating to the right page is the caller's job.
     */
    public ExtractionDTO.Response extractFromScreen(ValueKind kind, boolean includeCandidates) {
        String xml = bridge.dumpUiHierarchy(Duration.ofMillis(dumpTimeoutMs));
        List<TextElement> elements = uiHierarchyParser.parse(xml);
        return extract(elements, kind, includeCandidates);
    }

    ExtractionDTO.Response extract(List<TextElement> elements, ValueKind kind, boolean includeCandidates) {
        List<ValueCandidate> ranked = valueExtractor.rank(elements, kind);
        Optional<ExtractedValue> result = ranked.stream()
            .findFirst()
            .filter(ValueCandidate::isAcceptable)
            .map(ExtractedValue::from);

        ExtractionDTO.Response.ResponseBuilder response = ExtractionDTO.Response.builder()
            .kind(kind)
            .found(result.isPresent())
            .elementCount(elements.size());
        result.ifPresentOrElse(value -> {
            response.value(value.getValue())
                .unit(value.getUnit())
                .normalizedValue(value.getNormalizedValue())
                .displayText(value.getDisplayText())
                .sourceText(value.getSourceText())
                .sourceIndex(value.getSourceIndex())
                .score(value.getScore());
            log.info("Extracted {} {} from '{}' (score {})", kind, value.getDisplayText(),
                value.getSourceText(), value.getScore());
        }, () -> log.info("No {} value among {} elements ({} candidates)", kind, elements.size(), ranked.size()));

        if (includeCandidates) {
            response.candidates(ranked.stream().map(this::mapCandidate).collect(Collectors.toList()));
        }
        return response.build();
    }

    private List<TextElement> toElements(List<ExtractionDTO.Element> dtos) {
        List<TextElement> elements = new ArrayList<>(dtos.size());
        for (ExtractionDTO.Element dto : dtos) {
            if (dto == null) {
                continue;
            }
            TextElement element = new TextElement(dto.getText(), elements.size(),
                BoundingBox.parse(dto.getBounds()).orElse(null));
            if (!element.isBlank()) {
                elements.add(element);
            }
        }
        return elements;
    }

    private ExtractionDTO.Candidate mapCandidate(ValueCandidate candidate) {
        return ExtractionDTO.Candidate.builder()
            .rawText(candidate.getRawText())
            .numericValue(candidate.getNumericValue())
            .unit(candidate.getUnit())
            .sourceIndex(candidate.getSourceIndex())
            .score(candidate.getScore())
            .reasons(candidate.getReasons())
            .build();
    }
}
