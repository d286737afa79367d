package com.droidassist.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.droidassist.bridge.DeviceBridge;
import com.droidassist.dto.ExtractionDTO;
import com.droidassist.extraction.PlausibilityPolicy;
import com.droidassist.extraction.UiDumpParseException;
import com.droidassist.extraction.UiHierarchyParser;
import com.droidassist.extraction.ValueExtractor;
import com.droidassist.extraction.ValueKind;
import com.droidassist.extraction.ValueUnit;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScreenValueService Tests")
class ScreenValueServiceTest {

    @Mock
    private DeviceBridge bridge;

    private ScreenValueService screenValueService;

    @BeforeEach
    void setUp() {
        screenValueService = new ScreenValueService(
            new ValueExtractor(PlausibilityPolicy.defaults(), 15), new UiHierarchyParser(), bridge);
        ReflectionTestUtils.setField(screenValueService, "dumpTimeoutMs", 1000L);
    }

    private static ExtractionDTO.Element element(String text) {
        return ExtractionDTO.Element.builder().text(text).build();
    }

    @Nested
    @DisplayName("extract() Method Tests")
    class ExtractTests {

        @Test
        @DisplayName("Should skip blank elements and index the rest densely")
        void shouldSkipBlankElements() {
            ExtractionDTO.Request request = ExtractionDTO.Request.builder()
                .kind(ValueKind.CURRENCY)
                .elements(Arrays.asList(element("剩余话费"), element("  "), null, element("¥66.60")))
                .includeCandidates(true)
                .build();

            ExtractionDTO.Response response = screenValueService.extract(request);

            assertTrue(response.isFound());
            assertEquals(66.60, response.getValue(), 1e-9);
            assertEquals(1, response.getSourceIndex());
            assertEquals(2, response.getElementCount());
            assertEquals(1, response.getCandidates().size());
            assertFalse(response.getCandidates().get(0).getReasons().isEmpty());
        }

        @Test
        @DisplayName("Should report not found without candidates by default")
        void shouldReportNotFound() {
            ExtractionDTO.Request request = ExtractionDTO.Request.builder()
                .kind(ValueKind.CURRENCY)
                .elements(Arrays.asList(element("充值"), element("100")))
                .build();

            ExtractionDTO.Response response = screenValueService.extract(request);

            assertFalse(response.isFound());
            assertNull(response.getValue());
            assertNull(response.getCandidates());
        }

        @Test
        @DisplayName("Should reject a request without kind or elements")
        void shouldRejectIncompleteRequest() {
            assertThrows(IllegalArgumentException.class, () -> screenValueService.extract(
                ExtractionDTO.Request.builder().elements(Arrays.asList(element("¥5"))).build()));
            assertThrows(IllegalArgumentException.class, () -> screenValueService.extract(
                ExtractionDTO.Request.builder().kind(ValueKind.DATA).build()));
        }
    }

    @Nested
    @DisplayName("extractFromScreen() Method Tests")
    class ExtractFromScreenTests {

        @Test
        @DisplayName("Should extract from the dumped window hierarchy")
        void shouldExtractFromScreen() {
            when(bridge.dumpUiHierarchy(any())).thenReturn("<hierarchy>"
                + "<node text=\"剩余流量\" bounds=\"[0,100][500,160]\"/>"
                + "<node text=\"12.5GB\" bounds=\"[0,180][500,240]\"/>"
                + "</hierarchy>");

            ExtractionDTO.Response response = screenValueService.extractFromScreen(ValueKind.DATA, false);

            assertTrue(response.isFound());
            assertEquals(ValueUnit.DATA_GB, response.getUnit());
            assertEquals(12.5 * 1024, response.getNormalizedValue(), 1e-9);
        }

        @Test
        @DisplayName("Should propagate an unreadable dump")
        void shouldPropagateParseFailure() {
            when(bridge.dumpUiHierarchy(any())).thenReturn("ERROR: could not get idle state.");

            assertThrows(UiDumpParseException.class,
                () -> screenValueService.extractFromScreen(ValueKind.CURRENCY, false));
        }
    }
}
