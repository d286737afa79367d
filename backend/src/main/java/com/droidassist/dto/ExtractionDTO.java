package com.droidassist.dto;

import com.droidassist.extraction.ValueKind;
import com.droidassist.extraction.ValueUnit;
import lombok.*;

import java.util.List;

public class ExtractionDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Request {
        private ValueKind kind;
        private List<Element> elements;
        private boolean includeCandidates;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Element {
        private String text;
        private String bounds; // uiautomator form "[x1,y1][x2,y2]", optional
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private ValueKind kind;
        private boolean found;
        private Double value;
        private ValueUnit unit;
        private Double normalizedValue;
        private String displayText;
        private String sourceText;
        private Integer sourceIndex;
        private Integer score;
        private int elementCount;
        private List<Candidate> candidates;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Candidate {
        private String rawText;
        private double numericValue;
        private ValueUnit unit;
        private int sourceIndex;
        private int score;
        private List<String> reasons;
    }
}
