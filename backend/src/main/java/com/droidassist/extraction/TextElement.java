package com.droidassist.extraction;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One on-screen text fragment with its position in reading order.
 *
 * Text is NFKC-normalized and trimmed on construction, so full-width digits
 * and currency signs compare equal to their ASCII forms.
 */
@Value
public class TextElement {

    String text;
    int screenIndex;

    @Getter(AccessLevel.NONE)
    BoundingBox boundingBox;

    public TextElement(String text, int screenIndex, BoundingBox boundingBox) {
        this.text = normalize(text);
        this.screenIndex = screenIndex;
        this.boundingBox = boundingBox;
    }

    public static TextElement of(int screenIndex, String text) {
        return new TextElement(text, screenIndex, null);
    }

    /**
     * Builds a dump from plain texts, indexed 0..n-1 in the given order.
     */
    public static List<TextElement> sequence(String... texts) {
        List<TextElement> elements = new ArrayList<>(texts.length);
        for (int i = 0; i < texts.length; i++) {
            elements.add(of(i, texts[i]));
        }
        return elements;
    }

    public Optional<BoundingBox> getBoundingBox() {
        return Optional.ofNullable(boundingBox);
    }

    public boolean isBlank() {
        return text.isEmpty();
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return Normalizer.normalize(raw, Normalizer.Form.NFKC).strip();
    }
}
