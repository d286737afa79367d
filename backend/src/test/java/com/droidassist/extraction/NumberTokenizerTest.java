package com.droidassist.extraction;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("NumberTokenizer Tests")
class NumberTokenizerTest {

    @Nested
    @DisplayName("Data Units")
    class DataUnitTests {

        @Test
        @DisplayName("Should not read network generation labels as data")
        void shouldSkipNetworkGenerationLabels() {
            assertTrue(NumberTokenizer.tokenize("5G套餐", ValueKind.DATA).isEmpty());
            assertTrue(NumberTokenizer.tokenize("4G", ValueKind.DATA).isEmpty());
            assertTrue(NumberTokenizer.tokenize("5G 网络已开启", ValueKind.DATA).isEmpty());
        }

        @Test
        @DisplayName("Should still read gigabyte amounts written with a single letter")
        void shouldReadSingleLetterGigabytes() {
            List<NumberToken> decimal = NumberTokenizer.tokenize("1.5G", ValueKind.DATA);
            List<NumberToken> twoDigits = NumberTokenizer.tokenize("剩余20G", ValueKind.DATA);

            assertEquals(1, decimal.size());
            assertEquals(1.5, decimal.get(0).getValue(), 1e-9);
            assertEquals(ValueUnit.DATA_GB, decimal.get(0).getUnit());
            assertEquals(20.0, twoDigits.get(0).getValue(), 1e-9);
        }

        @Test
        @DisplayName("Should read a single digit with an explicit GB unit")
        void shouldReadSingleDigitGigabytes() {
            List<NumberToken> tokens = NumberTokenizer.tokenize("2GB", ValueKind.DATA);

            assertEquals(1, tokens.size());
            assertEquals(ValueUnit.DATA_GB, tokens.get(0).getUnit());
        }

        @Test
        @DisplayName("Should keep a plan amount next to a network label")
        void shouldKeepAmountBesideNetworkLabel() {
            List<NumberToken> tokens = NumberTokenizer.tokenize("5G套餐 30GB", ValueKind.DATA);

            assertEquals(1, tokens.size());
            assertEquals(30.0, tokens.get(0).getValue(), 1e-9);
        }
    }

    @Test
    @DisplayName("Should give a bare token only when the whole text is a number")
    void shouldTokenizeBareNumbersOnlyWhole() {
        assertEquals(1, NumberTokenizer.tokenize("88", ValueKind.CURRENCY).size());
        assertNull(NumberTokenizer.tokenize("88", ValueKind.CURRENCY).get(0).getUnit());
        assertTrue(NumberTokenizer.tokenize("第88名", ValueKind.CURRENCY).isEmpty());
    }
}
