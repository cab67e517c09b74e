package com.deepfake.scan.processor;

import com.deepfake.scan.model.SemanticLabel;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordLabelMapperTest {

    private final KeywordLabelMapper mapper = new KeywordLabelMapper();

    @Test
    void matchesKeywordsCaseInsensitively() {
        assertTrue(mapper.map("Fake").isFake());
        assertTrue(mapper.map("DEEPFAKE").isFake());
        assertTrue(mapper.map("synthetic_face").isFake());
        assertTrue(mapper.map("Real").isReal());
        assertTrue(mapper.map("authentic").isReal());
    }

    @Test
    void fakeKeywordWinsOverReal() {
        assertTrue(mapper.map("real_or_fake").isFake());
    }

    @Test
    void unknownLabelKeepsRawText() {
        SemanticLabel label = mapper.map("LABEL_0");

        assertEquals(SemanticLabel.Kind.UNKNOWN, label.getKind());
        assertEquals("LABEL_0", label.getRawText());
        assertEquals(SemanticLabel.Kind.UNKNOWN, mapper.map(null).getKind());
    }

    @Test
    void customKeywords() {
        KeywordLabelMapper custom = new KeywordLabelMapper(
                Collections.singletonList("Manipulated"), Arrays.asList("original", "pristine"));

        assertTrue(custom.map("manipulated").isFake());
        assertTrue(custom.map("Pristine").isReal());
        assertEquals(SemanticLabel.Kind.UNKNOWN, custom.map("fake").getKind());
    }
}
