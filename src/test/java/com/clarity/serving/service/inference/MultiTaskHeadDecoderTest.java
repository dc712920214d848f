package com.clarity.serving.service.inference;

import com.clarity.serving.exception.InferenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MultiTaskHeadDecoderTest {

    @Test
    @DisplayName("Heads are read from their logit slots through a sigmoid")
    void testDecode() {
        float[] logits = new float[12];
        logits[0] = 2.0f;
        logits[8] = -1.0f;
        logits[9] = 3.0f;
        logits[10] = 100.0f;

        ModelOutput output = MultiTaskHeadDecoder.decode(logits, new float[]{1.0f, 2.0f});

        assertEquals(ModelOutput.SLEEP_METRIC_COUNT, output.getSleepMetrics().length);
        assertEquals(0.8808f, output.getSleepMetrics()[0], 1e-4f);
        assertEquals(0.5f, output.getSleepMetrics()[7], 1e-6f);
        assertEquals(0.2689f, output.getCircadianScore(), 1e-4f);
        assertEquals(0.9526f, output.getDepressionRisk(), 1e-4f);
        assertArrayEquals(new float[]{1.0f, 2.0f}, output.getEmbedding());
        assertTrue(output.getSleepStages().isEmpty());
    }

    @Test
    @DisplayName("Missing embedding decodes to an empty one")
    void testNoEmbedding() {
        ModelOutput output = MultiTaskHeadDecoder.decode(new float[10], null);

        assertEquals(0, output.getEmbedding().length);
    }

    @Test
    @DisplayName("Too few logits is an inference failure")
    void testTooFewLogits() {
        assertThrows(InferenceException.class, () -> MultiTaskHeadDecoder.decode(new float[9], new float[0]));
        assertThrows(InferenceException.class, () -> MultiTaskHeadDecoder.decode(null, new float[0]));
    }
}
