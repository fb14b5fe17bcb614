package com.example.rfdetr.processing;

import org.junit.Test;

import java.awt.Color;

import static org.junit.Assert.*;

public class ProcessingUtilsTest {

    private static final float EPS = 1e-5f;

    @Test
    public void testSigmoid() {
        assertEquals(0.5f, ProcessingUtils.sigmoid(0f), EPS);
        assertEquals(1.0f / (1.0f + (float) Math.exp(-5)), ProcessingUtils.sigmoid(5f), EPS);
        assertTrue("大的负logit应接近0", ProcessingUtils.sigmoid(-20f) < 1e-8f);
        assertTrue(ProcessingUtils.sigmoid(20f) > 0.999999f);
    }

    @Test
    public void testSigmoidIsSymmetric() {
        for (float x = -12f; x <= 12f; x += 0.75f) {
            assertEquals(1.0f, ProcessingUtils.sigmoid(x) + ProcessingUtils.sigmoid(-x), EPS);
        }
    }

    @Test
    public void testCenterCornerConversionIsInvertible() {
        float[] original = {123.5f, 48.25f, 30f, 12.5f};

        float[] back = ProcessingUtils.xyxyToCxcywh(
                ProcessingUtils.cxcywhToXyxy(original[0], original[1], original[2], original[3]));

        assertArrayEquals(original, back, EPS);
    }

    @Test
    public void testCxcywhToXyxy() {
        BoundingBox box = ProcessingUtils.cxcywhToXyxy(50f, 50f, 20f, 10f);

        assertEquals(40f, box.getXMin(), EPS);
        assertEquals(45f, box.getYMin(), EPS);
        assertEquals(60f, box.getXMax(), EPS);
        assertEquals(55f, box.getYMax(), EPS);
        assertEquals(20f, box.getWidth(), EPS);
        assertEquals(10f, box.getHeight(), EPS);
    }

    @Test
    public void testXyxyToCxcywh() {
        float[] cxcywh = ProcessingUtils.xyxyToCxcywh(new BoundingBox(10f, 20f, 30f, 60f));

        assertArrayEquals(new float[]{20f, 40f, 20f, 40f}, cxcywh, EPS);
    }

    @Test
    public void testScaleBoxUsesSeparateFactors() {
        BoundingBox scaled = ProcessingUtils.scaleBox(new BoundingBox(10f, 10f, 20f, 20f), 2f, 0.5f);

        assertEquals(20f, scaled.getXMin(), EPS);
        assertEquals(5f, scaled.getYMin(), EPS);
        assertEquals(40f, scaled.getXMax(), EPS);
        assertEquals(10f, scaled.getYMax(), EPS);
    }

    @Test
    public void testNormalizeImagePerChannel() {
        float[] data = {1f, 0f, 0.5f, 0.5f, 0f, 1f};
        ProcessingUtils.normalizeImage(data, 2, new float[]{0.5f, 0.5f, 0f}, new float[]{0.5f, 0.25f, 2f});

        assertArrayEquals(new float[]{1f, -1f, 0f, 0f, 0f, 0.5f}, data, EPS);
    }

    @Test
    public void testColorForClassIsStable() {
        Color first = ProcessingUtils.colorForClass(3);

        assertEquals(first, ProcessingUtils.colorForClass(3));
        assertNotEquals(ProcessingUtils.colorForClass(0), ProcessingUtils.colorForClass(1));
        // 色相按180取模
        assertEquals(ProcessingUtils.colorForClass(0), ProcessingUtils.colorForClass(180));
    }
}
