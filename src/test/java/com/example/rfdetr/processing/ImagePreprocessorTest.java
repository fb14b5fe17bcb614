package com.example.rfdetr.processing;

import org.junit.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Arrays;

import static org.junit.Assert.*;

public class ImagePreprocessorTest {

    private static final float[] MEANS = {0.485f, 0.456f, 0.406f};
    private static final float[] STDS = {0.229f, 0.224f, 0.225f};

    private static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g2d = image.createGraphics();
        g2d.setColor(color);
        g2d.fillRect(0, 0, width, height);
        g2d.dispose();
        return image;
    }

    @Test
    public void testChannelOrderAndNormalization() {
        int res = 4;
        ImagePreprocessor preprocessor = new ImagePreprocessor(res, MEANS, STDS);
        float[] tensor = new float[3 * res * res];

        preprocessor.preprocess(solid(res, res, new Color(255, 0, 51)), tensor);

        int plane = res * res;
        float r = (1.0f - 0.485f) / 0.229f;
        float g = (0.0f - 0.456f) / 0.224f;
        float b = (51 / 255.0f - 0.406f) / 0.225f;
        for (int i = 0; i < plane; i++) {
            assertEquals(r, tensor[i], 1e-4f);
            assertEquals(g, tensor[plane + i], 1e-4f);
            assertEquals(b, tensor[2 * plane + i], 1e-4f);
        }
    }

    @Test
    public void testResizesAnyInputSize() {
        ImagePreprocessor preprocessor = new ImagePreprocessor(8, MEANS, STDS);
        float[] tensor = new float[3 * 64];

        preprocessor.preprocess(solid(37, 13, Color.WHITE), tensor);

        float expectedR = (1.0f - 0.485f) / 0.229f;
        assertEquals(expectedR, tensor[0], 1e-4f);
        assertEquals(expectedR, tensor[63], 1e-4f);
    }

    @Test
    public void testOverwritesEveryTensorEntry() {
        int res = 6;
        ImagePreprocessor preprocessor = new ImagePreprocessor(res, MEANS, STDS);
        float[] tensor = new float[3 * res * res + 5];
        Arrays.fill(tensor, Float.NaN);

        preprocessor.preprocess(solid(10, 10, Color.GRAY), tensor);

        for (int i = 0; i < 3 * res * res; i++) {
            assertFalse("第 " + i + " 个元素未写入", Float.isNaN(tensor[i]));
        }
        // 超出部分不动
        assertTrue(Float.isNaN(tensor[3 * res * res]));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsSmallOutput() {
        new ImagePreprocessor(4, MEANS, STDS).preprocess(solid(4, 4, Color.BLACK), new float[47]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveResolution() {
        new ImagePreprocessor(0, MEANS, STDS);
    }
}
