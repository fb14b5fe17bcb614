package com.example.rfdetr.processing;

import org.junit.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Locale;

import static org.junit.Assert.*;

public class FrameRendererTest {

    private static BufferedImage filled(int width, int height, int type, Color color) {
        BufferedImage image = new BufferedImage(width, height, type);
        Graphics2D g2d = image.createGraphics();
        g2d.setColor(color);
        g2d.fillRect(0, 0, width, height);
        g2d.dispose();
        return image;
    }

    @Test
    public void testDrawDetectionsDrawsRedBox() {
        BufferedImage image = filled(100, 100, BufferedImage.TYPE_3BYTE_BGR, Color.WHITE);
        DetectionSet detections = new DetectionSet();
        detections.add(0.9f, 0, new BoundingBox(20f, 20f, 80f, 80f));

        new FrameRenderer(Arrays.asList("person")).render(image, detections);

        Color edge = new Color(image.getRGB(20, 60));
        assertEquals(255, edge.getRed());
        assertTrue(edge.getGreen() < 128);
        // 框内部不变
        assertEquals(Color.WHITE.getRGB(), image.getRGB(50, 60));
    }

    @Test
    public void testLabelIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            FrameRenderer renderer = new FrameRenderer(Arrays.asList("person"));

            assertEquals("person: 0.95", renderer.formatLabel(0, 0.951f));
            assertEquals("class 3: 0.50", renderer.formatLabel(3, 0.5f));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    public void testBlendMaskHalfAlpha() {
        BufferedImage image = filled(4, 4, BufferedImage.TYPE_3BYTE_BGR, Color.BLACK);
        byte[] data = new byte[16];
        data[5] = 1;

        FrameRenderer.blendMask(image, new BinaryMask(4, 4, data), new Color(200, 100, 50));

        assertEquals(new Color(100, 50, 25).getRGB(), image.getRGB(1, 1));
        assertEquals(Color.BLACK.getRGB(), image.getRGB(0, 0));
    }

    @Test
    public void testBlendMaskOnIntRgbImage() {
        BufferedImage image = filled(4, 4, BufferedImage.TYPE_INT_RGB, Color.WHITE);
        byte[] data = new byte[16];
        data[15] = 1;

        FrameRenderer.blendMask(image, new BinaryMask(4, 4, data), new Color(0, 0, 0));

        assertEquals(new Color(128, 128, 128).getRGB(), image.getRGB(3, 3));
        assertEquals(Color.WHITE.getRGB(), image.getRGB(0, 0));
    }

    @Test
    public void testSegmentationSkipsMismatchedMask() {
        BufferedImage image = filled(100, 100, BufferedImage.TYPE_3BYTE_BGR, Color.BLACK);
        DetectionSet detections = new DetectionSet();
        detections.add(0.9f, 2, new BoundingBox(0f, 0f, 5f, 5f));
        byte[] data = new byte[100];
        Arrays.fill(data, (byte) 1);
        detections.addMask(new BinaryMask(10, 10, data));

        new FrameRenderer(Arrays.asList("a", "b")).render(image, detections);

        // 掩码没有混合到图像上
        assertEquals(Color.BLACK.getRGB(), image.getRGB(90, 90));
    }
}
