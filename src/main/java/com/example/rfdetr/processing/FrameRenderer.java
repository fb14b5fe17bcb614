package com.example.rfdetr.processing;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.List;
import java.util.Locale;

/**
 * 在原始帧上绘制检测框、标签和分割掩码
 */
public class FrameRenderer {

    private static final float MASK_ALPHA = 0.5f;
    private static final int LABEL_PADDING = 2;
    private static final int LABEL_OFFSET = 5;

    private final List<String> labels;
    private final Font font = new Font(Font.SANS_SERIF, Font.PLAIN, 14);

    public FrameRenderer(List<String> labels) {
        this.labels = labels;
    }

    /**
     * 根据是否带掩码选择检测或分割绘制方式
     */
    public void render(BufferedImage image, DetectionSet detections) {
        if (detections.hasMasks()) {
            drawSegmentation(image, detections);
        } else {
            drawDetections(image, detections);
        }
    }

    public void drawDetections(BufferedImage image, DetectionSet detections) {
        Graphics2D g2d = image.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setFont(font);
            for (int i = 0; i < detections.size(); i++) {
                drawBox(g2d, image.getWidth(), detections, i, Color.RED);
            }
        } finally {
            g2d.dispose();
        }
    }

    public void drawSegmentation(BufferedImage image, DetectionSet detections) {
        List<BinaryMask> masks = detections.getMasks();
        for (int i = 0; i < detections.size() && i < masks.size(); i++) {
            BinaryMask mask = masks.get(i);
            // 尺寸不一致的掩码直接跳过
            if (mask.getWidth() == image.getWidth() && mask.getHeight() == image.getHeight()) {
                blendMask(image, mask, ProcessingUtils.colorForClass(detections.getClassId(i)));
            }
        }

        Graphics2D g2d = image.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setFont(font);
            for (int i = 0; i < detections.size(); i++) {
                drawBox(g2d, image.getWidth(), detections, i,
                        ProcessingUtils.colorForClass(detections.getClassId(i)));
            }
        } finally {
            g2d.dispose();
        }
    }

    private void drawBox(Graphics2D g2d, int imageWidth, DetectionSet detections, int i, Color color) {
        BoundingBox box = detections.getBox(i);
        int x1 = Math.round(box.getXMin());
        int y1 = Math.round(box.getYMin());
        int x2 = Math.round(box.getXMax());
        int y2 = Math.round(box.getYMax());

        g2d.setColor(color);
        g2d.setStroke(new BasicStroke(2.0f));
        g2d.drawRect(x1, y1, Math.max(0, x2 - x1), Math.max(0, y2 - y1));

        String label = formatLabel(detections.getClassId(i), detections.getScore(i));
        FontMetrics fm = g2d.getFontMetrics();
        int textW = fm.stringWidth(label);
        int textH = fm.getAscent();

        // 标签放在框上方，超出上边界则放到框内，超出右边界则左移
        int textX = x1;
        int textY = y1 - LABEL_OFFSET;
        if (textY - textH < 0) {
            textY = y1 + textH + LABEL_OFFSET;
        }
        if (textX + textW > imageWidth) {
            textX = imageWidth - textW - LABEL_OFFSET;
        }

        g2d.setColor(Color.BLACK);
        g2d.fillRect(textX - LABEL_PADDING, textY - textH - LABEL_PADDING,
                textW + 2 * LABEL_PADDING, textH + 2 * LABEL_PADDING);
        g2d.setColor(Color.WHITE);
        g2d.drawString(label, textX, textY);
    }

    /**
     * "名称: 分数"，分数固定两位小数，不受默认Locale影响
     */
    String formatLabel(int classId, float score) {
        return String.format(Locale.ROOT, "%s: %.2f", LabelLoader.labelFor(labels, classId), score);
    }

    static void blendMask(BufferedImage image, BinaryMask mask, Color color) {
        int width = image.getWidth();
        int height = image.getHeight();

        if (image.getType() == BufferedImage.TYPE_3BYTE_BGR) {
            byte[] pixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            for (int p = 0; p < width * height; p++) {
                if (mask.getData()[p] == 0) {
                    continue;
                }
                int base = p * 3;
                pixels[base] = blend(pixels[base] & 0xFF, color.getBlue());
                pixels[base + 1] = blend(pixels[base + 1] & 0xFF, color.getGreen());
                pixels[base + 2] = blend(pixels[base + 2] & 0xFF, color.getRed());
            }
            return;
        }

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (!mask.isSet(x, y)) {
                    continue;
                }
                int rgb = image.getRGB(x, y);
                int r = blend((rgb >> 16) & 0xFF, color.getRed()) & 0xFF;
                int g = blend((rgb >> 8) & 0xFF, color.getGreen()) & 0xFF;
                int b = blend(rgb & 0xFF, color.getBlue()) & 0xFF;
                image.setRGB(x, y, (rgb & 0xFF000000) | (r << 16) | (g << 8) | b);
            }
        }
    }

    private static byte blend(int base, int overlay) {
        return (byte) Math.round(overlay * MASK_ALPHA + base * (1.0f - MASK_ALPHA));
    }
}
