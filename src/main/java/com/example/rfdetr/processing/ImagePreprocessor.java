package com.example.rfdetr.processing;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * 帧预处理：缩放 → BGR转RGB → [0,1] → CHW → 按通道归一化。
 * <p>
 * 内部持有一张 resolution x resolution 的缩放缓冲图，非线程安全，每个预处理线程一个实例。
 */
public class ImagePreprocessor {

    private static final float INV_255 = 1.0f / 255.0f;

    private final int resolution;
    private final float[] means;
    private final float[] stds;
    private final BufferedImage resized;

    public ImagePreprocessor(int resolution, float[] means, float[] stds) {
        if (resolution <= 0) {
            throw new IllegalArgumentException("预处理分辨率必须大于0: " + resolution);
        }
        this.resolution = resolution;
        this.means = means.clone();
        this.stds = stds.clone();
        this.resized = new BufferedImage(resolution, resolution, BufferedImage.TYPE_3BYTE_BGR);
    }

    /**
     * 将一帧写入预分配的张量，output长度至少为 3 * resolution²，前 3 * resolution² 个元素全部被覆盖
     */
    public void preprocess(BufferedImage frame, float[] output) {
        int channelSize = resolution * resolution;
        if (output.length < 3 * channelSize) {
            throw new IllegalArgumentException(
                    String.format("张量缓冲区过小: %d < %d", output.length, 3 * channelSize));
        }

        Graphics2D g2d = resized.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.drawImage(frame, 0, 0, resolution, resolution, null);
        } finally {
            g2d.dispose();
        }

        // TYPE_3BYTE_BGR: 每个像素依次为 B, G, R
        byte[] pixels = ((DataBufferByte) resized.getRaster().getDataBuffer()).getData();
        for (int p = 0; p < channelSize; p++) {
            int base = p * 3;
            output[p] = (pixels[base + 2] & 0xFF) * INV_255;
            output[channelSize + p] = (pixels[base + 1] & 0xFF) * INV_255;
            output[2 * channelSize + p] = (pixels[base] & 0xFF) * INV_255;
        }

        ProcessingUtils.normalizeImage(output, channelSize, means, stds);
    }

    public int getResolution() {
        return resolution;
    }
}
