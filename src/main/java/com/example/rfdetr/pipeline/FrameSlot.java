package com.example.rfdetr.pipeline;

import com.example.rfdetr.processing.DetectionSet;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * 预分配的单帧缓冲：原始帧、模型输入张量和解码结果。
 * 任一时刻只有持有其索引的那个阶段访问它，槽位本身不加锁。
 */
public class FrameSlot {

    private final int index;
    private final float[] tensor;
    private final DetectionSet detections = new DetectionSet();

    private BufferedImage rawFrame;
    private int origH;
    private int origW;
    private long frameNumber;

    FrameSlot(int index, int resolution) {
        this.index = index;
        this.tensor = new float[3 * resolution * resolution];
    }

    /**
     * 将解码得到的帧复制到槽位自己的缓冲图中，尺寸不变时复用同一张图
     */
    public void load(BufferedImage frame, long frameNumber) {
        int width = frame.getWidth();
        int height = frame.getHeight();
        if (rawFrame == null || rawFrame.getWidth() != width || rawFrame.getHeight() != height) {
            rawFrame = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        }

        Graphics2D g2d = rawFrame.createGraphics();
        try {
            g2d.drawImage(frame, 0, 0, null);
        } finally {
            g2d.dispose();
        }

        this.origW = width;
        this.origH = height;
        this.frameNumber = frameNumber;
    }

    public int getIndex() {
        return index;
    }

    public float[] getTensor() {
        return tensor;
    }

    public DetectionSet getDetections() {
        return detections;
    }

    public BufferedImage getRawFrame() {
        return rawFrame;
    }

    public int getOrigH() {
        return origH;
    }

    public int getOrigW() {
        return origW;
    }

    public long getFrameNumber() {
        return frameNumber;
    }
}
