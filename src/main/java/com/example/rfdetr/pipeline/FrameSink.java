package com.example.rfdetr.pipeline;

import java.awt.image.BufferedImage;

/**
 * 帧输出目标。尺寸在 open 时固定，按提交顺序写入，close 时完成封装。
 */
public interface FrameSink extends AutoCloseable {

    /**
     * @throws IllegalStateException 输出目标无法打开
     */
    void open(int width, int height, double frameRate);

    void write(BufferedImage frame);

    @Override
    void close();
}
