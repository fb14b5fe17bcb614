package com.example.rfdetr.pipeline;

import java.awt.image.BufferedImage;

/**
 * 实时预览
 */
public interface FrameDisplay extends AutoCloseable {

    /**
     * 显示一帧
     *
     * @return false 表示用户要求停止（例如按下ESC或关闭窗口）
     */
    boolean show(BufferedImage frame) throws InterruptedException;

    @Override
    void close();
}
