package com.example.rfdetr.pipeline;

import java.awt.image.BufferedImage;

/**
 * 视频帧来源，按采集顺序输出帧直到耗尽
 */
public interface FrameSource extends AutoCloseable {

    /**
     * 打开视频源
     *
     * @throws IllegalArgumentException 视频不存在或无法打开
     */
    void start();

    /**
     * 读取下一帧。返回的图像可能被来源复用，调用方需要在下次调用前复制。
     *
     * @return 下一帧，视频结束时返回null
     */
    BufferedImage grab();

    double getFrameRate();

    @Override
    void close();
}
