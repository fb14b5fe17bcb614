package com.example.rfdetr.video;

import com.example.rfdetr.pipeline.FrameSource;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.Java2DFrameConverter;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 基于 FFmpegFrameGrabber 的视频源，只读取视频帧
 */
@Slf4j
public class FFmpegFrameSource implements FrameSource {

    private final Path videoPath;
    private final Java2DFrameConverter frameConverter = new Java2DFrameConverter();
    private FFmpegFrameGrabber grabber;

    public FFmpegFrameSource(Path videoPath) {
        this.videoPath = videoPath;
    }

    @Override
    public void start() {
        if (videoPath == null || !Files.exists(videoPath)) {
            throw new IllegalArgumentException("视频文件不存在: " + videoPath);
        }

        grabber = new FFmpegFrameGrabber(videoPath.toString());
        try {
            grabber.start();
        } catch (FrameGrabber.Exception e) {
            release();
            throw new IllegalArgumentException("无法打开视频: " + videoPath + ", " + e.getMessage(), e);
        }

        log.info("打开视频: {} ({}x{}, {} fps)", videoPath,
                grabber.getImageWidth(), grabber.getImageHeight(), grabber.getFrameRate());
    }

    @Override
    public BufferedImage grab() {
        try {
            Frame frame;
            while ((frame = grabber.grabImage()) != null) {
                BufferedImage image = frameConverter.convert(frame);
                if (image != null) {
                    return image;
                }
            }
            return null;
        } catch (FrameGrabber.Exception e) {
            throw new IllegalStateException("读取视频帧失败: " + e.getMessage(), e);
        }
    }

    @Override
    public double getFrameRate() {
        return grabber != null ? grabber.getFrameRate() : 0.0;
    }

    @Override
    public void close() {
        release();
    }

    private void release() {
        if (grabber != null) {
            try {
                grabber.stop();
                grabber.release();
            } catch (Exception e) {
                log.warn("关闭grabber失败", e);
            }
            grabber = null;
        }
    }
}
