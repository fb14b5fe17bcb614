package com.example.rfdetr.video;

import com.example.rfdetr.pipeline.FrameSink;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.ffmpeg.global.avcodec;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.FrameRecorder;
import org.bytedeco.javacv.Java2DFrameConverter;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 基于 FFmpegFrameRecorder 的视频输出，MPEG-4 编码
 */
@Slf4j
public class FFmpegFrameSink implements FrameSink {

    private static final double DEFAULT_FRAME_RATE = 25.0;

    private final Path outputPath;
    private final Java2DFrameConverter frameConverter = new Java2DFrameConverter();
    private FFmpegFrameRecorder recorder;
    private long framesWritten;

    public FFmpegFrameSink(Path outputPath) {
        this.outputPath = outputPath;
    }

    @Override
    public void open(int width, int height, double frameRate) {
        try {
            Path outputDir = outputPath.toAbsolutePath().getParent();
            if (outputDir != null && !Files.exists(outputDir)) {
                Files.createDirectories(outputDir);
            }
        } catch (IOException e) {
            throw new IllegalStateException("无法创建输出目录: " + outputPath, e);
        }

        recorder = new FFmpegFrameRecorder(outputPath.toString(), width, height);
        recorder.setVideoCodec(avcodec.AV_CODEC_ID_MPEG4);
        recorder.setPixelFormat(avutil.AV_PIX_FMT_YUV420P);
        recorder.setFrameRate(frameRate > 0 ? frameRate : DEFAULT_FRAME_RATE);
        try {
            recorder.start();
        } catch (FrameRecorder.Exception e) {
            release();
            throw new IllegalStateException("无法打开视频输出: " + outputPath + ", " + e.getMessage(), e);
        }

        log.info("打开视频输出: {} ({}x{}, {} fps)", outputPath, width, height, recorder.getFrameRate());
    }

    @Override
    public void write(BufferedImage frame) {
        if (recorder == null) {
            throw new IllegalStateException("视频输出尚未打开: " + outputPath);
        }
        try {
            recorder.record(frameConverter.convert(frame));
            framesWritten++;
        } catch (FrameRecorder.Exception e) {
            throw new IllegalStateException("写入视频帧失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (recorder != null) {
            log.info("视频输出完成: {}, 共 {} 帧", outputPath, framesWritten);
        }
        release();
    }

    private void release() {
        if (recorder != null) {
            try {
                recorder.stop();
                recorder.release();
            } catch (Exception e) {
                log.warn("关闭recorder失败", e);
            }
            recorder = null;
        }
    }
}
