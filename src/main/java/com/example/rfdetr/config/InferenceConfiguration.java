package com.example.rfdetr.config;

import com.example.rfdetr.dto.ImageInferenceRequest;
import com.example.rfdetr.dto.ImageInferenceResult;
import com.example.rfdetr.dto.PipelineResult;
import com.example.rfdetr.dto.VideoInferenceRequest;
import com.example.rfdetr.engine.InferenceEngineFactory;
import com.example.rfdetr.engine.OnnxRuntimeEngine;
import com.example.rfdetr.service.InferenceService;
import com.example.rfdetr.util.MediaFileUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 推理后端配置和启动时运行
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class InferenceConfiguration {

    private final PipelineProperties properties;

    @Bean
    public InferenceEngineFactory inferenceEngineFactory() {
        return OnnxRuntimeEngine::new;
    }

    /**
     * rfdetr.pipeline.run-on-startup=true 时处理配置中的输入：视频走流水线，其他按单张图片处理
     */
    @Bean
    public CommandLineRunner pipelineStartupRunner(InferenceService inferenceService) {
        return args -> {
            if (!properties.isRunOnStartup()) {
                return;
            }

            String input = properties.getVideoPath();
            log.info("启动时处理输入: {}", input);

            if (MediaFileUtil.isVideoFile(input)) {
                PipelineResult result = inferenceService.processVideo(new VideoInferenceRequest()).block();
                if (result != null && result.isSuccess()) {
                    log.info("✅ 处理完成 {} 帧, 输出: {}", result.getTotalFrames(), result.getOutputPath());
                } else {
                    log.error("❌ 视频处理失败: {}", result != null ? result.getError() : null);
                }
            } else {
                ImageInferenceRequest request = new ImageInferenceRequest();
                request.setImagePath(input);
                ImageInferenceResult result = inferenceService.detectImage(request).block();
                if (result != null && result.isSuccess()) {
                    log.info("✅ 检测到 {} 个目标, 输出: {}", result.getDetections().size(), result.getOutputPath());
                    result.getDetections().forEach(d -> log.info("  {}", d));
                } else {
                    log.error("❌ 图片处理失败: {}", result != null ? result.getError() : null);
                }
            }
        };
    }
}
