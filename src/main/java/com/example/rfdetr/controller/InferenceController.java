package com.example.rfdetr.controller;

import com.example.rfdetr.config.PipelineProperties;
import com.example.rfdetr.dto.ImageInferenceRequest;
import com.example.rfdetr.dto.VideoInferenceRequest;
import com.example.rfdetr.engine.InferenceEngine;
import com.example.rfdetr.engine.InferenceEngineFactory;
import com.example.rfdetr.service.InferenceService;
import com.example.rfdetr.util.MediaFileUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import javax.validation.Valid;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/rfdetr")
@RequiredArgsConstructor
public class InferenceController {

    private final InferenceService inferenceService;
    private final PipelineProperties properties;
    private final InferenceEngineFactory engineFactory;

    /**
     * 视频推理，处理完成后返回
     */
    @PostMapping("/video")
    public Mono<ResponseEntity<Map<String, Object>>> processVideo(@Valid @RequestBody VideoInferenceRequest request) {
        String videoPath = request.getVideoPath() != null ? request.getVideoPath() : properties.getVideoPath();
        if (videoPath != null && !MediaFileUtil.isVideoFile(videoPath)) {
            return Mono.just(ResponseEntity.badRequest().body(errorResponse("不支持的视频格式: " + videoPath)));
        }

        return inferenceService.processVideo(request)
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", result.isSuccess());
                    response.put("result", result);
                    return result.isSuccess()
                            ? ResponseEntity.ok(response)
                            : ResponseEntity.badRequest().body(response);
                })
                .onErrorResume(ex -> {
                    log.error("视频推理失败: {}", ex.getMessage(), ex);
                    return Mono.just(ResponseEntity.badRequest().body(errorResponse(ex.getMessage())));
                });
    }

    /**
     * 单张图片推理
     */
    @PostMapping("/image")
    public Mono<ResponseEntity<Map<String, Object>>> detectImage(@Valid @RequestBody ImageInferenceRequest request) {
        return inferenceService.detectImage(request)
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", result.isSuccess());
                    response.put("result", result);
                    return result.isSuccess()
                            ? ResponseEntity.ok(response)
                            : ResponseEntity.badRequest().body(response);
                })
                .onErrorResume(ex -> {
                    log.error("图片推理失败: {}", ex.getMessage(), ex);
                    return Mono.just(ResponseEntity.badRequest().body(errorResponse(ex.getMessage())));
                });
    }

    /**
     * 推理后端、默认配置和JVM信息
     */
    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> getStatus() {
        return Mono.fromCallable(() -> {
            Map<String, Object> status = new HashMap<>();
            status.put("status", "RUNNING");
            status.put("timestamp", LocalDateTime.now().toString());
            try (InferenceEngine engine = engineFactory.create()) {
                status.put("backend", engine.getBackendName());
            } catch (Exception e) {
                log.warn("推理后端不可用: {}", e.getMessage());
                status.put("backend", "UNAVAILABLE");
            }
            status.put("modelPath", properties.getModelPath());
            status.put("labelPath", properties.getLabelPath());
            status.put("ringBufferSize", properties.getRingBufferSize());
            status.put("modelType", properties.getInference().getModelType());
            status.put("resolution", properties.getInference().getResolution());
            status.put("threshold", properties.getInference().getThreshold());
            status.put("maxDetections", properties.getInference().getMaxDetections());
            status.put("supportedVideoFormats", MediaFileUtil.getVideoExtensions());

            MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
            Map<String, Object> systemInfo = new HashMap<>();
            systemInfo.put("javaVersion", System.getProperty("java.version"));
            systemInfo.put("processors", Runtime.getRuntime().availableProcessors());
            systemInfo.put("heapUsed", memoryBean.getHeapMemoryUsage().getUsed());
            systemInfo.put("heapMax", memoryBean.getHeapMemoryUsage().getMax());
            status.put("system", systemInfo);
            return ResponseEntity.ok(status);
        });
    }

    private Map<String, Object> errorResponse(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("error", message);
        return error;
    }
}
