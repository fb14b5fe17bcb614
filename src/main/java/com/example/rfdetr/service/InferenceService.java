package com.example.rfdetr.service;

import com.example.rfdetr.dto.ImageInferenceRequest;
import com.example.rfdetr.dto.ImageInferenceResult;
import com.example.rfdetr.dto.PipelineResult;
import com.example.rfdetr.dto.VideoInferenceRequest;
import reactor.core.publisher.Mono;

/**
 * RF-DETR 推理服务接口
 */
public interface InferenceService {

    /**
     * 运行视频流水线：解码、推理、绘制并写出结果视频
     *
     * @param request 推理请求，未指定的参数使用默认配置
     * @return 处理结果，失败时 success=false
     */
    Mono<PipelineResult> processVideo(VideoInferenceRequest request);

    /**
     * 单张图片推理并保存绘制结果
     */
    Mono<ImageInferenceResult> detectImage(ImageInferenceRequest request);
}
