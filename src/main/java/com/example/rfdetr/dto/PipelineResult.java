package com.example.rfdetr.dto;

import com.example.rfdetr.processing.ModelType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 视频推理结果DTO
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PipelineResult {

    /** 是否成功 */
    private boolean success;

    /** 错误信息 */
    private String error;

    /** 消息信息 */
    private String message;

    /** 视频路径 */
    private String videoPath;

    /** 输出视频路径 */
    private String outputPath;

    /** 处理开始时间 */
    private LocalDateTime startTime;

    /** 处理结束时间 */
    private LocalDateTime endTime;

    /** 总处理时间（毫秒） */
    private long processingTimeMs;

    /** 处理完成的帧数 */
    private long totalFrames;

    /** 平均处理速度（帧/秒） */
    private double fps;

    /** 模型输入分辨率 */
    private int resolution;

    private ModelType modelType;

    /** 推理后端名称 */
    private String backend;
}
