package com.example.rfdetr.pipeline;

import com.example.rfdetr.processing.InferenceConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * 视频流水线配置
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class VideoPipelineConfig {

    /** 输入视频 */
    private Path videoPath;

    /** 模型文件 */
    private Path modelPath;

    /** 标签文件 */
    private Path labelPath;

    /** 输出视频 */
    @Builder.Default
    private Path outputPath = Path.of("output_video.mp4");

    /** 推理参数，resolution 必须已经确定（>0） */
    @Builder.Default
    private InferenceConfig inferenceConfig = new InferenceConfig();

    /** 槽位数量 */
    @Builder.Default
    private int ringBufferSize = 8;

    /** 是否实时预览 */
    private boolean display;
}
