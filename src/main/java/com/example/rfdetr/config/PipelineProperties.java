package com.example.rfdetr.config;

import com.example.rfdetr.processing.InferenceConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 流水线默认配置，REST请求中未指定的参数使用这里的值
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "rfdetr.pipeline")
public class PipelineProperties {

    /** 输入视频（启动时运行模式下也可以是图片） */
    private String videoPath;

    private String modelPath;

    private String labelPath;

    private String outputPath = "output_video.mp4";

    private String imageOutputPath = "output_image.jpg";

    /** 槽位数量 */
    private int ringBufferSize = 8;

    private boolean display = false;

    /** 启动后立即处理 videoPath */
    private boolean runOnStartup = false;

    private InferenceConfig inference = new InferenceConfig();
}
