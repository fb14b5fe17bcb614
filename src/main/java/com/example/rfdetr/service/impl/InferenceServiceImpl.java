package com.example.rfdetr.service.impl;

import com.example.rfdetr.config.PipelineProperties;
import com.example.rfdetr.dto.DetectionInfo;
import com.example.rfdetr.dto.ImageInferenceRequest;
import com.example.rfdetr.dto.ImageInferenceResult;
import com.example.rfdetr.dto.PipelineResult;
import com.example.rfdetr.dto.VideoInferenceRequest;
import com.example.rfdetr.engine.InferenceEngineFactory;
import com.example.rfdetr.pipeline.FrameDisplay;
import com.example.rfdetr.pipeline.FrameSink;
import com.example.rfdetr.pipeline.FrameSource;
import com.example.rfdetr.pipeline.VideoPipeline;
import com.example.rfdetr.pipeline.VideoPipelineConfig;
import com.example.rfdetr.processing.BinaryMask;
import com.example.rfdetr.processing.DetectionSet;
import com.example.rfdetr.processing.DetrInference;
import com.example.rfdetr.processing.FrameRenderer;
import com.example.rfdetr.processing.ImagePreprocessor;
import com.example.rfdetr.processing.InferenceConfig;
import com.example.rfdetr.processing.LabelLoader;
import com.example.rfdetr.processing.ModelType;
import com.example.rfdetr.service.InferenceService;
import com.example.rfdetr.util.MediaFileUtil;
import com.example.rfdetr.video.CanvasFrameDisplay;
import com.example.rfdetr.video.FFmpegFrameSink;
import com.example.rfdetr.video.FFmpegFrameSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class InferenceServiceImpl implements InferenceService {

    private final PipelineProperties properties;
    private final InferenceEngineFactory engineFactory;

    @Override
    public Mono<PipelineResult> processVideo(VideoInferenceRequest request) {
        return Mono.fromCallable(() -> runVideo(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<ImageInferenceResult> detectImage(ImageInferenceRequest request) {
        return Mono.fromCallable(() -> runImage(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    PipelineResult runVideo(VideoInferenceRequest request) {
        LocalDateTime startTime = LocalDateTime.now();
        String videoPath = pick(request.getVideoPath(), properties.getVideoPath());
        String outputPath = pick(request.getOutputPath(), properties.getOutputPath());

        try {
            Path video = requirePath(videoPath, "视频路径不能为空");
            if (!Files.exists(video)) {
                throw new IllegalArgumentException("视频文件不存在: " + videoPath);
            }
            Path model = requirePath(pick(request.getModelPath(), properties.getModelPath()), "模型路径不能为空");
            Path labels = requirePath(pick(request.getLabelPath(), properties.getLabelPath()), "标签路径不能为空");
            Path output = Paths.get(outputPath);

            InferenceConfig inferenceConfig = resolveInferenceConfig(request.getModelType(),
                    request.getThreshold(), request.getMaskThreshold(), request.getMaxDetections());
            ModelInfo modelInfo = inspectModel(model, inferenceConfig);
            inferenceConfig.setResolution(modelInfo.resolution);

            VideoPipelineConfig pipelineConfig = VideoPipelineConfig.builder()
                    .videoPath(video)
                    .modelPath(model)
                    .labelPath(labels)
                    .outputPath(output)
                    .inferenceConfig(inferenceConfig)
                    .ringBufferSize(request.getRingBufferSize() != null
                            ? request.getRingBufferSize() : properties.getRingBufferSize())
                    .display(request.getDisplay() != null ? request.getDisplay() : properties.isDisplay())
                    .build();

            log.info("开始视频推理: {} -> {}, 分辨率: {}, 模型类型: {}",
                    videoPath, outputPath, inferenceConfig.getResolution(), inferenceConfig.getModelType());

            FrameDisplay display = pipelineConfig.isDisplay() ? createDisplay() : null;
            VideoPipeline pipeline = new VideoPipeline(pipelineConfig,
                    createSource(video), createSink(output), display, engineFactory);
            long frames = pipeline.run();

            LocalDateTime endTime = LocalDateTime.now();
            long processingTime = Duration.between(startTime, endTime).toMillis();
            double fps = processingTime > 0 ? frames * 1000.0 / processingTime : 0.0;

            log.info("视频推理完成: {} 帧, 耗时 {} ms, {} FPS", frames, processingTime, String.format("%.2f", fps));

            return PipelineResult.builder()
                    .success(true)
                    .message("视频推理完成")
                    .videoPath(videoPath)
                    .outputPath(outputPath)
                    .startTime(startTime)
                    .endTime(endTime)
                    .processingTimeMs(processingTime)
                    .totalFrames(frames)
                    .fps(fps)
                    .resolution(inferenceConfig.getResolution())
                    .modelType(inferenceConfig.getModelType())
                    .backend(modelInfo.backend)
                    .build();
        } catch (Exception e) {
            log.error("视频推理失败: {}", e.getMessage(), e);
            LocalDateTime endTime = LocalDateTime.now();
            return PipelineResult.builder()
                    .success(false)
                    .error(e.getMessage())
                    .message("视频推理失败")
                    .videoPath(videoPath)
                    .outputPath(outputPath)
                    .startTime(startTime)
                    .endTime(endTime)
                    .processingTimeMs(Duration.between(startTime, endTime).toMillis())
                    .build();
        }
    }

    ImageInferenceResult runImage(ImageInferenceRequest request) {
        long startTime = System.currentTimeMillis();
        String imagePath = request.getImagePath();
        String outputPath = pick(request.getOutputPath(), properties.getImageOutputPath());

        try {
            Path image = requirePath(imagePath, "图像路径不能为空");
            if (!Files.exists(image)) {
                throw new IllegalArgumentException("图片文件不存在: " + imagePath);
            }
            Path model = requirePath(pick(request.getModelPath(), properties.getModelPath()), "模型路径不能为空");
            List<String> labels = LabelLoader.load(
                    requirePath(pick(request.getLabelPath(), properties.getLabelPath()), "标签路径不能为空"));

            BufferedImage original = ImageIO.read(image.toFile());
            if (original == null) {
                throw new IllegalArgumentException("无法读取图片: " + imagePath);
            }
            BufferedImage canvas = toBgr(original);
            int width = canvas.getWidth();
            int height = canvas.getHeight();

            InferenceConfig inferenceConfig = resolveInferenceConfig(request.getModelType(),
                    request.getThreshold(), request.getMaskThreshold(), request.getMaxDetections());

            DetectionSet detections = new DetectionSet();
            int resolution;
            try (DetrInference inference = new DetrInference(engineFactory.create(), model, inferenceConfig)) {
                resolution = inference.getResolution();
                float[] tensor = new float[3 * resolution * resolution];
                new ImagePreprocessor(resolution, inferenceConfig.getMeans(), inferenceConfig.getStds())
                        .preprocess(canvas, tensor);

                inference.runInference(tensor);
                inference.postprocess(width / (float) resolution, height / (float) resolution,
                        height, width, detections);
            }

            new FrameRenderer(labels).render(canvas, detections);
            Path output = Paths.get(outputPath);
            saveImage(canvas, output);

            List<DetectionInfo> infos = toDetectionInfos(detections, labels);
            long processingTime = System.currentTimeMillis() - startTime;
            log.info("图片推理完成: {}, 检测到 {} 个目标, 耗时 {} ms", imagePath, infos.size(), processingTime);

            return ImageInferenceResult.builder()
                    .success(true)
                    .imagePath(imagePath)
                    .outputPath(outputPath)
                    .width(width)
                    .height(height)
                    .resolution(resolution)
                    .processingTimeMs(processingTime)
                    .detections(infos)
                    .build();
        } catch (Exception e) {
            log.error("图片推理失败: {}", e.getMessage(), e);
            return ImageInferenceResult.builder()
                    .success(false)
                    .error(e.getMessage())
                    .imagePath(imagePath)
                    .outputPath(outputPath)
                    .processingTimeMs(System.currentTimeMillis() - startTime)
                    .detections(new ArrayList<>())
                    .build();
        }
    }

    protected FrameSource createSource(Path videoPath) {
        return new FFmpegFrameSource(videoPath);
    }

    protected FrameSink createSink(Path outputPath) {
        return new FFmpegFrameSink(outputPath);
    }

    protected FrameDisplay createDisplay() {
        return new CanvasFrameDisplay("RF-DETR Inference");
    }

    /**
     * 用临时推理后端读取模型输入分辨率；模型不可用时在启动流水线前失败
     */
    private ModelInfo inspectModel(Path model, InferenceConfig inferenceConfig) {
        try (DetrInference inference = new DetrInference(engineFactory.create(), model, inferenceConfig)) {
            log.debug("模型 {} 输入分辨率: {}, 后端: {}", model, inference.getResolution(), inference.getBackendName());
            return new ModelInfo(inference.getResolution(), inference.getBackendName());
        }
    }

    private InferenceConfig resolveInferenceConfig(ModelType modelType,
                                                   Float threshold, Float maskThreshold, Integer maxDetections) {
        InferenceConfig config = properties.getInference().copy();
        if (modelType != null) {
            config.setModelType(modelType);
        }
        if (threshold != null) {
            config.setThreshold(threshold);
        }
        if (maskThreshold != null) {
            config.setMaskThreshold(maskThreshold);
        }
        if (maxDetections != null) {
            config.setMaxDetections(maxDetections);
        }
        return config;
    }

    private List<DetectionInfo> toDetectionInfos(DetectionSet detections, List<String> labels) {
        List<DetectionInfo> infos = new ArrayList<>(detections.size());
        for (int i = 0; i < detections.size(); i++) {
            int classId = detections.getClassId(i);
            Integer maskPixels = null;
            if (detections.hasMasks()) {
                BinaryMask mask = detections.getMasks().get(i);
                maskPixels = mask.countNonZero();
            }
            infos.add(DetectionInfo.builder()
                    .classId(classId)
                    .label(LabelLoader.labelFor(labels, classId))
                    .score(detections.getScore(i))
                    .bbox(detections.getBox(i).toArray())
                    .maskPixels(maskPixels)
                    .build());
        }
        return infos;
    }

    private static BufferedImage toBgr(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_3BYTE_BGR) {
            return source;
        }
        BufferedImage converted = new BufferedImage(
                source.getWidth(), source.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g2d = converted.createGraphics();
        try {
            g2d.drawImage(source, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return converted;
    }

    private static void saveImage(BufferedImage image, Path output) throws IOException {
        MediaFileUtil.ensureParentDirectory(output);
        String format = MediaFileUtil.getExtension(output.toString());
        if (format == null || "jpeg".equals(format)) {
            format = "jpg";
        }
        if (!ImageIO.write(image, format, output.toFile())) {
            throw new IOException("不支持的图片格式: " + format);
        }
    }

    private static String pick(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static Path requirePath(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return Paths.get(value);
    }

    private static final class ModelInfo {
        private final int resolution;
        private final String backend;

        private ModelInfo(int resolution, String backend) {
            this.resolution = resolution;
            this.backend = backend;
        }
    }
}
