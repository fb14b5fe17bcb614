package com.example.rfdetr.controller;

import com.example.rfdetr.config.PipelineProperties;
import com.example.rfdetr.dto.ImageInferenceRequest;
import com.example.rfdetr.dto.ImageInferenceResult;
import com.example.rfdetr.dto.PipelineResult;
import com.example.rfdetr.dto.VideoInferenceRequest;
import com.example.rfdetr.engine.MockInferenceEngine;
import com.example.rfdetr.service.InferenceService;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Map;

import static org.junit.Assert.*;

public class InferenceControllerTest {

    private PipelineProperties properties;
    private StubInferenceService service;
    private InferenceController controller;

    @Before
    public void setUp() {
        properties = new PipelineProperties();
        properties.setModelPath("models/rfdetr.onnx");
        service = new StubInferenceService();
        controller = new InferenceController(service, properties, () -> new MockInferenceEngine(8, 1, 2));
    }

    @Test
    public void testRejectsNonVideoInput() {
        VideoInferenceRequest request = new VideoInferenceRequest();
        request.setVideoPath("photo.jpg");

        ResponseEntity<Map<String, Object>> response = controller.processVideo(request).block();

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(false, response.getBody().get("success"));
        assertEquals(0, service.videoCalls);
    }

    @Test
    public void testVideoSuccess() {
        service.videoResult = PipelineResult.builder().success(true).totalFrames(12).build();
        VideoInferenceRequest request = new VideoInferenceRequest();
        request.setVideoPath("clip.mp4");

        ResponseEntity<Map<String, Object>> response = controller.processVideo(request).block();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(true, response.getBody().get("success"));
        assertSame(service.videoResult, response.getBody().get("result"));
    }

    @Test
    public void testFailedResultIsBadRequest() {
        service.imageResult = ImageInferenceResult.builder().success(false).error("图片文件不存在: x.png")
                .detections(new ArrayList<>()).build();
        ImageInferenceRequest request = new ImageInferenceRequest();
        request.setImagePath("x.png");

        ResponseEntity<Map<String, Object>> response = controller.detectImage(request).block();

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(false, response.getBody().get("success"));
    }

    @Test
    public void testServiceErrorIsBadRequest() {
        service.failure = new IllegalStateException("boom");
        VideoInferenceRequest request = new VideoInferenceRequest();
        request.setVideoPath("clip.mp4");

        ResponseEntity<Map<String, Object>> response = controller.processVideo(request).block();

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("boom", response.getBody().get("error"));
    }

    @Test
    public void testStatus() {
        ResponseEntity<Map<String, Object>> response = controller.getStatus().block();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> body = response.getBody();
        assertEquals("RUNNING", body.get("status"));
        assertEquals("Mock", body.get("backend"));
        assertEquals("models/rfdetr.onnx", body.get("modelPath"));
        assertEquals(8, body.get("ringBufferSize"));
        assertNotNull(body.get("system"));
    }

    private static class StubInferenceService implements InferenceService {

        private PipelineResult videoResult;
        private ImageInferenceResult imageResult;
        private RuntimeException failure;
        private int videoCalls;

        @Override
        public Mono<PipelineResult> processVideo(VideoInferenceRequest request) {
            videoCalls++;
            return failure != null ? Mono.error(failure) : Mono.just(videoResult);
        }

        @Override
        public Mono<ImageInferenceResult> detectImage(ImageInferenceRequest request) {
            return failure != null ? Mono.error(failure) : Mono.just(imageResult);
        }
    }
}
