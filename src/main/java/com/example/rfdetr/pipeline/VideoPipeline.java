package com.example.rfdetr.pipeline;

import com.example.rfdetr.engine.InferenceEngineFactory;
import com.example.rfdetr.processing.DetrInference;
import com.example.rfdetr.processing.FrameRenderer;
import com.example.rfdetr.processing.ImagePreprocessor;
import com.example.rfdetr.processing.InferenceConfig;
import com.example.rfdetr.processing.LabelLoader;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 四阶段环形缓冲视频流水线。
 * <p>
 * 解码 → 预处理 → 推理+后处理 → 绘制+写出，每个阶段一个线程。阶段之间只传递槽位索引，帧数据不复制。
 * 空闲队列容量等于槽位数，所以同时在处理中的帧最多为槽位数，解码速度被最慢的阶段限制。
 * <p>
 * 解码阶段读到视频结尾后发送 {@link SlotTicket#SHUTDOWN}，各阶段收到后转发给下游并退出。
 * 任一阶段失败时，剩余线程通过关闭信号和中断被唤醒，{@link #run()} 在所有线程结束后抛出异常。
 */
@Slf4j
public class VideoPipeline {

    private final VideoPipelineConfig config;
    private final InferenceConfig inferenceConfig;
    private final List<String> labels;
    private final FrameSource source;
    private final FrameSink sink;
    private final FrameDisplay display;
    private final InferenceEngineFactory engineFactory;

    private final SlotPool pool;
    private final BoundedQueue<SlotTicket> freeSlots;
    private final BoundedQueue<SlotTicket> decodeToPreprocess;
    private final BoundedQueue<SlotTicket> preprocessToInfer;
    private final BoundedQueue<SlotTicket> inferToDraw;

    private final AtomicLong framesProcessed = new AtomicLong();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile List<Thread> workers = Collections.emptyList();
    private volatile double frameRate;

    /**
     * @param display 不需要预览时传null
     * @throws IllegalArgumentException 配置错误，例如标签文件不存在或分辨率未确定
     */
    public VideoPipeline(VideoPipelineConfig config, FrameSource source, FrameSink sink,
                         FrameDisplay display, InferenceEngineFactory engineFactory) {
        this.config = config;
        this.inferenceConfig = config.getInferenceConfig();
        this.source = source;
        this.sink = sink;
        this.display = display;
        this.engineFactory = engineFactory;

        if (inferenceConfig.getResolution() <= 0) {
            throw new IllegalArgumentException("启动流水线前必须确定模型分辨率: " + inferenceConfig.getResolution());
        }
        if (config.getRingBufferSize() <= 0) {
            throw new IllegalArgumentException("环形缓冲区大小必须大于0: " + config.getRingBufferSize());
        }

        this.labels = LabelLoader.load(config.getLabelPath());

        int slotCount = config.getRingBufferSize();
        this.pool = new SlotPool(slotCount, inferenceConfig.getResolution());
        this.freeSlots = new BoundedQueue<>(slotCount);
        this.decodeToPreprocess = new BoundedQueue<>(slotCount);
        this.preprocessToInfer = new BoundedQueue<>(slotCount);
        this.inferToDraw = new BoundedQueue<>(slotCount);

        for (int index : pool.indices()) {
            freeSlots.offer(SlotTicket.of(index));
        }
    }

    /**
     * 运行流水线直到视频结束（阻塞）
     *
     * @return 处理完成的帧数
     * @throws PipelineException 任一阶段失败
     */
    public long run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("流水线只能运行一次");
        }

        long startTime = System.currentTimeMillis();
        log.info("启动视频流水线: {} -> {}, 槽位: {}, 分辨率: {}, 模型类型: {}",
                config.getVideoPath(), config.getOutputPath(), pool.size(),
                pool.getResolution(), inferenceConfig.getModelType());

        source.start();
        frameRate = source.getFrameRate();

        try {
            // 先启动消费者，再启动生产者
            List<Thread> threads = new ArrayList<>(4);
            threads.add(newWorker("draw-write", this::drawWriteStage));
            threads.add(newWorker("infer", this::inferPostprocessStage));
            threads.add(newWorker("preprocess", this::preprocessStage));
            threads.add(newWorker("decode", this::decodeStage));
            workers = Collections.unmodifiableList(threads);
            for (Thread worker : threads) {
                worker.start();
            }

            joinWorkers();
        } finally {
            shutdown();
            try {
                source.close();
            } catch (Exception e) {
                log.warn("关闭视频源失败", e);
            }
        }

        Throwable error = failure.get();
        if (error != null) {
            throw new PipelineException("视频流水线执行失败: " + error.getMessage(), error);
        }

        log.info("视频流水线完成: {} 帧, 耗时 {} ms", framesProcessed.get(), System.currentTimeMillis() - startTime);
        return framesProcessed.get();
    }

    /**
     * 保底关闭：仍有线程存活时，向所有队列发送关闭信号并中断线程，然后等待其结束。
     * 正常结束时所有线程已经退出，这里不做任何事。
     */
    void shutdown() {
        boolean anyAlive = false;
        for (Thread worker : workers) {
            if (worker.isAlive()) {
                anyAlive = true;
                break;
            }
        }
        if (anyAlive) {
            abort(null);
            joinWorkers();
        }
    }

    private void joinWorkers() {
        boolean interrupted = false;
        for (Thread worker : workers) {
            while (worker.isAlive()) {
                try {
                    worker.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                    abort(new InterruptedException("等待流水线结束时被中断"));
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 提前终止：记录第一个错误，向所有队列发送关闭信号，中断其余工作线程
     */
    private void abort(Throwable cause) {
        if (cause != null) {
            failure.compareAndSet(null, cause);
        }
        if (!aborted.compareAndSet(false, true)) {
            return;
        }

        log.warn("流水线提前终止, 通知所有阶段退出");
        decodeToPreprocess.offer(SlotTicket.SHUTDOWN);
        preprocessToInfer.offer(SlotTicket.SHUTDOWN);
        inferToDraw.offer(SlotTicket.SHUTDOWN);
        freeSlots.offer(SlotTicket.SHUTDOWN);

        Thread current = Thread.currentThread();
        for (Thread worker : workers) {
            if (worker != current) {
                worker.interrupt();
            }
        }
    }

    private Thread newWorker(String name, Stage stage) {
        Thread thread = new Thread(() -> runStage(name, stage), "rfdetr-" + name);
        thread.setDaemon(true);
        return thread;
    }

    private void runStage(String name, Stage stage) {
        log.debug("阶段 {} 启动", name);
        try {
            stage.run();
        } catch (InterruptedException e) {
            // 只有 abort() 会中断工作线程
            log.debug("阶段 {} 被中断", name);
            Thread.currentThread().interrupt();
        } catch (Throwable t) {
            if (aborted.get() && failure.get() == null) {
                // 用户主动停止后被中断的阶段，不算失败
                log.debug("阶段 {} 在停止过程中退出: {}", name, t.toString());
            } else {
                log.error("阶段 {} 执行失败: {}", name, t.getMessage(), t);
                abort(t);
            }
        }
        log.debug("阶段 {} 结束", name);
    }

    private void decodeStage() throws InterruptedException {
        long frameNumber = 0;
        while (true) {
            SlotTicket ticket = freeSlots.pop();
            if (ticket.isShutdown()) {
                decodeToPreprocess.push(SlotTicket.SHUTDOWN);
                return;
            }

            BufferedImage frame = source.grab();
            if (frame == null) {
                // 视频结束：归还未使用的槽位，向下游发送关闭信号
                freeSlots.push(ticket);
                decodeToPreprocess.push(SlotTicket.SHUTDOWN);
                log.debug("视频读取完毕, 共 {} 帧", frameNumber);
                return;
            }

            pool.get(ticket.getIndex()).load(frame, frameNumber++);
            decodeToPreprocess.push(ticket);
        }
    }

    private void preprocessStage() throws InterruptedException {
        ImagePreprocessor preprocessor = new ImagePreprocessor(
                pool.getResolution(), inferenceConfig.getMeans(), inferenceConfig.getStds());

        while (true) {
            SlotTicket ticket = decodeToPreprocess.pop();
            if (ticket.isShutdown()) {
                preprocessToInfer.push(SlotTicket.SHUTDOWN);
                return;
            }

            FrameSlot slot = pool.get(ticket.getIndex());
            preprocessor.preprocess(slot.getRawFrame(), slot.getTensor());
            preprocessToInfer.push(ticket);
        }
    }

    private void inferPostprocessStage() throws InterruptedException {
        // 推理后端只属于这个线程
        try (DetrInference inference = new DetrInference(
                engineFactory.create(), config.getModelPath(), inferenceConfig)) {
            if (inference.getResolution() != pool.getResolution()) {
                throw new IllegalStateException(String.format("模型分辨率 %d 与槽位分辨率 %d 不一致",
                        inference.getResolution(), pool.getResolution()));
            }
            float res = (float) inference.getResolution();

            while (true) {
                SlotTicket ticket = preprocessToInfer.pop();
                if (ticket.isShutdown()) {
                    inferToDraw.push(SlotTicket.SHUTDOWN);
                    return;
                }

                FrameSlot slot = pool.get(ticket.getIndex());
                slot.getDetections().clear();

                inference.runInference(slot.getTensor());

                float scaleW = slot.getOrigW() / res;
                float scaleH = slot.getOrigH() / res;
                inference.postprocess(scaleW, scaleH, slot.getOrigH(), slot.getOrigW(), slot.getDetections());

                log.debug("第 {} 帧检测到 {} 个目标", slot.getFrameNumber(), slot.getDetections().size());
                inferToDraw.push(ticket);
            }
        }
    }

    private void drawWriteStage() throws InterruptedException {
        FrameRenderer renderer = new FrameRenderer(labels);
        boolean sinkOpened = false;

        try {
            while (true) {
                SlotTicket ticket = inferToDraw.pop();
                if (ticket.isShutdown()) {
                    return;
                }

                FrameSlot slot = pool.get(ticket.getIndex());
                if (!sinkOpened) {
                    sink.open(slot.getOrigW(), slot.getOrigH(), frameRate);
                    sinkOpened = true;
                }

                renderer.render(slot.getRawFrame(), slot.getDetections());
                sink.write(slot.getRawFrame());

                if (display != null && !display.show(slot.getRawFrame())) {
                    log.info("用户停止预览, 在第 {} 帧提前结束", slot.getFrameNumber());
                    abort(null);
                    return;
                }

                framesProcessed.incrementAndGet();
                freeSlots.push(ticket);
            }
        } finally {
            try {
                sink.close();
            } catch (Exception e) {
                log.warn("关闭视频输出失败", e);
            }
            if (display != null) {
                display.close();
            }
        }
    }

    public long getFramesProcessed() {
        return framesProcessed.get();
    }

    SlotPool getPool() {
        return pool;
    }

    BoundedQueue<SlotTicket> getFreeSlots() {
        return freeSlots;
    }

    BoundedQueue<SlotTicket> getDecodeToPreprocess() {
        return decodeToPreprocess;
    }

    BoundedQueue<SlotTicket> getPreprocessToInfer() {
        return preprocessToInfer;
    }

    BoundedQueue<SlotTicket> getInferToDraw() {
        return inferToDraw;
    }

    @FunctionalInterface
    private interface Stage {
        void run() throws Exception;
    }
}
