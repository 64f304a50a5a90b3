package com.edge.marker.service;

import com.edge.marker.config.YamlConfig;
import com.edge.marker.core.detect.DetectionPipeline;
import com.edge.marker.core.detect.DetectionSettings;
import com.edge.marker.core.detect.InvalidFrameException;
import com.edge.marker.core.detect.MarkerDetector;
import com.edge.marker.core.export.CornerPinExporter;
import com.edge.marker.core.export.CornerPinTrack;
import com.edge.marker.core.export.ExportPointType;
import com.edge.marker.core.export.TrackInterpolator;
import com.edge.marker.core.geometry.GeometryAnalyzer;
import com.edge.marker.core.geometry.GeometryResult;
import com.edge.marker.core.geometry.GeometrySummary;
import com.edge.marker.core.model.FrameRecord;
import com.edge.marker.core.model.MarkerRole;
import com.edge.marker.core.source.Frame;
import com.edge.marker.core.source.FrameSource;
import com.edge.marker.core.source.FrameSourceFactory;
import com.edge.marker.core.store.DataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * 标记跟踪服务
 * <p>
 * 流程：帧来源 → 检测流水线 → 数据表 → 几何分析 / 轨迹导出
 * <p>
 * 多线程时每个工作线程持有独立的流水线和数据表分区，全部完成后合并到结果表，
 * 合并后的数据表只读，几何分析和导出只在其上进行。
 */
@Service
public class MarkerTrackingService {
    private static final Logger logger = LoggerFactory.getLogger(MarkerTrackingService.class);

    @Autowired
    private YamlConfig yamlConfig;

    @Autowired
    private DetectionSettings detectionSettings;

    @Autowired
    private Supplier<MarkerDetector> markerDetectorFactory;

    @Autowired
    private GeometryAnalyzer geometryAnalyzer;

    @Autowired
    private TrackInterpolator trackInterpolator;

    @Autowired
    private CornerPinExporter cornerPinExporter;

    private volatile DataStore currentStore;
    private volatile TrackingRunSummary lastRun;

    /**
     * 处理帧来源（目录或视频文件）
     *
     * @param source    来源路径
     * @param workers   工作线程数，null 时使用配置
     * @param maxFrames 最多处理帧数，null 或 0 表示全部
     */
    public TrackingRunSummary process(String source, Integer workers, Integer maxFrames) {
        int w = workers != null ? workers : yamlConfig.getProcessing().getWorkers();
        int max = maxFrames != null ? maxFrames : yamlConfig.getProcessing().getMaxFrames();

        FrameSource frameSource = FrameSourceFactory.create(source);
        try {
            if (!frameSource.open()) {
                throw new IllegalArgumentException("Cannot open frame source: " + source);
            }
            TrackingRunSummary summary = process(frameSource, w, max);
            summary.setSource(source);
            return summary;
        } finally {
            frameSource.close();
        }
    }

    /**
     * 处理已打开的帧来源，结果替换当前数据表
     */
    public TrackingRunSummary process(FrameSource source, int workers, int maxFrames) {
        long start = System.currentTimeMillis();
        int workerCount = Math.max(1, workers);
        int total = source.size();
        int limit = maxFrames > 0 ? (total >= 0 ? Math.min(total, maxFrames) : maxFrames) : total;
        logger.info("Processing {} frames with {} worker(s)...", limit >= 0 ? limit : "all", workerCount);

        List<Integer> failed = Collections.synchronizedList(new ArrayList<>());
        DataStore store = workerCount == 1
            ? processSequential(source, limit, failed)
            : processParallel(source, limit, workerCount, failed);
        store.seal();

        TrackingRunSummary summary = summarize(store, failed);
        summary.setWorkers(workerCount);
        summary.setDurationMs(System.currentTimeMillis() - start);

        currentStore = store;
        lastRun = summary;
        logger.info("Processing complete: {} frames, {} complete, {} partial, {} empty, {} failed, {} ms",
            summary.getProcessedFrames(), summary.getCompleteFrames(), summary.getPartialFrames(),
            summary.getEmptyFrames(), summary.getFailedFrames().size(), summary.getDurationMs());
        return summary;
    }

    private DataStore processSequential(FrameSource source, int limit, List<Integer> failed) {
        DataStore store = new DataStore(detectionSettings.getExpectedMarkers());
        DetectionPipeline pipeline = new DetectionPipeline(markerDetectorFactory.get(), detectionSettings);
        for (int position = 0; limit < 0 || position < limit; position++) {
            Frame frame = source.getFrame(position);
            if (frame == null) {
                break;
            }
            try {
                detectFrame(pipeline, frame, store, failed);
            } finally {
                frame.release();
            }
        }
        return store;
    }

    private DataStore processParallel(FrameSource source, int limit, int workerCount, List<Integer> failed) {
        List<Worker> workers = Collections.synchronizedList(new ArrayList<>());
        ThreadLocal<Worker> local = ThreadLocal.withInitial(() -> {
            Worker worker = new Worker(new DetectionPipeline(markerDetectorFactory.get(), detectionSettings),
                new DataStore(detectionSettings.getExpectedMarkers()));
            workers.add(worker);
            return worker;
        });

        // 限制已读取但未处理的帧数量
        Semaphore inFlight = new Semaphore(workerCount * 2);
        ExecutorService executor = Executors.newFixedThreadPool(workerCount);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int position = 0; limit < 0 || position < limit; position++) {
                inFlight.acquire();
                Frame frame = source.getFrame(position);
                if (frame == null) {
                    inFlight.release();
                    break;
                }
                futures.add(executor.submit(() -> {
                    try {
                        Worker worker = local.get();
                        detectFrame(worker.pipeline, frame, worker.partition, failed);
                    } finally {
                        frame.release();
                        inFlight.release();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Processing interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Frame processing failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }

        DataStore merged = new DataStore(detectionSettings.getExpectedMarkers());
        for (Worker worker : workers) {
            merged.merge(worker.partition);
        }
        return merged;
    }

    private void detectFrame(DetectionPipeline pipeline, Frame frame, DataStore store, List<Integer> failed) {
        try {
            pipeline.process(frame.getImage(), frame.getFrameNumber(), store);
        } catch (InvalidFrameException e) {
            logger.error("Skipping frame: {}", e.getMessage());
            failed.add(e.getFrameIndex());
        }
    }

    private TrackingRunSummary summarize(DataStore store, List<Integer> failed) {
        TrackingRunSummary summary = new TrackingRunSummary();
        int complete = 0, partial = 0, empty = 0;
        for (FrameRecord record : store.getRecords()) {
            if (record.isComplete(store.getExpectedMarkers())) {
                complete++;
            } else if (record.size() == 0) {
                empty++;
            } else {
                partial++;
            }
        }
        summary.setProcessedFrames(store.size());
        summary.setCompleteFrames(complete);
        summary.setPartialFrames(partial);
        summary.setEmptyFrames(empty);
        List<Integer> sorted = new ArrayList<>(failed);
        Collections.sort(sorted);
        summary.setFailedFrames(sorted);
        return summary;
    }

    /**
     * 当前数据表（最近一次运行结果）
     *
     * @throws IllegalStateException 尚未运行过检测
     */
    public DataStore getCurrentStore() {
        DataStore store = currentStore;
        if (store == null) {
            throw new IllegalStateException("No frames processed yet");
        }
        return store;
    }

    public TrackingRunSummary getLastRun() {
        return lastRun;
    }

    public GeometryResult analyzeFrame(int frameIndex) {
        return geometryAnalyzer.analyze(getCurrentStore(), frameIndex);
    }

    public List<GeometryResult> analyzeAll() {
        return geometryAnalyzer.analyzeAll(getCurrentStore());
    }

    public GeometrySummary summarizeGeometry() {
        return geometryAnalyzer.summarize(analyzeAll());
    }

    /**
     * 生成轨迹
     *
     * @param pointType 导出点类型，null 时使用配置
     * @param from      起始帧，null 时为第一帧
     * @param to        结束帧，null 时为最后一帧
     */
    public CornerPinTrack buildTrack(String pointType, Integer from, Integer to) {
        DataStore store = getCurrentStore();
        if (store.isEmpty()) {
            throw new IllegalStateException("No data to export");
        }
        ExportPointType type = ExportPointType.parse(pointType != null ? pointType : yamlConfig.getExport().getPointType());
        int fromFrame = from != null ? from : store.getFirstFrame();
        int toFrame = to != null ? to : store.getLastFrame();
        return trackInterpolator.build(store, type, pinOrder(), fromFrame, toFrame);
    }

    /**
     * 导出 CornerPin2D 文件
     *
     * @param outputPath 输出路径，null 时写入配置的导出目录
     * @return 实际写入的轨迹
     */
    public ExportResult export(String pointType, String outputPath, Integer from, Integer to) throws IOException {
        CornerPinTrack track = buildTrack(pointType, from, to);
        Path path = outputPath != null && !outputPath.isBlank()
            ? Paths.get(outputPath)
            : Paths.get(yamlConfig.getExport().getOutputDir(),
                "cornerpin_" + track.getPointType().name().toLowerCase() + ".nk");
        cornerPinExporter.export(track, path);
        return new ExportResult(path, track);
    }

    List<MarkerRole> pinOrder() {
        List<MarkerRole> order = new ArrayList<>();
        for (int id : yamlConfig.getExport().getPinOrder()) {
            order.add(MarkerRole.fromMarkerId(id));
        }
        return order;
    }

    /**
     * 导出结果：文件路径 + 轨迹
     */
    public static class ExportResult {
        private final Path path;
        private final CornerPinTrack track;

        public ExportResult(Path path, CornerPinTrack track) {
            this.path = path;
            this.track = track;
        }

        public Path getPath() {
            return path;
        }

        public CornerPinTrack getTrack() {
            return track;
        }
    }

    private static final class Worker {
        final DetectionPipeline pipeline;
        final DataStore partition;

        Worker(DetectionPipeline pipeline, DataStore partition) {
            this.pipeline = pipeline;
            this.partition = partition;
        }
    }
}
