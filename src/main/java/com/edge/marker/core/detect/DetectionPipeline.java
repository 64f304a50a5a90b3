package com.edge.marker.core.detect;

import com.edge.marker.core.model.FrameRecord;
import com.edge.marker.core.model.MarkerObservation;
import com.edge.marker.core.store.DataStore;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 多阶段自适应检测流水线
 * <p>
 * 状态机：NOT_STARTED → DEFAULT_PASS → QUICK_SCAN_PASS → DETAILED_SEARCH_PASS → DONE
 * <ul>
 *   <li>DEFAULT_PASS：基准参数，原图</li>
 *   <li>QUICK_SCAN_PASS：宽松阈值、更小的最小周长，原图</li>
 *   <li>DETAILED_SEARCH_PASS：对比度等级 × 候选参数，在增强图像上逐一尝试</li>
 * </ul>
 * 任一阶段找齐所有期望标记后立即结束。各阶段找到的标记累积保留，
 * 已找到的 ID 不会被后续阶段覆盖。找不齐时保留部分结果。
 * <p>
 * 每个实例持有自己的检测器和增强器，不应跨线程共享。
 */
public class DetectionPipeline {
    private static final Logger logger = LoggerFactory.getLogger(DetectionPipeline.class);

    private final DetectionSettings settings;
    private final DetectionStage stage;
    private final ContrastEnhancer enhancer;

    public DetectionPipeline(MarkerDetector detector, DetectionSettings settings) {
        this(detector, settings, new ContrastEnhancer(settings.getClaheTileSize()));
    }

    public DetectionPipeline(MarkerDetector detector, DetectionSettings settings, ContrastEnhancer enhancer) {
        this.settings = settings;
        this.stage = new DetectionStage(detector, settings.getExpectedMarkers());
        this.enhancer = enhancer;
    }

    public DetectionSettings getSettings() {
        return settings;
    }

    /**
     * 检测一帧并写入数据表（无论是否找齐都写入）
     *
     * @return 是否找齐所有期望标记
     * @throws InvalidFrameException 图像为空或无效，此时不写入任何记录
     */
    public boolean process(Mat image, int frameIndex, DataStore store) {
        DetectionOutcome outcome = detect(image, frameIndex);
        store.put(outcome.getRecord());
        return outcome.isComplete();
    }

    /**
     * 检测一帧
     *
     * @param image      输入图像
     * @param frameIndex 帧号
     * @return 检测结果
     * @throws InvalidFrameException 图像为空或无效
     */
    public DetectionOutcome detect(Mat image, int frameIndex) {
        if (image == null || image.empty()) {
            throw new InvalidFrameException(frameIndex, "image is null or empty");
        }
        if (image.width() <= 0 || image.height() <= 0) {
            throw new InvalidFrameException(frameIndex, "invalid size " + image.width() + "x" + image.height());
        }

        FrameContext ctx = new FrameContext(new FrameRecord(frameIndex, image.width(), image.height()));
        PipelineState state = PipelineState.NOT_STARTED;
        while (state != PipelineState.DONE) {
            state = step(state, image, ctx);
        }

        boolean complete = ctx.isComplete();
        if (complete) {
            logger.info("Frame {}: all {} markers found after {} attempts ({})",
                frameIndex, settings.getExpectedMarkers(), ctx.attempts, ctx.visited);
        } else {
            logger.warn("Frame {}: found {}/{} markers {} after {} attempts",
                frameIndex, ctx.record.size(), settings.getExpectedMarkers(),
                ctx.record.getObservations().keySet(), ctx.attempts);
        }
        return new DetectionOutcome(ctx.record, complete, ctx.visited, ctx.attempts);
    }

    /**
     * 执行当前状态并返回下一状态
     */
    private PipelineState step(PipelineState state, Mat image, FrameContext ctx) {
        switch (state) {
            case NOT_STARTED:
                return PipelineState.DEFAULT_PASS;
            case DEFAULT_PASS:
                ctx.visited.add(state);
                attempt(image, settings.getBaseline(), state, 0, ctx);
                break;
            case QUICK_SCAN_PASS:
                ctx.visited.add(state);
                attempt(image, settings.getQuickScan(), state, 0, ctx);
                break;
            case DETAILED_SEARCH_PASS:
                ctx.visited.add(state);
                detailedSearch(image, ctx);
                break;
            default:
                return PipelineState.DONE;
        }
        PipelineState next = ctx.isComplete() ? PipelineState.DONE : state.next();
        logger.debug("Frame {}: {} -> {} ({} markers)", ctx.record.getFrameIndex(), state, next, ctx.record.size());
        return next;
    }

    private void detailedSearch(Mat image, FrameContext ctx) {
        int budget = settings.getMaxDetailedAttempts();
        int used = 0;
        for (int level : settings.getContrastLevels()) {
            Mat variant = enhancer.enhance(image, level);
            try {
                for (DetectionParams params : settings.getDetailedCandidates()) {
                    if (used >= budget) {
                        logger.debug("Frame {}: detailed search budget {} exhausted",
                            ctx.record.getFrameIndex(), budget);
                        return;
                    }
                    used++;
                    attempt(variant, params, PipelineState.DETAILED_SEARCH_PASS, level, ctx);
                    if (ctx.isComplete()) {
                        return;
                    }
                }
            } finally {
                variant.release();
            }
        }
    }

    /**
     * 执行一次检测，把新出现的 ID 写入帧记录
     */
    private void attempt(Mat variant, DetectionParams params, PipelineState state, int contrastLevel,
                         FrameContext ctx) {
        ctx.attempts++;
        Map<Integer, MarkerCandidate> found = stage.run(variant, params);
        for (MarkerCandidate candidate : found.values()) {
            if (ctx.record.has(candidate.getMarkerId())) {
                continue;
            }
            ctx.record.put(new MarkerObservation(candidate.getMarkerId(), candidate.getCorners(),
                state, params, contrastLevel));
            logger.debug("Frame {}: ID{} found in {} contrast={} ({})",
                ctx.record.getFrameIndex(), candidate.getMarkerId(), state, contrastLevel, params);
        }
    }

    private class FrameContext {
        final FrameRecord record;
        final List<PipelineState> visited = new ArrayList<>();
        int attempts;

        FrameContext(FrameRecord record) {
            this.record = record;
        }

        boolean isComplete() {
            return record.isComplete(settings.getExpectedMarkers());
        }
    }
}
