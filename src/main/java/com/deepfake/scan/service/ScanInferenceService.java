package com.deepfake.scan.service;

import com.deepfake.scan.classifier.ImageClassifier;
import com.deepfake.scan.classifier.OnnxImageClassifier;
import com.deepfake.scan.config.ScanJobConfig;
import com.deepfake.scan.detector.FaceDetectorProvider;
import com.deepfake.scan.exception.ClassifierUnavailableException;
import com.deepfake.scan.exception.InvalidInputException;
import com.deepfake.scan.exception.UnsupportedMediaTypeException;
import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.image.FrameLoader;
import com.deepfake.scan.image.OpenCvFrameLoader;
import com.deepfake.scan.model.AggregatedReport;
import com.deepfake.scan.model.FaceLocalization;
import com.deepfake.scan.model.HealthStatus;
import com.deepfake.scan.model.LabelScore;
import com.deepfake.scan.model.MediaType;
import com.deepfake.scan.model.ScanRequest;
import com.deepfake.scan.model.ScanResponse;
import com.deepfake.scan.model.ScanResult;
import com.deepfake.scan.processor.FaceCropGeometry;
import com.deepfake.scan.processor.FaceLocalizer;
import com.deepfake.scan.processor.FakeProbabilityExtractor;
import com.deepfake.scan.processor.FrameSampler;
import com.deepfake.scan.processor.ScoreAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 深度伪造推理服务
 * 流程：
 * 1. 校验请求与媒体类型
 * 2. 抽样帧（视频最多 maxFrames 帧，图片只取第一帧）
 * 3. 逐帧人脸定位并裁剪，未检测到人脸时使用整图
 * 4. 整批送入分类器
 * 5. 提取伪造概率并聚合为风险报告
 */
public class ScanInferenceService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScanInferenceService.class);

    private final ScanJobConfig config;
    private final FrameLoader frameLoader;
    private final FaceLocalizer faceLocalizer;
    private final ImageClassifier classifier;
    private final FakeProbabilityExtractor probabilityExtractor;
    private final ScoreAggregator aggregator;
    private final FaceDetectorProvider detectorProvider;

    public ScanInferenceService(ScanJobConfig config,
                                FrameLoader frameLoader,
                                FaceLocalizer faceLocalizer,
                                ImageClassifier classifier,
                                FakeProbabilityExtractor probabilityExtractor,
                                ScoreAggregator aggregator,
                                FaceDetectorProvider detectorProvider) {
        this.config = config;
        this.frameLoader = frameLoader;
        this.faceLocalizer = faceLocalizer;
        this.classifier = classifier;
        this.probabilityExtractor = probabilityExtractor;
        this.aggregator = aggregator;
        this.detectorProvider = detectorProvider;
    }

    /**
     * 按配置组装真实的OpenCV/ONNX实现并加载分类模型
     *
     * 模型加载失败不抛出：服务照常创建，请求返回503，健康检查报告 unhealthy
     */
    public static ScanInferenceService create(ScanJobConfig config) {
        FaceDetectorProvider detectorProvider = new FaceDetectorProvider(config);
        FaceLocalizer localizer = new FaceLocalizer(detectorProvider,
                new FaceCropGeometry(config.getFacePaddingPercent()));

        OnnxImageClassifier classifier = new OnnxImageClassifier(
                config.getClassifierModelPath(),
                config.getClassifierModelName(),
                config.getClassifierLabels(),
                config.getClassifierInputSize(),
                config.isClassifierApplySoftmax());
        if (!classifier.load()) {
            LOG.error("Classifier {} is not available, scan requests will be rejected until it is",
                    config.getClassifierModelName());
        }

        return new ScanInferenceService(config, new OpenCvFrameLoader(), localizer, classifier,
                new FakeProbabilityExtractor(), new ScoreAggregator(), detectorProvider);
    }

    public ScanResult infer(ScanRequest request) {
        long startTime = System.currentTimeMillis();

        if (request == null) {
            throw new InvalidInputException("Request body is required");
        }
        // 模型未加载时不再校验请求内容，统一返回503
        if (!classifier.isReady()) {
            throw new ClassifierUnavailableException("Model " + classifier.getModelName() + " is not loaded");
        }
        MediaType mediaType = MediaType.fromWire(request.getMediaType());
        if (mediaType == MediaType.AUDIO) {
            throw new UnsupportedMediaTypeException(mediaType,
                    "Audio-only deepfake detection is not supported by the current model");
        }

        List<String> framePaths = request.getExtractedFrames();
        if (framePaths == null || framePaths.isEmpty()) {
            throw new InvalidInputException("No frames provided for " + mediaType + " analysis");
        }

        List<String> selected = mediaType == MediaType.IMAGE
                ? Collections.singletonList(framePaths.get(0))
                : FrameSampler.sample(framePaths, config.getMaxFrames());
        LOG.info("Scanning {} {}: {} of {} frames selected", mediaType, request.getHash(),
                selected.size(), framePaths.size());

        List<FrameImage> loaded = new ArrayList<>(selected.size());
        List<FrameImage> prepared = new ArrayList<>(selected.size());
        try {
            int facesDetected = 0;
            for (String path : selected) {
                FrameImage frame;
                try {
                    frame = frameLoader.load(path);
                } catch (InvalidInputException e) {
                    LOG.warn("Skipping frame {}: {}", path, e.getMessage());
                    continue;
                }
                loaded.add(frame);

                FaceLocalization localization = faceLocalizer.localize(frame);
                if (localization.isFullImage()) {
                    prepared.add(frame);
                } else {
                    prepared.add(frame.crop(localization.getCropRegion()));
                    facesDetected++;
                }
            }

            if (prepared.isEmpty()) {
                throw new InvalidInputException("No valid frames processed");
            }

            List<List<LabelScore>> results = classifier.classify(prepared);
            if (results.size() != prepared.size()) {
                throw new IllegalStateException("Classifier returned " + results.size()
                        + " results for " + prepared.size() + " frames");
            }

            List<Double> probabilities = new ArrayList<>(results.size());
            for (List<LabelScore> result : results) {
                probabilities.add(probabilityExtractor.extract(result));
            }

            AggregatedReport report = aggregator.aggregate(probabilities, mediaType);
            long inferenceTime = System.currentTimeMillis() - startTime;

            ScanResponse response = ScanResponse.of(report, resolveModelVersion(request), inferenceTime);
            LOG.info("Scan {} finished: risk={}, confidence={}, frames={}, faces={}, {} ms",
                    request.getHash(), report.getRiskScore(), report.getConfidence(),
                    prepared.size(), facesDetected, inferenceTime);

            return ScanResult.builder()
                    .hash(request.getHash())
                    .mediaType(mediaType)
                    .framesAnalyzed(prepared.size())
                    .facesDetected(facesDetected)
                    .response(response)
                    .processedAt(System.currentTimeMillis())
                    .build();
        } finally {
            // 裁剪图与原图分别持有本地内存
            for (FrameImage image : prepared) {
                if (!loaded.contains(image)) {
                    image.release();
                }
            }
            for (FrameImage image : loaded) {
                image.release();
            }
        }
    }

    public HealthStatus health() {
        boolean ready = classifier.isReady();
        return HealthStatus.builder()
                .status(ready ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY)
                .service(config.getServiceName())
                .version(config.getServiceVersion())
                .model(classifier.getModelName())
                .modelStatus(ready ? "loaded" : "not_loaded")
                .detector(detectorProvider.describe())
                .timestamp(Instant.now().toString())
                .build();
    }

    public FaceLocalizer getFaceLocalizer() {
        return faceLocalizer;
    }

    private String resolveModelVersion(ScanRequest request) {
        String version = request.getModelVersion();
        return version == null || version.trim().isEmpty() ? config.getDefaultModelVersion() : version;
    }

    @Override
    public void close() {
        try {
            classifier.close();
        } catch (Exception e) {
            LOG.error("Error closing classifier", e);
        }
        detectorProvider.close();
        LOG.info("ScanInferenceService closed");
    }
}
