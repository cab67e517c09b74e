package com.deepfake.scan.detector;

import com.deepfake.scan.config.ScanJobConfig;
import com.deepfake.scan.util.ModelDownloader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Supplier;

/**
 * 人脸检测器句柄：首次使用时下载权重、选择后端并加载，之后只读共享
 *
 * 后端选择只做一次：DNN权重可用 -> DNN；否则Haar级联可用 -> Haar；否则不检测
 * 未指定级联路径时，级联文件与DNN权重一样下载到模型目录
 */
public class FaceDetectorProvider implements Supplier<FaceDetector>, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FaceDetectorProvider.class);

    static final String DNN_MODEL_FILE = "res10_300x300_ssd_iter_140000.caffemodel";
    static final String DNN_CONFIG_FILE = "deploy.prototxt";
    static final String HAAR_CASCADE_FILE = "haarcascade_frontalface_default.xml";

    private final ScanJobConfig config;

    private volatile FaceDetector detector;

    private final Object lock = new Object();

    public FaceDetectorProvider(ScanJobConfig config) {
        this.config = config;
    }

    @Override
    public FaceDetector get() {
        FaceDetector current = detector;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (detector == null) {
                detector = initialize();
                LOG.info("Face detector initialized: {}", detector.getBackend().getDescription());
            }
            return detector;
        }
    }

    /**
     * 当前后端描述，未初始化时不触发下载
     */
    public String describe() {
        FaceDetector current = detector;
        return current == null ? "not_initialized" : current.getBackend().getDescription();
    }

    private FaceDetector initialize() {
        if (!config.isFaceDetectionEnabled()) {
            LOG.warn("Face detection disabled by configuration, full frames will be classified");
            return new NoOpFaceDetector();
        }

        Path modelsDir = Paths.get(config.getFaceModelsDir());
        Path modelPath = modelsDir.resolve(DNN_MODEL_FILE);
        Path configPath = modelsDir.resolve(DNN_CONFIG_FILE);

        int timeout = config.getFaceDownloadTimeoutMs();
        boolean modelReady = ModelDownloader.downloadIfMissing(config.getFaceDnnModelUrl(), modelPath, timeout);
        boolean configReady = ModelDownloader.downloadIfMissing(config.getFaceDnnConfigUrl(), configPath, timeout);

        if (modelReady && configReady) {
            try {
                return createDnnDetector(configPath.toString(), modelPath.toString(),
                        config.getFaceDnnConfidenceThreshold());
            } catch (RuntimeException e) {
                LOG.error("Failed to load DNN face detector, trying Haar cascade fallback", e);
            }
        } else {
            LOG.warn("DNN face detector weights not available, trying Haar cascade fallback");
        }

        Path cascadePath = resolveHaarCascade(modelsDir, timeout);
        if (cascadePath != null) {
            try {
                return createHaarDetector(cascadePath.toString(), config.getFaceHaarConfidenceThreshold());
            } catch (RuntimeException e) {
                LOG.error("Failed to load Haar cascade from {}", cascadePath, e);
            }
        }

        LOG.error("No face detector available, full frames will be classified (may cause incorrect predictions)");
        return new NoOpFaceDetector();
    }

    /**
     * 显式配置的级联路径优先，否则下载默认级联到模型目录；都不可用返回null
     */
    private Path resolveHaarCascade(Path modelsDir, int timeout) {
        String configured = config.getFaceHaarCascadePath();
        if (configured != null && !configured.trim().isEmpty()) {
            Path path = Paths.get(configured.trim());
            if (Files.isRegularFile(path)) {
                return path;
            }
            LOG.warn("Configured Haar cascade not found: {}", path);
            return null;
        }
        Path downloaded = modelsDir.resolve(HAAR_CASCADE_FILE);
        return ModelDownloader.downloadIfMissing(config.getFaceHaarCascadeUrl(), downloaded, timeout) ? downloaded : null;
    }

    protected FaceDetector createDnnDetector(String configPath, String modelPath, float threshold) {
        return new DnnFaceDetector(configPath, modelPath, threshold);
    }

    protected FaceDetector createHaarDetector(String cascadePath, float threshold) {
        return new HaarFaceDetector(cascadePath, threshold);
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (detector != null) {
                detector.close();
                detector = null;
            }
        }
    }
}
