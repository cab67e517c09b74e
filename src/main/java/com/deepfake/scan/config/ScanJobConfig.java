package com.deepfake.scan.config;

import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * 深度伪造扫描任务配置类
 */
@Data
public class ScanJobConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ScanJobConfig.class);

    public static final String CONFIG_FILE = "application.properties";

    // Kafka配置
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaTopic = "deepfake-scan-requests";
    private String kafkaGroupId = "deepfake-scan-group";

    // Doris配置
    private String dorisFenodes = "localhost:8030";
    private String dorisDatabase = "deepfake_analytics";
    private String dorisTable = "scan_reports";
    private String dorisFailureTable = "scan_failures";
    private String dorisUsername = "root";
    private String dorisPassword = "";

    // 人脸检测配置
    private boolean faceDetectionEnabled = true;
    private String faceModelsDir = "face_detection_models";
    private String faceDnnModelUrl =
            "https://raw.githubusercontent.com/opencv/opencv_3rdparty/dnn_samples_face_detector_20170830/res10_300x300_ssd_iter_140000.caffemodel";
    private String faceDnnConfigUrl =
            "https://raw.githubusercontent.com/opencv/opencv/master/samples/dnn/face_detector/deploy.prototxt";
    private String faceHaarCascadePath = "";
    private String faceHaarCascadeUrl =
            "https://raw.githubusercontent.com/opencv/opencv/4.x/data/haarcascades/haarcascade_frontalface_default.xml";
    private int faceDownloadTimeoutMs = 30000;
    private float faceDnnConfidenceThreshold = 0.3f;
    private float faceHaarConfidenceThreshold = 0.5f;
    private int facePaddingPercent = 30;

    // 分类模型配置
    private String classifierModelPath = "models/efficientnet_b0_ffpp_c23.onnx";
    private String classifierModelName = "efficientnet_b0_ffpp_c23";
    private List<String> classifierLabels = new ArrayList<>(Arrays.asList("Real", "Fake"));
    private int classifierInputSize = 224;
    private boolean classifierApplySoftmax = true;

    // 推理服务配置
    private int maxFrames = 30;
    private String defaultModelVersion = "v2";
    private String serviceName = "deepfake-detection-ml-service";
    private String serviceVersion = "2.0.0";

    // 任务配置
    private int parallelism = 2;
    private long checkpointInterval = 60000;

    /**
     * 从classpath下的配置文件加载配置
     */
    public static ScanJobConfig loadConfig() {
        Properties props = new Properties();

        try (InputStream input = ScanJobConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input == null) {
                LOG.warn("Configuration file '{}' not found in classpath, using defaults", CONFIG_FILE);
                return new ScanJobConfig();
            }
            props.load(input);
        } catch (Exception e) {
            LOG.error("Error loading configuration", e);
            throw new IllegalStateException("Failed to load configuration", e);
        }

        return fromProperties(props);
    }

    public static ScanJobConfig fromProperties(Properties props) {
        ScanJobConfig config = new ScanJobConfig();
        try {
            // 加载Kafka配置
            config.setKafkaBootstrapServers(props.getProperty("kafka.bootstrap.servers", config.getKafkaBootstrapServers()));
            config.setKafkaTopic(props.getProperty("kafka.topic", config.getKafkaTopic()));
            config.setKafkaGroupId(props.getProperty("kafka.group.id", config.getKafkaGroupId()));

            // 加载Doris配置
            config.setDorisFenodes(props.getProperty("doris.fenodes", config.getDorisFenodes()));
            config.setDorisDatabase(props.getProperty("doris.database", config.getDorisDatabase()));
            config.setDorisTable(props.getProperty("doris.table", config.getDorisTable()));
            config.setDorisFailureTable(props.getProperty("doris.failure.table", config.getDorisFailureTable()));
            config.setDorisUsername(props.getProperty("doris.username", config.getDorisUsername()));
            config.setDorisPassword(props.getProperty("doris.password", config.getDorisPassword()));

            // 加载人脸检测配置
            config.setFaceDetectionEnabled(Boolean.parseBoolean(
                    props.getProperty("face.detection.enabled", String.valueOf(config.isFaceDetectionEnabled()))));
            config.setFaceModelsDir(props.getProperty("face.models.dir", config.getFaceModelsDir()));
            config.setFaceDnnModelUrl(props.getProperty("face.dnn.model.url", config.getFaceDnnModelUrl()));
            config.setFaceDnnConfigUrl(props.getProperty("face.dnn.config.url", config.getFaceDnnConfigUrl()));
            config.setFaceHaarCascadePath(props.getProperty("face.haar.cascade.path", config.getFaceHaarCascadePath()));
            config.setFaceHaarCascadeUrl(props.getProperty("face.haar.cascade.url", config.getFaceHaarCascadeUrl()));
            config.setFaceDownloadTimeoutMs(Integer.parseInt(props.getProperty(
                    "face.download.timeout.ms", String.valueOf(config.getFaceDownloadTimeoutMs()))));
            config.setFaceDnnConfidenceThreshold(Float.parseFloat(props.getProperty(
                    "face.dnn.confidence.threshold", String.valueOf(config.getFaceDnnConfidenceThreshold()))));
            config.setFaceHaarConfidenceThreshold(Float.parseFloat(props.getProperty(
                    "face.haar.confidence.threshold", String.valueOf(config.getFaceHaarConfidenceThreshold()))));
            config.setFacePaddingPercent(Integer.parseInt(props.getProperty(
                    "face.padding.percent", String.valueOf(config.getFacePaddingPercent()))));

            // 加载分类模型配置
            config.setClassifierModelPath(props.getProperty("classifier.model.path", config.getClassifierModelPath()));
            config.setClassifierModelName(props.getProperty("classifier.model.name", config.getClassifierModelName()));
            String labels = props.getProperty("classifier.labels");
            if (labels != null && !labels.trim().isEmpty()) {
                config.setClassifierLabels(splitList(labels));
            }
            config.setClassifierInputSize(Integer.parseInt(props.getProperty(
                    "classifier.input.size", String.valueOf(config.getClassifierInputSize()))));
            config.setClassifierApplySoftmax(Boolean.parseBoolean(props.getProperty(
                    "classifier.apply.softmax", String.valueOf(config.isClassifierApplySoftmax()))));

            // 加载推理服务配置
            config.setMaxFrames(Integer.parseInt(props.getProperty("scan.max.frames", String.valueOf(config.getMaxFrames()))));
            config.setDefaultModelVersion(props.getProperty("scan.default.model.version", config.getDefaultModelVersion()));
            config.setServiceName(props.getProperty("service.name", config.getServiceName()));
            config.setServiceVersion(props.getProperty("service.version", config.getServiceVersion()));

            // 加载任务配置
            config.setParallelism(Integer.parseInt(props.getProperty("job.parallelism", String.valueOf(config.getParallelism()))));
            config.setCheckpointInterval(Long.parseLong(props.getProperty(
                    "job.checkpoint.interval", String.valueOf(config.getCheckpointInterval()))));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid numeric value in configuration: " + e.getMessage(), e);
        }

        if (config.getMaxFrames() <= 0) {
            throw new IllegalStateException("scan.max.frames must be positive: " + config.getMaxFrames());
        }

        if (config.getFaceDownloadTimeoutMs() <= 0) {
            throw new IllegalStateException("face.download.timeout.ms must be positive: " + config.getFaceDownloadTimeoutMs());
        }

        LOG.info("Configuration loaded successfully");
        LOG.info("Kafka: {} -> topic: {}", config.getKafkaBootstrapServers(), config.getKafkaTopic());
        LOG.info("Doris: {} -> {}.{} (failures: {})", config.getDorisFenodes(), config.getDorisDatabase(),
                config.getDorisTable(), config.getDorisFailureTable());
        LOG.info("Classifier: {} ({}), labels: {}, input: {}px", config.getClassifierModelName(),
                config.getClassifierModelPath(), config.getClassifierLabels(), config.getClassifierInputSize());
        LOG.info("Face detection: enabled={}, padding={}%, max frames: {}",
                config.isFaceDetectionEnabled(), config.getFacePaddingPercent(), config.getMaxFrames());

        return config;
    }

    private static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.trim().isEmpty()) {
                result.add(item.trim());
            }
        }
        return result;
    }
}
