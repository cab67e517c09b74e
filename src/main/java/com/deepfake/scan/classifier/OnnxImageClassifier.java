package com.deepfake.scan.classifier;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.deepfake.scan.exception.ClassifierUnavailableException;
import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.model.LabelScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 深度伪造图像分类器（使用ONNX Runtime）
 * 输入: [N, 3, S, S]，RGB，[0,1]；输出: [N, C] logits
 */
public class OnnxImageClassifier implements ImageClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(OnnxImageClassifier.class);

    private final String modelPath;
    private final String modelName;
    private final List<String> labels;
    private final int inputSize;
    private final boolean applySoftmax;

    private OrtEnvironment env;
    private volatile OrtSession session;
    private String inputName;

    private final Object lock = new Object();

    public OnnxImageClassifier(String modelPath, String modelName, List<String> labels,
                               int inputSize, boolean applySoftmax) {
        this.modelPath = modelPath;
        this.modelName = modelName;
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
        this.inputSize = inputSize;
        this.applySoftmax = applySoftmax;
    }

    /**
     * 加载模型（只加载一次）
     *
     * @return 模型是否已就绪
     */
    public boolean load() {
        if (session != null) {
            LOG.info("Model already loaded, returning cached instance");
            return true;
        }
        synchronized (lock) {
            if (session != null) {
                return true;
            }
            if (!Files.isRegularFile(Paths.get(modelPath))) {
                LOG.error("Classifier model not found: {}", modelPath);
                return false;
            }
            try {
                env = OrtEnvironment.getEnvironment();
                OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
                opts.setIntraOpNumThreads(2);
                opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.BASIC_OPT);

                OrtSession created = env.createSession(modelPath, opts);
                inputName = created.getInputNames().iterator().next();
                session = created;
                LOG.info("Classifier model loaded successfully from: {}", modelPath);
                LOG.info("Model inputs: {}, outputs: {}", created.getInputNames(), created.getOutputNames());
                return true;
            } catch (OrtException e) {
                LOG.error("Failed to load classifier model from {}", modelPath, e);
                return false;
            }
        }
    }

    @Override
    public boolean isReady() {
        return session != null;
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public List<List<LabelScore>> classify(List<FrameImage> images) {
        if (images == null || images.isEmpty()) {
            return Collections.emptyList();
        }

        synchronized (lock) {
            if (session == null) {
                throw new ClassifierUnavailableException("Model is not loaded");
            }

            int planeSize = 3 * inputSize * inputSize;
            float[] batch = new float[images.size() * planeSize];
            for (int i = 0; i < images.size(); i++) {
                System.arraycopy(images.get(i).toTensor(inputSize), 0, batch, i * planeSize, planeSize);
            }

            long[] shape = {images.size(), 3, inputSize, inputSize};
            long startTime = System.currentTimeMillis();
            try (OnnxTensor inputTensor = OnnxTensor.createTensor(env, FloatBuffer.wrap(batch), shape);
                 OrtSession.Result results = session.run(Collections.singletonMap(inputName, inputTensor))) {

                Object output = results.get(0).getValue();
                if (!(output instanceof float[][])) {
                    throw new IllegalStateException("Unexpected classifier output type: "
                            + output.getClass().getSimpleName());
                }
                float[][] logits = (float[][]) output;
                if (logits.length != images.size()) {
                    throw new IllegalStateException("Classifier returned " + logits.length
                            + " rows for a batch of " + images.size());
                }

                List<List<LabelScore>> ranked = new ArrayList<>(logits.length);
                for (float[] row : logits) {
                    ranked.add(toLabelScores(row, labels, applySoftmax));
                }
                LOG.debug("Classified {} images in {} ms", images.size(), System.currentTimeMillis() - startTime);
                return ranked;
            } catch (OrtException e) {
                throw new IllegalStateException("Classifier inference failed", e);
            }
        }
    }

    /**
     * 一行模型输出转为按得分降序的标签列表；缺少标签名时使用 LABEL_i
     */
    static List<LabelScore> toLabelScores(float[] row, List<String> labels, boolean applySoftmax) {
        double[] scores = new double[row.length];
        if (applySoftmax) {
            double max = Double.NEGATIVE_INFINITY;
            for (float v : row) {
                max = Math.max(max, v);
            }
            double sum = 0;
            for (int i = 0; i < row.length; i++) {
                scores[i] = Math.exp(row[i] - max);
                sum += scores[i];
            }
            for (int i = 0; i < row.length; i++) {
                scores[i] /= sum;
            }
        } else {
            for (int i = 0; i < row.length; i++) {
                scores[i] = row[i];
            }
        }

        List<LabelScore> result = new ArrayList<>(row.length);
        for (int i = 0; i < row.length; i++) {
            String label = i < labels.size() ? labels.get(i) : "LABEL_" + i;
            result.add(new LabelScore(label, scores[i]));
        }
        result.sort(Comparator.comparingDouble(LabelScore::getScore).reversed());
        return result;
    }

    @Override
    public void close() {
        synchronized (lock) {
            try {
                if (session != null) {
                    session.close();
                    session = null;
                }
                LOG.info("Classifier closed");
            } catch (OrtException e) {
                LOG.error("Error closing classifier session", e);
            }
        }
    }
}
