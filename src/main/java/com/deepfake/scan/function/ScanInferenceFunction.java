package com.deepfake.scan.function;

import com.deepfake.scan.config.ScanJobConfig;
import com.deepfake.scan.exception.ScanException;
import com.deepfake.scan.model.ScanFailure;
import com.deepfake.scan.model.ScanRequest;
import com.deepfake.scan.model.ScanResult;
import com.deepfake.scan.serialization.ScanJsonCodec;
import com.deepfake.scan.service.ScanInferenceService;
import com.deepfake.scan.service.ScanServiceFactory;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 扫描推理函数
 * 功能：
 * 1. 解析Kafka中的扫描请求
 * 2. 调用推理服务生成风险报告
 * 3. 失败请求以ScanFailure发往侧输出，不中断任务
 */
public class ScanInferenceFunction extends ProcessFunction<String, ScanResult> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ScanInferenceFunction.class);

    // 侧输出标签 - 失败请求
    public static final OutputTag<ScanFailure> FAILURE_TAG = new OutputTag<ScanFailure>("scan-failures"){};

    private final ScanJobConfig config;
    private final ScanServiceFactory serviceFactory;

    private transient ScanInferenceService service;

    // 统计信息
    private transient AtomicLong totalRequests;
    private transient AtomicLong failedRequests;

    public ScanInferenceFunction(ScanJobConfig config) {
        this(config, ScanInferenceService::create);
    }

    public ScanInferenceFunction(ScanJobConfig config, ScanServiceFactory serviceFactory) {
        this.config = config;
        this.serviceFactory = serviceFactory;
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);

        service = serviceFactory.create(config);

        totalRequests = new AtomicLong(0);
        failedRequests = new AtomicLong(0);

        LOG.info("ScanInferenceFunction opened, health: {}", service.health().getStatus());
    }

    @Override
    public void processElement(String message, Context ctx, Collector<ScanResult> out) throws Exception {
        long total = totalRequests.incrementAndGet();
        String hash = null;

        try {
            ScanRequest request = ScanJsonCodec.parseRequest(message);
            hash = request.getHash();
            out.collect(service.infer(request));
        } catch (ScanException e) {
            failedRequests.incrementAndGet();
            if (e.getStatus() >= 500) {
                LOG.error("Scan {} failed with status {}", hash, e.getStatus(), e);
            } else {
                LOG.warn("Scan {} rejected with status {}: {}", hash, e.getStatus(), e.getMessage());
            }
            ctx.output(FAILURE_TAG, failure(hash, e.getStatus(), e.getError(), e.getMessage()));
        } catch (Exception e) {
            failedRequests.incrementAndGet();
            LOG.error("Inference failed for scan {}", hash, e);
            ctx.output(FAILURE_TAG, failure(hash, 500, "Inference failed", e.getMessage()));
        }

        // 定期打印处理统计信息
        if (total % 100 == 0) {
            LOG.info("Total requests: {}, failed: {}, full-image fallbacks: {}",
                    total, failedRequests.get(), service.getFaceLocalizer().getFullImageFallbacks());
        }
    }

    private static ScanFailure failure(String hash, int status, String error, String message) {
        return ScanFailure.builder()
                .hash(hash)
                .status(status)
                .error(error)
                .message(message)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    @Override
    public void close() throws Exception {
        super.close();

        // 关闭资源
        if (service != null) {
            service.close();
        }

        LOG.info("ScanInferenceFunction closed. Total requests: {}, failed: {}",
                totalRequests != null ? totalRequests.get() : 0,
                failedRequests != null ? failedRequests.get() : 0);
    }
}
