package com.deepfake.scan;

import com.deepfake.scan.config.ScanJobConfig;
import com.deepfake.scan.function.ScanInferenceFunction;
import com.deepfake.scan.model.HealthStatus;
import com.deepfake.scan.model.ScanFailure;
import com.deepfake.scan.model.ScanResult;
import com.deepfake.scan.serialization.ScanJsonCodec;
import com.deepfake.scan.service.ScanInferenceService;
import com.deepfake.scan.sink.DorisSinkBuilder;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.restartstrategy.RestartStrategies;
import org.apache.flink.api.common.serialization.SimpleStringSchema;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * 深度伪造扫描主任务
 * 功能：
 * 1. 从Kafka接收扫描请求（已抽帧的图片或视频）
 * 2. 人脸定位裁剪 + 分类模型推理 + 多帧风险聚合
 * 3. 将风险报告写入Doris，失败请求写入失败表
 *
 * 使用 --health 参数时只加载模型并输出健康状态，健康返回0，否则返回1
 */
public class DeepfakeScanJob {

    private static final Logger LOG = LoggerFactory.getLogger(DeepfakeScanJob.class);

    public static void main(String[] args) throws Exception {

        // 1. 加载配置
        ScanJobConfig config = ScanJobConfig.loadConfig();

        if (Arrays.asList(args).contains("--health")) {
            System.exit(runHealthCheck(config));
        }

        // 2. 创建执行环境
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

        // 3. 配置环境参数
        configureEnvironment(env, config);

        // 4. 从Kafka读取扫描请求
        DataStream<String> requestStream = env
                .fromSource(createKafkaSource(config), WatermarkStrategy.noWatermarks(), "Kafka-Scan-Source")
                .name("scan-request-source")
                .uid("scan-request-source-uid");

        // 5. 推理
        SingleOutputStreamOperator<ScanResult> resultStream = requestStream
                .process(new ScanInferenceFunction(config))
                .name("scan-inference")
                .uid("scan-inference-uid");

        // 6. 风险报告写入Doris
        DataStream<String> reportRows = resultStream
                .map(ScanJsonCodec::toReportRow)
                .returns(Types.STRING)
                .name("report-to-json");
        DorisSinkBuilder.addToDoris(reportRows, config, config.getDorisTable(), "reports");

        // 7. 失败请求写入Doris失败表
        DataStream<ScanFailure> failureStream = resultStream.getSideOutput(ScanInferenceFunction.FAILURE_TAG);
        DataStream<String> failureRows = failureStream
                .map(ScanJsonCodec::toFailureRow)
                .returns(Types.STRING)
                .name("failure-to-json");
        DorisSinkBuilder.addToDoris(failureRows, config, config.getDorisFailureTable(), "failures");

        // 8. 执行任务
        LOG.info("Starting Deepfake Scan Job...");
        env.execute("Deepfake Scan Job");
    }

    /**
     * 健康检查：加载模型后输出健康状态JSON
     */
    static int runHealthCheck(ScanJobConfig config) {
        try (ScanInferenceService service = ScanInferenceService.create(config)) {
            HealthStatus health = service.health();
            System.out.println(ScanJsonCodec.toJson(health));
            return health.isHealthy() ? 0 : 1;
        } catch (RuntimeException e) {
            LOG.error("Health check failed", e);
            return 1;
        }
    }

    /**
     * 配置Flink执行环境
     */
    private static void configureEnvironment(StreamExecutionEnvironment env, ScanJobConfig config) {
        // 设置并行度
        env.setParallelism(config.getParallelism());

        // 开启Checkpoint
        env.enableCheckpointing(config.getCheckpointInterval(), CheckpointingMode.EXACTLY_ONCE);
        env.getCheckpointConfig().setMinPauseBetweenCheckpoints(30000);
        env.getCheckpointConfig().setCheckpointTimeout(600000);
        env.getCheckpointConfig().setMaxConcurrentCheckpoints(1);

        // 设置重启策略
        env.setRestartStrategy(RestartStrategies.fixedDelayRestart(
                3, // 重启次数
                Time.of(10, TimeUnit.SECONDS) // 重启间隔
        ));

        LOG.info("Flink environment configured successfully");
    }

    /**
     * 创建Kafka Source，消息体按原始字符串读取，解析失败在推理函数中记为失败请求
     */
    private static KafkaSource<String> createKafkaSource(ScanJobConfig config) {
        return KafkaSource.<String>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.latest())
                .setValueOnlyDeserializer(new SimpleStringSchema())
                .build();
    }
}
