package com.deepfake.scan.sink;

import com.deepfake.scan.config.ScanJobConfig;
import org.apache.doris.flink.cfg.DorisExecutionOptions;
import org.apache.doris.flink.cfg.DorisOptions;
import org.apache.doris.flink.cfg.DorisReadOptions;
import org.apache.doris.flink.sink.DorisSink;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Doris Sink构建器
 */
public final class DorisSinkBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(DorisSinkBuilder.class);

    private DorisSinkBuilder() {
    }

    /**
     * @param table 目标表名，报告表与失败表共用同一套连接配置
     * @return 是否已挂载Sink；配置不完整时跳过
     */
    public static boolean addToDoris(DataStream<String> stream, ScanJobConfig config, String table, String name) {
        if (isBlank(config.getDorisFenodes()) || isBlank(config.getDorisDatabase()) || isBlank(table)) {
            LOG.warn("Doris configuration is incomplete. Skipping {} sink. Fenodes: {}, Database: {}, Table: {}",
                    name, config.getDorisFenodes(), config.getDorisDatabase(), table);
            return false;
        }

        String database = config.getDorisDatabase();
        String username = config.getDorisUsername() != null ? config.getDorisUsername() : "";
        String password = config.getDorisPassword() != null ? config.getDorisPassword() : "";

        LOG.info("Configuring Doris sink {}: fenodes={}, db={}, table={}, user={}",
                name, config.getDorisFenodes(), database, table, username);

        // Doris连接配置
        DorisOptions.Builder dorisBuilder = DorisOptions.builder()
                .setFenodes(config.getDorisFenodes())
                .setTableIdentifier(database + "." + table);
        if (!username.isEmpty()) {
            dorisBuilder.setUsername(username);
        }
        if (!password.isEmpty()) {
            dorisBuilder.setPassword(password);
        }

        // 执行选项
        DorisExecutionOptions executionOptions = DorisExecutionOptions.builder()
                .setLabelPrefix("deepfake_" + name + "_" + System.currentTimeMillis())
                .setBufferSize(128 * 1024)
                .setBufferCount(2)
                .setMaxRetries(3)
                .setStreamLoadProp(streamLoadProperties())
                .build();

        DorisSink<String> sink = DorisSink.<String>builder()
                .setDorisReadOptions(DorisReadOptions.builder().build())
                .setDorisExecutionOptions(executionOptions)
                .setDorisOptions(dorisBuilder.build())
                .setSerializer(new JsonLineDorisSerializer())
                .build();

        stream.sinkTo(sink)
                .name("DorisSink-" + database + "." + table)
                .uid("doris-sink-" + table.replace("_", "-"));

        LOG.info("Doris sink configured successfully: {}.{}", database, table);
        return true;
    }

    /**
     * Stream Load配置：按行读取JSON
     */
    static Properties streamLoadProperties() {
        Properties props = new Properties();
        props.setProperty("format", "json");
        props.setProperty("strip_outer_array", "false");
        props.setProperty("read_json_by_line", "true");
        return props;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
