package com.deepfake.scan.sink;

import org.apache.doris.flink.sink.writer.serializer.DorisRecord;
import org.apache.doris.flink.sink.writer.serializer.DorisRecordSerializer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 单行JSON序列化为 Stream Load 字节，空行跳过
 */
public class JsonLineDorisSerializer implements DorisRecordSerializer<String> {

    private static final long serialVersionUID = 1L;

    @Override
    public DorisRecord serialize(String record) throws IOException {
        if (record == null || record.trim().isEmpty()) {
            return DorisRecord.empty;
        }
        return DorisRecord.of(record.trim().getBytes(StandardCharsets.UTF_8));
    }
}
