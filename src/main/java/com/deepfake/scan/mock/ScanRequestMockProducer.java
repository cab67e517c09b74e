package com.deepfake.scan.mock;

import com.deepfake.scan.model.MediaType;
import com.deepfake.scan.model.ScanRequest;
import com.deepfake.scan.serialization.ScanJsonCodec;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 扫描请求模拟生产者
 * 功能：
 * 1. 读取本地目录：每个子目录视为一段已抽帧的视频，根目录下的图片视为单张图片
 * 2. 构建扫描请求发送到Kafka
 * 3. 可配置重复轮数和发送间隔
 */
public class ScanRequestMockProducer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScanRequestMockProducer.class);

    private final String topic;
    private final KafkaProducer<String, String> producer;

    public ScanRequestMockProducer(String bootstrapServers, String topic) {
        this.topic = topic;

        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "1");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 10);

        producer = new KafkaProducer<>(props);
        LOG.info("Kafka producer initialized: {}", bootstrapServers);
    }

    /**
     * 发送请求，按hash分区
     */
    public void send(List<ScanRequest> requests, int rounds, long intervalMillis) throws InterruptedException {
        long sent = 0;
        for (int round = 0; round < rounds; round++) {
            for (ScanRequest request : requests) {
                String json = ScanJsonCodec.toJson(request);
                producer.send(new ProducerRecord<>(topic, request.getHash(), json), (metadata, exception) -> {
                    if (exception != null) {
                        LOG.error("Error sending scan request {}: {}", request.getHash(), exception.getMessage());
                    }
                });
                sent++;
                if (intervalMillis > 0) {
                    Thread.sleep(intervalMillis);
                }
            }
            LOG.info("Round {} completed, {} requests sent", round + 1, sent);
        }
    }

    /**
     * 扫描目录构建请求，按名称排序保证可重复
     */
    public static List<ScanRequest> buildRequests(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }

        List<Path> entries;
        try (Stream<Path> children = Files.list(root)) {
            entries = children.sorted().collect(Collectors.toList());
        }

        List<ScanRequest> requests = new ArrayList<>();
        for (Path entry : entries) {
            if (Files.isDirectory(entry)) {
                List<Path> frames = listImages(entry);
                if (frames.isEmpty()) {
                    LOG.warn("Skipping folder without frames: {}", entry);
                    continue;
                }
                requests.add(buildRequest(MediaType.VIDEO, frames, entry.getFileName().toString()));
            } else if (isImage(entry)) {
                requests.add(buildRequest(MediaType.IMAGE, Collections.singletonList(entry),
                        entry.getFileName().toString()));
            }
        }
        return requests;
    }

    private static ScanRequest buildRequest(MediaType mediaType, List<Path> frames, String source)
            throws IOException {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("source", source);
        metadata.put("frameCount", frames.size());

        return ScanRequest.builder()
                .hash(sha256(frames))
                .mediaType(mediaType.name())
                .extractedFrames(frames.stream()
                        .map(path -> path.toAbsolutePath().toString())
                        .collect(Collectors.toList()))
                .metadata(metadata)
                .build();
    }

    private static List<Path> listImages(Path directory) throws IOException {
        try (Stream<Path> paths = Files.list(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(ScanRequestMockProducer::isImage)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static boolean isImage(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".jpg") || fileName.endsWith(".jpeg") || fileName.endsWith(".png");
    }

    static String sha256(List<Path> files) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (Path file : files) {
            digest.update(Files.readAllBytes(file));
        }
        StringBuilder hex = new StringBuilder();
        for (byte b : digest.digest()) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }

    @Override
    public void close() {
        producer.flush();
        producer.close();
        LOG.info("Kafka producer closed");
    }

    /**
     * 主函数
     */
    public static void main(String[] args) {
        // 配置参数（可以从命令行读取）
        String bootstrapServers = args.length >= 1 ? args[0] : "localhost:9092";
        String topic = args.length >= 2 ? args[1] : "deepfake-scan-requests";
        String directory = args.length >= 3 ? args[2] : "src/test/resources/scan-samples";
        int rounds = args.length >= 4 ? Integer.parseInt(args[3]) : 1;
        long intervalMillis = args.length >= 5 ? Long.parseLong(args[4]) : 500;

        try {
            List<ScanRequest> requests = buildRequests(Paths.get(directory));
            if (requests.isEmpty()) {
                throw new IllegalStateException("No frames or images found in directory: " + directory);
            }
            LOG.info("Built {} scan requests from {}", requests.size(), directory);

            try (ScanRequestMockProducer producer = new ScanRequestMockProducer(bootstrapServers, topic)) {
                producer.send(requests, rounds, intervalMillis);
            }
        } catch (Exception e) {
            LOG.error("Error running mock producer", e);
            System.exit(1);
        }
    }
}
