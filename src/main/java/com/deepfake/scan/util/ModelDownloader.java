package com.deepfake.scan.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 模型文件下载工具：本地已有则跳过，下载到临时文件后原子替换
 */
@Slf4j
public final class ModelDownloader {

    static final int DEFAULT_TIMEOUT_MILLIS = 30000;

    private ModelDownloader() {
    }

    public static boolean downloadIfMissing(String url, Path target) {
        return downloadIfMissing(url, target, DEFAULT_TIMEOUT_MILLIS);
    }

    /**
     * @param timeoutMillis 连接超时与读取超时，超时按下载失败处理
     * @return 文件已就绪返回true，下载失败返回false
     */
    public static boolean downloadIfMissing(String url, Path target, int timeoutMillis) {
        if (Files.isRegularFile(target)) {
            return true;
        }
        if (url == null || url.trim().isEmpty()) {
            log.warn("No download URL configured for {}", target);
            return false;
        }

        Path temp = null;
        try {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, target.getFileName().toString(), ".part");

            log.info("Downloading: {}", url);
            URLConnection connection = new URL(url).openConnection();
            connection.setConnectTimeout(timeoutMillis);
            connection.setReadTimeout(timeoutMillis);
            try (InputStream in = connection.getInputStream()) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Downloaded to: {}", target);
            return true;
        } catch (IOException e) {
            log.error("Failed to download {} to {}", url, target, e);
            deleteQuietly(temp);
            return false;
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete partial download {}: {}", path, e.getMessage());
        }
    }
}
