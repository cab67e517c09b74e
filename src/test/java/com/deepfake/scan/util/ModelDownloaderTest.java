package com.deepfake.scan.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelDownloaderTest {

    @TempDir
    Path tempDir;

    @Test
    void downloadsIntoMissingDirectory() throws Exception {
        Path source = Files.write(tempDir.resolve("source.bin"), "weights".getBytes(StandardCharsets.UTF_8));
        Path target = tempDir.resolve("cache").resolve("model.bin");

        assertTrue(ModelDownloader.downloadIfMissing(source.toUri().toString(), target));
        assertArrayEquals("weights".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(target));
    }

    @Test
    void skipsDownloadWhenFileExists() throws Exception {
        Path target = Files.write(tempDir.resolve("model.bin"), new byte[]{9});

        assertTrue(ModelDownloader.downloadIfMissing(tempDir.resolve("nowhere").toUri().toString(), target));
        assertArrayEquals(new byte[]{9}, Files.readAllBytes(target));
    }

    @Test
    void failedDownloadLeavesNoPartialFile() throws Exception {
        Path cache = tempDir.resolve("cache");
        Path target = cache.resolve("model.bin");

        assertFalse(ModelDownloader.downloadIfMissing(tempDir.resolve("nowhere").toUri().toString(), target));
        assertFalse(Files.exists(target));
        try (Stream<Path> leftovers = Files.list(cache)) {
            assertEquals(0, leftovers.count());
        }
    }

    @Test
    void missingUrlIsNotAvailable() {
        assertFalse(ModelDownloader.downloadIfMissing("", tempDir.resolve("model.bin")));
        assertFalse(ModelDownloader.downloadIfMissing(null, tempDir.resolve("model.bin")));
    }

    @Test
    void stalledServerTimesOutWithoutPartialFile() throws Exception {
        Path cache = tempDir.resolve("cache");
        Path target = cache.resolve("model.bin");
        List<Socket> held = new CopyOnWriteArrayList<>();

        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"))) {
            // 接受连接但从不响应
            Thread acceptor = new Thread(() -> {
                try {
                    while (!server.isClosed()) {
                        held.add(server.accept());
                    }
                } catch (IOException ignored) {
                    // server closed
                }
            });
            acceptor.setDaemon(true);
            acceptor.start();

            String url = "http://127.0.0.1:" + server.getLocalPort() + "/model.bin";
            boolean downloaded = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> ModelDownloader.downloadIfMissing(url, target, 300));

            assertFalse(downloaded);
        } finally {
            for (Socket socket : held) {
                socket.close();
            }
        }

        assertFalse(Files.exists(target));
        try (Stream<Path> leftovers = Files.list(cache)) {
            assertEquals(0, leftovers.count());
        }
    }
}
