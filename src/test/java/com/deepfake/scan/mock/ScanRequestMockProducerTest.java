package com.deepfake.scan.mock;

import com.deepfake.scan.model.ScanRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScanRequestMockProducerTest {

    @TempDir
    Path tempDir;

    @Test
    void foldersBecomeVideosAndImagesBecomeImageRequests() throws Exception {
        Path clip = Files.createDirectories(tempDir.resolve("clip_01"));
        Files.write(clip.resolve("frame_0002.jpg"), new byte[]{2});
        Files.write(clip.resolve("frame_0001.jpg"), new byte[]{1});
        Files.write(clip.resolve("frame_0003.PNG"), new byte[]{3});
        Files.write(clip.resolve("notes.txt"), new byte[]{4});
        Files.createDirectories(tempDir.resolve("empty_clip"));
        Files.write(tempDir.resolve("portrait.jpeg"), new byte[]{5});
        Files.write(tempDir.resolve("readme.md"), new byte[]{6});

        List<ScanRequest> requests = ScanRequestMockProducer.buildRequests(tempDir);

        assertEquals(2, requests.size());

        ScanRequest video = requests.get(0);
        assertEquals("VIDEO", video.getMediaType());
        assertEquals(3, video.getExtractedFrames().size());
        assertTrue(video.getExtractedFrames().get(0).endsWith("frame_0001.jpg"));
        assertTrue(video.getExtractedFrames().get(2).endsWith("frame_0003.PNG"));
        assertEquals("clip_01", video.getMetadata().get("source"));
        assertEquals(64, video.getHash().length());

        ScanRequest image = requests.get(1);
        assertEquals("IMAGE", image.getMediaType());
        assertEquals(1, image.getExtractedFrames().size());
        assertTrue(image.getExtractedFrames().get(0).endsWith("portrait.jpeg"));
    }

    @Test
    void hashDependsOnContent() throws Exception {
        Path a = Files.write(tempDir.resolve("a.jpg"), new byte[]{1, 2, 3});
        Path b = Files.write(tempDir.resolve("b.jpg"), new byte[]{1, 2, 3});
        Path c = Files.write(tempDir.resolve("c.jpg"), new byte[]{3, 2, 1});

        assertEquals(ScanRequestMockProducer.sha256(Arrays.asList(a)), ScanRequestMockProducer.sha256(Arrays.asList(b)));
        assertNotEquals(ScanRequestMockProducer.sha256(Arrays.asList(a)), ScanRequestMockProducer.sha256(Arrays.asList(c)));
        assertEquals("039058c6f2c0cb492c533b0a4d14ef77cc0f78abccced5287d84a1a2011cfb81",
                ScanRequestMockProducer.sha256(Arrays.asList(a)));
    }

    @Test
    void rejectsMissingDirectory() {
        assertThrows(IllegalArgumentException.class,
                () -> ScanRequestMockProducer.buildRequests(tempDir.resolve("absent")));
    }
}
