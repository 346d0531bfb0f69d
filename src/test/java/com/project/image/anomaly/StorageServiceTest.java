package com.project.image.anomaly;

import com.project.image.anomaly.exceptions.StorageException;
import com.project.image.anomaly.service.StorageService;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import java.nio.file.Files;
import java.nio.file.Path;
import static org.assertj.core.api.Assertions.*;

class StorageServiceTest {
    @Test
    void store_and_storeHeatmap_work() throws Exception {
        Path tmp = Files.createTempDirectory("uploads-test");
        StorageService storage = new StorageService(tmp.toString());

        MockMultipartFile file = new MockMultipartFile(
                "file", "my part (1).png", "image/png", new byte[]{1,2,3,4}
        );
        var stored = storage.store(file);
        assertThat(Files.exists(stored.path())).isTrue();
        assertThat(stored.filename()).endsWith("my_part__1_.png");
        assertThat(stored.relativeWebPath()).startsWith("uploads/");

        var first = storage.storeHeatmap(new byte[]{8,9,10});
        var second = storage.storeHeatmap(new byte[]{11});
        assertThat(Files.readAllBytes(first.path())).containsExactly(8, 9, 10);
        assertThat(first.filename()).endsWith("_heatmap.jpg").isNotEqualTo(second.filename());
    }
    @Test
    void store_rejectsNonImage() {
        Path tmp = Path.of(System.getProperty("java.io.tmpdir"), "uploads-test2");
        StorageService storage = new StorageService(tmp.toString());

        MockMultipartFile notImage = new MockMultipartFile("file", "x.txt", "text/plain", "hi".getBytes());
        assertThatThrownBy(() -> storage.store(notImage)).isInstanceOf(StorageException.class);
    }
}
