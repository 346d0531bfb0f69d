package com.project.image.anomaly;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.image.anomaly.DTOs.AnomalyResult;
import com.project.image.anomaly.exceptions.AnomalyDetectionException;
import com.project.image.anomaly.exceptions.InvalidImageException;
import com.project.image.anomaly.exceptions.ModelExecutionException;
import com.project.image.anomaly.exceptions.ModelLoadException;
import com.project.image.anomaly.processing.Tensor;
import com.project.image.anomaly.service.AnalysisExecutor;
import com.project.image.anomaly.service.AnomalyDetectionService;
import com.project.image.anomaly.service.ModelMetadataService;
import com.project.image.anomaly.service.ModelSessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class AnalysisExecutorTest {

    private final ModelSessionManager sessions = new ModelSessionManager(
            path -> { throw new ModelLoadException("not used"); },
            new ModelMetadataService(new ObjectMapper()), 10f);
    private final AnalysisExecutor executor = new AnalysisExecutor(new AnomalyDetectionService(sessions), 2, 30);

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void run_executesOnAWorkerThread() {
        FakeInferenceAdapter adapter = FakeInferenceAdapter.pixelEnergy();
        sessions.activate(adapter, null, "energy", null);

        AnomalyResult result = executor.run(TestImages.withDefect(256, 256));

        assertThat(result.score()).isGreaterThan(0f);
        assertThat(adapter.callingThreads).hasSize(1);
        assertThat(adapter.callingThreads.get(0)).startsWith("anomaly-worker-");
    }

    @Test
    void run_rethrowsThePipelineExceptionUnwrapped() {
        sessions.activate(FakeInferenceAdapter.failing("boom"), null, "broken", null);
        assertThatThrownBy(() -> executor.run(TestImages.withDefect(64, 64)))
                .isExactlyInstanceOf(ModelExecutionException.class)
                .hasMessage("boom");

        assertThatThrownBy(() -> executor.run(null)).isInstanceOf(InvalidImageException.class);
    }

    @Test
    void concurrentAnalyses_ofTheSameImage_agree() {
        sessions.activate(FakeInferenceAdapter.pixelEnergy(), null, "energy", null);
        var image = TestImages.withDefect(400, 300);

        List<CompletableFuture<AnomalyResult>> futures = IntStream.range(0, 6)
                .mapToObj(i -> executor.submit(image))
                .collect(Collectors.toList());
        List<AnomalyResult> results = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());

        for (AnomalyResult r : results) {
            assertThat(r.score()).isEqualTo(results.get(0).score());
            assertThat(r.heatmapJpeg()).isEqualTo(results.get(0).heatmapJpeg());
        }
    }

    @Test
    void timedOutRequest_isDroppedFromTheQueue() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger inferences = new AtomicInteger();
        sessions.activate(new FakeInferenceAdapter("slow", input -> {
            inferences.incrementAndGet();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Tensor.zeros(1, 1, 224, 224);
        }), null, "slow", null);
        AnalysisExecutor single = new AnalysisExecutor(new AnomalyDetectionService(sessions), 1, 1);
        var image = TestImages.withDefect(64, 64);

        try {
            CompletableFuture<AnomalyResult> running = single.submit(image);
            assertThatThrownBy(() -> single.run(image))
                    .isInstanceOf(AnomalyDetectionException.class)
                    .hasMessageContaining("did not finish");

            release.countDown();
            assertThat(running.get(10, TimeUnit.SECONDS).score()).isZero();
        } finally {
            single.shutdown();
        }
        assertThat(inferences.get()).isEqualTo(1);
    }

    @Test
    void workerCount_mustBePositive() {
        assertThatThrownBy(() -> new AnalysisExecutor(new AnomalyDetectionService(sessions), 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
