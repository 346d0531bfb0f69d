package com.project.image.anomaly.service;

import com.project.image.anomaly.DTOs.AnomalyResult;
import com.project.image.anomaly.exceptions.InvalidImageException;
import com.project.image.anomaly.processing.AnomalyMap;
import com.project.image.anomaly.processing.BoundaryMode;
import com.project.image.anomaly.processing.GeometricPreprocessor;
import com.project.image.anomaly.processing.HeatmapColorizer;
import com.project.image.anomaly.processing.ScoreExtractor;
import com.project.image.anomaly.processing.SeparableGaussianSmoother;
import com.project.image.anomaly.processing.Tensor;
import com.project.image.anomaly.processing.TensorNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.Point;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/**
 * The analysis pipeline: preprocess, normalise, infer, smooth, then score and colourise the
 * smoothed map. Runs synchronously on the calling thread; see {@link AnalysisExecutor} for the
 * worker pool.
 */
@Service
public class AnomalyDetectionService {
    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final ModelSessionManager sessions;
    private final GeometricPreprocessor preprocessor = new GeometricPreprocessor();
    private final TensorNormalizer normalizer = new TensorNormalizer();
    private final SeparableGaussianSmoother smoother;
    private final HeatmapColorizer colorizer = new HeatmapColorizer();

    @Autowired
    public AnomalyDetectionService(ModelSessionManager sessions,
                                   @Value("${app.anomaly.sigma:4.0}") double sigma,
                                   @Value("${app.anomaly.boundary:REFLECT}") BoundaryMode boundary) {
        this.sessions = sessions;
        this.smoother = new SeparableGaussianSmoother(sigma, boundary);
        log.info("Anomaly map smoothing: sigma={}, kernel size={}, boundary={}",
                sigma, smoother.kernel().size(), boundary);
    }

    public AnomalyDetectionService(ModelSessionManager sessions) {
        this(sessions, SeparableGaussianSmoother.DEFAULT_SIGMA, BoundaryMode.REFLECT);
    }

    public AnomalyResult analyze(Path imagePath) {
        try (InputStream in = Files.newInputStream(imagePath)) {
            return analyze(decode(in, imagePath.getFileName().toString()));
        } catch (IOException e) {
            throw new InvalidImageException("Cannot read image " + imagePath + ": " + e.getMessage(), e);
        }
    }

    public AnomalyResult analyze(InputStream in, String name) {
        return analyze(decode(in, name));
    }

    public AnomalyResult analyze(BufferedImage input) {
        long start = System.nanoTime();
        BufferedImage image = preprocessor.preprocess(input);
        Tensor tensor = normalizer.normalize(image);

        return sessions.withActiveModel(model -> {
            log.info("Analyzing {}x{} image with model '{}'", input.getWidth(), input.getHeight(), model.modelName());

            AnomalyMap raw = AnomalyMap.fromTensor(model.adapter().infer(tensor));
            AnomalyMap smoothed = smoother.smooth(raw);

            float score = ScoreExtractor.score(smoothed);
            Point peak = ScoreExtractor.locate(smoothed);
            BufferedImage heatmap = colorizer.colorize(smoothed, score);
            BufferedImage overlay = colorizer.composite(image, heatmap);
            byte[] jpeg = HeatmapColorizer.toJpeg(overlay);

            boolean anomalous = score > model.threshold();
            log.info("Score {} (threshold {}) -> {}, peak at ({},{}), took {} ms",
                    score, model.threshold(), anomalous ? AnomalyResult.ANOMALY : AnomalyResult.NORMAL,
                    peak.x, peak.y, (System.nanoTime() - start) / 1_000_000);

            return new AnomalyResult(score, model.threshold(), anomalous, peak.x, peak.y,
                    smoothed.width(), smoothed.height(), jpeg);
        });
    }

    private static BufferedImage decode(InputStream in, String name) {
        BufferedImage image;
        try {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new InvalidImageException("Cannot decode image " + name + ": " + e.getMessage(), e);
        }
        if (image == null) {
            throw new InvalidImageException("The file " + name + " is not a valid image or is corrupted.");
        }
        return image;
    }
}
