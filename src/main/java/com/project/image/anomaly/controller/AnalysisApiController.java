package com.project.image.anomaly.controller;

import com.project.image.anomaly.DTOs.AnomalyResult;
import com.project.image.anomaly.service.AnalysisExecutor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Base64;

@RestController
@RequestMapping("/api")
public class AnalysisApiController {

    private final AnalysisExecutor analysisExecutor;

    public AnalysisApiController(AnalysisExecutor analysisExecutor) {
        this.analysisExecutor = analysisExecutor;
    }

    public record AnalysisResponse(
            float score,
            float threshold,
            boolean anomalous,
            String status,
            int peakX,
            int peakY,
            String heatmapJpeg   // base64
    ) {
        static AnalysisResponse of(AnomalyResult r) {
            return new AnalysisResponse(r.score(), r.threshold(), r.anomalous(), r.status(),
                    r.peakX(), r.peakY(), Base64.getEncoder().encodeToString(r.heatmapJpeg()));
        }
    }

    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisResponse analyze(@RequestParam("file") MultipartFile file) throws IOException {
        AnalysisController.validateUploadedFile(file);
        return AnalysisResponse.of(analysisExecutor.run(AnalysisController.loadImage(file)));
    }
}
