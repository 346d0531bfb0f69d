package com.project.image.anomaly.controller;

import com.project.image.anomaly.DTOs.AnomalyResult;
import com.project.image.anomaly.exceptions.InvalidImageException;
import com.project.image.anomaly.service.AnalysisExecutor;
import com.project.image.anomaly.service.ModelSessionManager;
import com.project.image.anomaly.service.StorageService;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import javax.imageio.ImageIO;

@Controller
@Validated
public class AnalysisController {
    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    static final List<String> SUPPORTED_FORMATS = List.of(
            "image/jpeg", "image/jpg", "image/png", "image/bmp", "image/gif"
    );
    static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024;

    private final AnalysisExecutor analysisExecutor;
    private final StorageService storageService;
    private final ModelSessionManager sessions;

    public AnalysisController(AnalysisExecutor analysisExecutor, StorageService storageService,
                              ModelSessionManager sessions) {
        this.analysisExecutor = analysisExecutor;
        this.storageService = storageService;
        this.sessions = sessions;
    }

    @GetMapping("/analyze")
    public String showForm(Model model) {
        ViewModels.addModelStatus(model, sessions.status());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
        return "analyze";
    }

    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(@RequestParam("file") @NotNull MultipartFile file, Model model) throws IOException {
        validateUploadedFile(file);
        log.info("Processing file: {} ({}KB)", file.getOriginalFilename(), file.getSize() / 1024);

        BufferedImage input = loadImage(file);
        AnomalyResult result = analysisExecutor.run(input);

        var storedOriginal = storageService.store(file);
        var heatmapStored = storageService.storeHeatmap(result.heatmapJpeg());

        model.addAttribute("originalPath", "/" + storedOriginal.relativeWebPath());
        model.addAttribute("heatmapPath", "/" + heatmapStored.relativeWebPath());
        model.addAttribute("score", String.format("%.4f", result.score()));
        model.addAttribute("threshold", result.threshold());
        model.addAttribute("status", result.status());
        model.addAttribute("anomalous", result.anomalous());
        model.addAttribute("peak", result.peakX() + ", " + result.peakY());
        ViewModels.addModelStatus(model, sessions.status());

        log.info("Analysis of {} finished: {}", file.getOriginalFilename(), result.status());
        return "result";
    }

    static void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose an image to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException("Unsupported file type: " + contentType
                    + ". Supported types: " + String.join(", ", SUPPORTED_FORMATS));
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("The file is too large. Maximum size: 10MB");
        }
    }

    static BufferedImage loadImage(MultipartFile file) throws IOException {
        BufferedImage input;
        try (var inputStream = file.getInputStream()) {
            input = ImageIO.read(inputStream);
        }
        if (input == null) {
            throw new InvalidImageException("The file is not a valid image or is corrupted.");
        }
        log.debug("Image loaded: {}x{}", input.getWidth(), input.getHeight());
        return input;
    }
}
