package com.project.image.anomaly.controller;

import com.project.image.anomaly.DTOs.ModelStatus;
import com.project.image.anomaly.service.ModelSessionManager;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.nio.file.Paths;

@Controller
@Validated
@RequestMapping("/model")
public class ModelController {
    private static final Logger log = LoggerFactory.getLogger(ModelController.class);

    private final ModelSessionManager sessions;

    public ModelController(ModelSessionManager sessions) {
        this.sessions = sessions;
    }

    @PostMapping
    public String loadModel(@RequestParam("modelPath") @NotBlank String modelPath,
                            @RequestParam(name = "metadataPath", required = false) String metadataPath,
                            @RequestParam(name = "threshold", required = false) Float threshold,
                            RedirectAttributes redirect) {
        log.info("Model reload requested: {}", modelPath);
        ModelStatus status = sessions.load(
                Paths.get(modelPath.trim()),
                StringUtils.hasText(metadataPath) ? Paths.get(metadataPath.trim()) : null,
                threshold);
        redirect.addFlashAttribute("message",
                "Model '" + status.modelName() + "' loaded successfully. Now choose an image.");
        return "redirect:/";
    }

    @PostMapping("/threshold")
    public String updateThreshold(@RequestParam("threshold") float threshold, RedirectAttributes redirect) {
        ModelStatus status = sessions.updateThreshold(threshold);
        redirect.addFlashAttribute("message", "Threshold set to " + status.threshold());
        return "redirect:/";
    }
}
