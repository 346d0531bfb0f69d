package com.project.image.anomaly.controller;

import com.project.image.anomaly.DTOs.ModelStatus;
import org.springframework.ui.Model;

final class ViewModels {

    private ViewModels() {
    }

    static void addModelStatus(Model model, ModelStatus status) {
        model.addAttribute("modelLoaded", status.loaded());
        model.addAttribute("modelName", status.modelName());
        model.addAttribute("modelCategory", status.category());
        model.addAttribute("modelThreshold", status.threshold());
    }
}
