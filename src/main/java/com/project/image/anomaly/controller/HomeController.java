package com.project.image.anomaly.controller;

import com.project.image.anomaly.service.ModelSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/** Home page with the active model and threshold. */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final ModelSessionManager sessions;

    public HomeController(ModelSessionManager sessions) {
        this.sessions = sessions;
    }

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving home page");
        ViewModels.addModelStatus(model, sessions.status());
        return "index"; // templates/index.html
    }
}
