package com.cred.freestyle.promotions.api.controller;

import io.swagger.v3.oas.annotations.Hidden;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the static admin page (static/index.html) at the root and at /ui.
 *
 * @author Promotions Team
 */
@Hidden
@Controller
public class AdminUiController {

    @GetMapping({"/", "/ui"})
    public String index() {
        return "forward:/index.html";
    }
}
