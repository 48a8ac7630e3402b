package com.sparrowlogic.reachability.controller;

import com.sparrowlogic.reachability.config.ReachabilityProperties;
import com.sparrowlogic.reachability.model.PortRange;
import com.sparrowlogic.reachability.service.ConnectivityCheckService;
import com.sparrowlogic.reachability.service.ResourceLookupFacade;
import com.sparrowlogic.reachability.service.ResourceLookupFacade.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Controller
public class ReachabilityController {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityController.class);

    private final ResourceLookupFacade lookups;
    private final ConnectivityCheckService checkService;
    private final ReachabilityProperties properties;

    public ReachabilityController(ResourceLookupFacade lookups, ConnectivityCheckService checkService,
                                  ReachabilityProperties properties) {
        this.lookups = lookups;
        this.checkService = checkService;
        this.properties = properties;
    }

    @GetMapping("/")
    public String showForm(Model model) {
        model.addAttribute("defaultPort", properties.defaultPort());
        return "form";
    }

    @PostMapping("/check")
    public String check(@RequestParam String sourceType, @RequestParam String sourceName,
                        @RequestParam String databaseName, @RequestParam(required = false) Integer port,
                        Model model) {
        try {
            var targetPort = port != null ? port : properties.defaultPort();
            if (!PortRange.all().contains(targetPort)) {
                throw new IllegalArgumentException("port " + targetPort + " is outside 0-65535");
            }
            var source = lookups.lookupSource(SourceType.parse(sourceType), sourceName);
            var destination = lookups.lookupDatabase(databaseName);
            var report = checkService.check(source, destination, targetPort);

            model.addAttribute("source", source);
            model.addAttribute("destination", destination);
            model.addAttribute("report", report);
            return "result";
        } catch (Exception e) {
            log.error("Reachability check from {} {} to {} failed", sourceType, sourceName, databaseName, e);
            model.addAttribute("error", "Error checking reachability: " + e.getMessage());
            return "error";
        }
    }
}
