package com.sparrowlogic.reachability;

import com.sparrowlogic.reachability.cli.ReachabilityCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReachabilityApplication {

    public static void main(String[] args) {
        var application = new SpringApplication(ReachabilityApplication.class);
        if (ReachabilityCommand.isCommandLineInvocation(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }
}
