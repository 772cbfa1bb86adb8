package com.autonomous.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AnalysisApplication {

    public static void main(String[] args) {
        boolean cli = Arrays.asList(args).contains("--analysis.cli.enabled=true");
        SpringApplication application = new SpringApplication(AnalysisApplication.class);
        if (cli) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = application.run(args);
        if (cli) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
