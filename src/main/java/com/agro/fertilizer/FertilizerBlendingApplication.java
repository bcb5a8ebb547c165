package com.agro.fertilizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class FertilizerBlendingApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(FertilizerBlendingApplication.class, args);
        // In cli mode the run is over once the runner returns
        if (context.getEnvironment().getProperty("fertilizer.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
