package org.sjsu.puffplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PuffPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PuffPlannerApplication.class, args);
    }
}
