package com.worktrack.workitems;

import com.worktrack.workitems.config.WorkItemProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(WorkItemProperties.class)
public class WorkTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkTrackApplication.class, args);
    }
}
