package com.example.trackscheduler;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AppSchedulerProperties.class
})
public class TrackSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackSchedulerApplication.class, args);
    }
}
