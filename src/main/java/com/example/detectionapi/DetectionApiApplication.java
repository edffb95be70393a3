package com.example.detectionapi;

import com.example.detectionapi.config.DetectorProperties;
import com.example.detectionapi.config.PipelineProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Object Detection API",
                version = "1.0",
                description = "Accepts uploaded images, runs them through an object detection model in the background "
                        + "and serves the most recent detection result."))
@SpringBootApplication
@EnableConfigurationProperties({DetectorProperties.class, PipelineProperties.class})
public class DetectionApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(DetectionApiApplication.class, args);
    }
}
