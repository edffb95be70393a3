package com.example.detectionapi.config;

import com.example.detectionapi.service.detection.DetectionModel;
import com.example.detectionapi.service.detection.NoOpDetectionModel;
import com.example.detectionapi.service.detection.OpenCvYoloDetectionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Wires the {@link DetectionModel} selected by {@code detector.engine} and the
 * single-threaded executor that hosts the inference worker.
 */
@Configuration
public class DetectorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DetectorConfiguration.class);

    @Bean
    public DetectionModel detectionModel(DetectorProperties properties) {
        if (properties.getEngine() == DetectorProperties.Engine.NOOP) {
            log.info("Using no-op detection model. Configure detector.engine=opencv to run a YOLO model.");
            return new NoOpDetectionModel();
        }
        log.info("Using OpenCV DNN detection model from {}", properties.getModelPath());
        return new OpenCvYoloDetectionModel(properties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "inferenceExecutor")
    public ThreadPoolTaskExecutor inferenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("inference-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
