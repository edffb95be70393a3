package com.example.detectionapi.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "detector")
public class DetectorProperties {

    public enum Engine {
        OPENCV,
        NOOP
    }

    @NotNull
    private Engine engine = Engine.OPENCV;
    private String modelPath = "./models/best.onnx";
    @Positive
    private int inputSize = 640;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confThreshold = 0.25;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double nmsThreshold = 0.45;
    private List<String> classNames = new ArrayList<>();

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine;
    }

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public int getInputSize() {
        return inputSize;
    }

    public void setInputSize(int inputSize) {
        this.inputSize = inputSize;
    }

    public double getConfThreshold() {
        return confThreshold;
    }

    public void setConfThreshold(double confThreshold) {
        this.confThreshold = confThreshold;
    }

    public double getNmsThreshold() {
        return nmsThreshold;
    }

    public void setNmsThreshold(double nmsThreshold) {
        this.nmsThreshold = nmsThreshold;
    }

    public List<String> getClassNames() {
        return classNames;
    }

    public void setClassNames(List<String> classNames) {
        this.classNames = classNames;
    }

    /**
     * Resolves the label for a class index emitted by the model. Indices without a configured
     * name fall back to {@code class_<index>}.
     */
    public String classNameFor(int classIndex) {
        if (classNames != null && classIndex >= 0 && classIndex < classNames.size()) {
            String name = classNames.get(classIndex);
            if (name != null && !name.isBlank()) {
                return name.trim();
            }
        }
        return "class_" + classIndex;
    }
}
