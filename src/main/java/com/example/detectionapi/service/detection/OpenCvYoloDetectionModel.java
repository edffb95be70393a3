package com.example.detectionapi.service.detection;

import com.example.detectionapi.config.DetectorProperties;
import com.example.detectionapi.model.BoundingBox;
import com.example.detectionapi.model.Detection;
import nu.pattern.OpenCV;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.dnn.Dnn;
import org.opencv.dnn.Net;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Runs an Ultralytics YOLO (v8 / 11) detection model exported to ONNX through the OpenCV DNN
 * module. The export produces a single output tensor of shape {@code [1, 4 + classes, boxes]}
 * (or the transposed {@code [1, boxes, 4 + classes]}) where every box carries
 * {@code [cx, cy, w, h, score_0 ... score_n]} relative to the square network input.
 */
public class OpenCvYoloDetectionModel implements DetectionModel {

    private static final Logger log = LoggerFactory.getLogger(OpenCvYoloDetectionModel.class);

    private static final int BOX_FEATURES = 4;

    private final DetectorProperties properties;
    private Net network;

    public OpenCvYoloDetectionModel(DetectorProperties properties) {
        this.properties = properties;
    }

    @Override
    public void load() throws DetectionException {
        String modelPath = properties.getModelPath();
        if (modelPath == null || modelPath.isBlank()) {
            throw new ModelUnavailableException("Model path must be configured via detector.model-path");
        }
        Path path = Path.of(modelPath);
        if (!Files.isRegularFile(path)) {
            throw new ModelUnavailableException("YOLO model file " + path.toAbsolutePath() + " not found");
        }
        try {
            OpenCV.loadLocally();
            log.info("Loaded OpenCV native libraries");
            log.info("Loading YOLO model from {}", path.toAbsolutePath());
            Net loaded = Dnn.readNetFromONNX(path.toString());
            if (loaded.empty()) {
                throw new ModelUnavailableException("OpenCV returned an empty network for " + path.toAbsolutePath());
            }
            network = loaded;
        } catch (CvException | UnsatisfiedLinkError ex) {
            throw new ModelUnavailableException("Unable to load YOLO model from " + path.toAbsolutePath(), ex);
        }
    }

    @Override
    public List<Detection> infer(BufferedImage image) throws DetectionException {
        Objects.requireNonNull(image, "BufferedImage must not be null");
        Net net = network;
        if (net == null) {
            throw new ModelUnavailableException("YOLO model has not been loaded");
        }
        int inputSize = properties.getInputSize();
        Mat source = bufferedImageToMat(image);
        Mat blob = null;
        Mat output = null;
        try {
            blob = Dnn.blobFromImage(source, 1.0 / 255.0, new Size(inputSize, inputSize), new Scalar(0, 0, 0), true, false);
            net.setInput(blob);
            output = net.forward();
            if (output.dims() != 3) {
                throw new DetectionException("Unexpected YOLO output with " + output.dims() + " dimensions");
            }
            int first = output.size(1);
            int second = output.size(2);
            boolean channelFirst = first < second;
            int numFeatures = channelFirst ? first : second;
            int numBoxes = channelFirst ? second : first;
            float[] data = new float[numFeatures * numBoxes];
            Mat flat = output.reshape(1, 1);
            try {
                flat.get(0, 0, data);
            } finally {
                flat.release();
            }

            OutputLayout layout = new OutputLayout(numBoxes, numFeatures, channelFirst);
            float xFactor = image.getWidth() / (float) inputSize;
            float yFactor = image.getHeight() / (float) inputSize;
            List<Candidate> candidates = decode(data, layout, xFactor, yFactor,
                    image.getWidth(), image.getHeight(), properties.getConfThreshold());
            List<Candidate> kept = applyNms(candidates, properties.getNmsThreshold());

            List<Detection> detections = new ArrayList<>(kept.size());
            for (Candidate candidate : kept) {
                detections.add(new Detection(properties.classNameFor(candidate.classIndex()),
                        candidate.confidence(), candidate.box()));
            }
            return detections;
        } catch (CvException ex) {
            throw new DetectionException("OpenCV failed to run the YOLO model: " + ex.getMessage(), ex);
        } finally {
            if (output != null) {
                output.release();
            }
            if (blob != null) {
                blob.release();
            }
            source.release();
        }
    }

    static List<Candidate> decode(float[] data, OutputLayout layout, float xFactor, float yFactor,
                                  int imageWidth, int imageHeight, double threshold) {
        int classCount = layout.numFeatures() - BOX_FEATURES;
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < layout.numBoxes(); i++) {
            int bestClass = -1;
            float bestScore = 0f;
            for (int c = 0; c < classCount; c++) {
                float score = layout.value(data, i, BOX_FEATURES + c);
                if (score > bestScore) {
                    bestScore = score;
                    bestClass = c;
                }
            }
            if (bestClass < 0 || bestScore < threshold) {
                continue;
            }
            float cx = layout.value(data, i, 0);
            float cy = layout.value(data, i, 1);
            float w = layout.value(data, i, 2);
            float h = layout.value(data, i, 3);

            double x1 = clamp((cx - w / 2f) * xFactor, 0, imageWidth);
            double y1 = clamp((cy - h / 2f) * yFactor, 0, imageHeight);
            double x2 = clamp((cx + w / 2f) * xFactor, 0, imageWidth);
            double y2 = clamp((cy + h / 2f) * yFactor, 0, imageHeight);
            if (x2 <= x1 || y2 <= y1) {
                continue;
            }
            double confidence = Math.min(1.0, bestScore);
            candidates.add(new Candidate(new BoundingBox(x1, y1, x2, y2), confidence, bestClass));
        }
        return candidates;
    }

    /**
     * Class-aware non maximum suppression: a box only suppresses overlapping boxes of the same
     * class.
     */
    static List<Candidate> applyNms(List<Candidate> candidates, double threshold) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<Integer> order = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer idx) -> candidates.get(idx).confidence()).reversed());
        List<Candidate> kept = new ArrayList<>();
        boolean[] suppressed = new boolean[candidates.size()];
        for (int idx : order) {
            if (suppressed[idx]) {
                continue;
            }
            Candidate current = candidates.get(idx);
            kept.add(current);
            for (int j = 0; j < candidates.size(); j++) {
                if (suppressed[j] || j == idx) {
                    continue;
                }
                Candidate other = candidates.get(j);
                if (other.classIndex() == current.classIndex()
                        && intersectionOverUnion(current.box(), other.box()) > threshold) {
                    suppressed[j] = true;
                }
            }
        }
        return kept;
    }

    static double intersectionOverUnion(BoundingBox a, BoundingBox b) {
        double x1 = Math.max(a.x1(), b.x1());
        double y1 = Math.max(a.y1(), b.y1());
        double x2 = Math.min(a.x2(), b.x2());
        double y2 = Math.min(a.y2(), b.y2());
        double intersectionArea = Math.max(0, x2 - x1) * Math.max(0, y2 - y1);
        double union = a.area() + b.area() - intersectionArea;
        if (union <= 0) {
            return 0d;
        }
        return intersectionArea / union;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        byte[] data = ((DataBufferByte) converted.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    record OutputLayout(int numBoxes, int numFeatures, boolean channelFirst) {

        float value(float[] data, int boxIndex, int featureIndex) {
            if (channelFirst) {
                return data[featureIndex * numBoxes + boxIndex];
            }
            return data[boxIndex * numFeatures + featureIndex];
        }
    }

    record Candidate(BoundingBox box, double confidence, int classIndex) {
    }
}
