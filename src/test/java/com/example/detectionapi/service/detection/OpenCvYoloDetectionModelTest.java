package com.example.detectionapi.service.detection;

import com.example.detectionapi.config.DetectorProperties;
import com.example.detectionapi.model.BoundingBox;
import com.example.detectionapi.service.detection.OpenCvYoloDetectionModel.Candidate;
import com.example.detectionapi.service.detection.OpenCvYoloDetectionModel.OutputLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OpenCvYoloDetectionModelTest {

    @Test
    void decodesChannelFirstOutputIntoImageCoordinates() {
        // two boxes, two classes: rows are cx, cy, w, h, score0, score1
        float[] data = {
                320f, 100f,
                320f, 100f,
                64f, 20f,
                128f, 20f,
                0.10f, 0.05f,
                0.90f, 0.10f
        };
        OutputLayout layout = new OutputLayout(2, 6, true);

        List<Candidate> candidates = OpenCvYoloDetectionModel.decode(data, layout, 2f, 1f, 1280, 640, 0.25);

        assertThat(candidates).hasSize(1);
        Candidate candidate = candidates.get(0);
        assertThat(candidate.classIndex()).isEqualTo(1);
        assertThat(candidate.confidence()).isCloseTo(0.9, within(1e-6));
        assertThat(candidate.box()).isEqualTo(new BoundingBox(576, 256, 704, 384));
    }

    @Test
    void decodesChannelLastOutputAndClampsToImage() {
        float[] data = {
                10f, 10f, 40f, 40f, 0.8f
        };
        OutputLayout layout = new OutputLayout(1, 5, false);

        List<Candidate> candidates = OpenCvYoloDetectionModel.decode(data, layout, 1f, 1f, 100, 100, 0.25);

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).box()).isEqualTo(new BoundingBox(0, 0, 30, 30));
    }

    @Test
    void nmsSuppressesOverlapsOfTheSameClassOnly() {
        Candidate strong = new Candidate(new BoundingBox(0, 0, 100, 100), 0.9, 0);
        Candidate overlapping = new Candidate(new BoundingBox(5, 5, 105, 105), 0.8, 0);
        Candidate otherClass = new Candidate(new BoundingBox(5, 5, 105, 105), 0.7, 1);
        Candidate separate = new Candidate(new BoundingBox(300, 300, 350, 350), 0.6, 0);

        List<Candidate> kept = OpenCvYoloDetectionModel.applyNms(List.of(overlapping, strong, otherClass, separate), 0.45);

        assertThat(kept).containsExactly(strong, otherClass, separate);
    }

    @Test
    void intersectionOverUnionOfDisjointBoxesIsZero() {
        double iou = OpenCvYoloDetectionModel.intersectionOverUnion(
                new BoundingBox(0, 0, 10, 10), new BoundingBox(20, 20, 30, 30));

        assertThat(iou).isZero();
    }

    @Test
    void loadFailsWhenModelFileIsMissing(@TempDir Path tempDir) {
        DetectorProperties properties = new DetectorProperties();
        properties.setModelPath(tempDir.resolve("missing.onnx").toString());
        OpenCvYoloDetectionModel model = new OpenCvYoloDetectionModel(properties);

        assertThatThrownBy(model::load)
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void inferBeforeLoadIsFatal() {
        OpenCvYoloDetectionModel model = new OpenCvYoloDetectionModel(new DetectorProperties());

        assertThatThrownBy(() -> model.infer(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB)))
                .isInstanceOf(ModelUnavailableException.class);
    }

    @Test
    void classNamesFallBackToIndexLabel() {
        DetectorProperties properties = new DetectorProperties();
        properties.setClassNames(List.of("person", " "));

        assertThat(properties.classNameFor(0)).isEqualTo("person");
        assertThat(properties.classNameFor(1)).isEqualTo("class_1");
        assertThat(properties.classNameFor(5)).isEqualTo("class_5");
    }
}
