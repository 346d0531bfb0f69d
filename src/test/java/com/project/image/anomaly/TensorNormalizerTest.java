package com.project.image.anomaly;

import com.project.image.anomaly.exceptions.ShapeMismatchException;
import com.project.image.anomaly.processing.Tensor;
import com.project.image.anomaly.processing.TensorNormalizer;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.*;

class TensorNormalizerTest {

    private final TensorNormalizer normalizer = new TensorNormalizer();

    @Test
    void normalize_producesChannelFirstImageNetTensor() {
        BufferedImage img = TestImages.solid(224, 224, Color.BLACK);
        img.setRGB(5, 7, new Color(255, 128, 0).getRGB());

        Tensor t = normalizer.normalize(img);

        assertThat(t.shape()).containsExactly(1, 3, 224, 224);
        assertThat(t.get(0, 0, 7, 5)).isCloseTo((1f - 0.485f) / 0.229f, within(1e-6f));
        assertThat(t.get(0, 1, 7, 5)).isCloseTo((128 / 255f - 0.456f) / 0.224f, within(1e-6f));
        assertThat(t.get(0, 2, 7, 5)).isCloseTo((0f - 0.406f) / 0.225f, within(1e-6f));

        // black pixels elsewhere
        assertThat(t.get(0, 0, 0, 0)).isCloseTo(-0.485f / 0.229f, within(1e-6f));
        assertThat(t.get(0, 2, 223, 223)).isCloseTo(-0.406f / 0.225f, within(1e-6f));
    }

    @Test
    void layout_isRowMajorWithinEachPlane() {
        BufferedImage img = TestImages.solid(224, 224, Color.BLACK);
        img.setRGB(3, 1, Color.WHITE.getRGB());

        Tensor t = normalizer.normalize(img);
        float[] data = t.data();
        int plane = 224 * 224;
        float white = (1f - 0.485f) / 0.229f;
        assertThat(data[1 * 224 + 3]).isEqualTo(white);
        assertThat(data[plane + 1 * 224 + 3]).isEqualTo((1f - 0.456f) / 0.224f);
        assertThat(t.offset(0, 2, 1, 3)).isEqualTo(2 * plane + 224 + 3);
    }

    @Test
    void wrongSize_isAShapeMismatch() {
        assertThatThrownBy(() -> normalizer.normalize(TestImages.solid(256, 224, Color.BLACK)))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void tensor_rejectsDataOfTheWrongLength() {
        assertThatThrownBy(() -> new Tensor(new long[]{1, 3, 2, 2}, new float[11]))
                .isInstanceOf(ShapeMismatchException.class);
    }
}
