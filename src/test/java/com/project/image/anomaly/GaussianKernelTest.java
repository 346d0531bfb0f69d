package com.project.image.anomaly;

import com.project.image.anomaly.processing.GaussianKernel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class GaussianKernelTest {

    @ParameterizedTest
    @ValueSource(doubles = {0.3, 1.0, 1.5, 2.25, 4.0, 7.9})
    void kernel_isOddAndSumsToOne(double sigma) {
        GaussianKernel k = GaussianKernel.of(sigma);

        assertThat(k.size() % 2).isEqualTo(1);
        assertThat(k.size()).isEqualTo(2 * k.radius() + 1);
        assertThat(k.radius()).isEqualTo((int) Math.ceil(4 * sigma));

        double sum = 0;
        for (double w : k.weights()) sum += w;
        assertThat(sum).isCloseTo(1.0, within(1e-4));
    }

    @Test
    void defaultSigma_hasRadiusSixteen() {
        GaussianKernel k = GaussianKernel.of(4.0);
        assertThat(k.radius()).isEqualTo(16);
        assertThat(k.size()).isEqualTo(33);
    }

    @Test
    void kernel_isSymmetricAndPeaksInTheCentre() {
        GaussianKernel k = GaussianKernel.of(4.0);
        for (int i = 0; i < k.radius(); i++) {
            assertThat(k.weight(i)).isEqualTo(k.weight(k.size() - 1 - i));
            assertThat(k.weight(i)).isLessThan(k.weight(i + 1));
        }
        // unnormalised weight ratio between the centre and one step away is exp(-1/(2 sigma^2))
        assertThat(k.weight(k.radius() + 1) / k.weight(k.radius()))
                .isCloseTo(Math.exp(-1.0 / 32.0), within(1e-12));
    }

    @Test
    void nonPositiveSigma_isRejected() {
        assertThatThrownBy(() -> GaussianKernel.of(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GaussianKernel.of(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GaussianKernel.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
