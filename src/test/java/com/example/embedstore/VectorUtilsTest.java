package com.example.embedstore;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class VectorUtilsTest {

    @Test
    public void identicalVectorsScoreOne() {
        float[] a = {0.3f, -1.2f, 4f};
        assertThat(VectorUtils.cosineSimilarity(a, a)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    public void orthogonalAndOppositeVectors() {
        assertThat(VectorUtils.cosineSimilarity(new float[]{1f, 0f}, new float[]{0f, 1f})).isEqualTo(0.0);
        assertThat(VectorUtils.cosineSimilarity(new float[]{1f, 2f}, new float[]{-1f, -2f})).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    public void zeroMagnitudeScoresZero() {
        assertThat(VectorUtils.cosineSimilarity(new float[]{0f, 0f}, new float[]{1f, 1f})).isEqualTo(0.0);
        assertThat(VectorUtils.cosineSimilarity(new float[]{1f, 1f}, new float[]{0f, 0f})).isEqualTo(0.0);
    }

    @Test
    public void differentLengthsAreRejected() {
        assertThatThrownBy(() -> VectorUtils.cosineSimilarity(new float[]{1f}, new float[]{1f, 2f}))
                .isInstanceOf(DimensionMismatchException.class)
                .satisfies(e -> {
                    DimensionMismatchException dme = (DimensionMismatchException) e;
                    assertThat(dme.getExpected()).isEqualTo(1);
                    assertThat(dme.getActual()).isEqualTo(2);
                });
    }

    @Test
    public void similarityStaysWithinBounds() {
        Random random = new Random(7);
        for (int n = 0; n < 500; n++) {
            float[] a = new float[16];
            float[] b = new float[16];
            for (int i = 0; i < 16; i++) {
                a[i] = (float) (random.nextGaussian() * 100);
                b[i] = random.nextBoolean() ? a[i] * 3 : (float) random.nextGaussian();
            }
            assertThat(VectorUtils.cosineSimilarity(a, b)).isBetween(-1.0, 1.0);
        }
    }

    @Test
    public void parsesJsonAndSeparatedFloats() {
        assertThat(VectorUtils.parseFloats("[0.5, -1, 2e-1]")).containsExactly(0.5f, -1f, 0.2f);
        assertThat(VectorUtils.parseFloats(" 0.5,-1  2 \n")).containsExactly(0.5f, -1f, 2f);
    }

    @Test
    public void unparsableTextIsNumberFormatException() {
        assertThatThrownBy(() -> VectorUtils.parseFloats("[1, \"x\"")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> VectorUtils.parseFloats("embedding failed")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> VectorUtils.parseFloats("   ")).isInstanceOf(NumberFormatException.class);
    }
}
