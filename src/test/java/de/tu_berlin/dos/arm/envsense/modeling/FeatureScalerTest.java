package de.tu_berlin.dos.arm.envsense.modeling;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeatureScalerTest {

    @Test
    void columnsAreCentredAndScaled() {

        FeatureScaler scaler = FeatureScaler.fit("v1", new double[][]{{1, 10}, {3, 10}});

        // mean 2, population deviation 1
        assertArrayEquals(new double[]{-1, 0}, scaler.transform(new double[]{1, 10}), 1e-12);
        assertArrayEquals(new double[]{1, 0}, scaler.transform(new double[]{3, 10}), 1e-12);
    }

    @Test
    void constantColumnIsOnlyCentred() {

        FeatureScaler scaler = FeatureScaler.fit("v1", new double[][]{{4}, {4}, {4}});

        assertArrayEquals(new double[]{2}, scaler.transform(new double[]{6}), 1e-12);
    }

    @Test
    void widthMustMatch() {

        FeatureScaler scaler = FeatureScaler.fit("v1", new double[][]{{1, 2}});

        assertThrows(IllegalArgumentException.class, () -> scaler.transform(new double[]{1, 2, 3}));
    }
}
