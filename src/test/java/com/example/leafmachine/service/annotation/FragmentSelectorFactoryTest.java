package com.example.leafmachine.service.annotation;

import com.example.leafmachine.model.FragmentSelector;
import com.example.leafmachine.model.RegionOfInterest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FragmentSelectorFactoryTest {

    private final FragmentSelectorFactory factory = new FragmentSelectorFactory();

    @Test
    void detectionBoxIsKeptVerbatimWithDimensions() {
        List<Double> box = List.of(120.5, 80.0, 640.0, 900.25);

        FragmentSelector selector = factory.fromDetectionBox(box, 1000, 2000);

        assertThat(selector.boundingBox()).containsExactly(120.5, 80.0, 640.0, 900.25);
        assertThat(selector.imageWidth()).isEqualTo(1000);
        assertThat(selector.imageHeight()).isEqualTo(2000);
    }

    @Test
    void regionOfInterestIsNormalizedAgainstSuppliedDimensions() {
        FragmentSelector selector = factory.fromDetectionBox(List.of(100.0, 200.0, 300.0, 600.0), 1000, 2000);

        RegionOfInterest roi = selector.regionOfInterest();

        assertThat(roi.xFrac()).isCloseTo(0.1, within(1e-9));
        assertThat(roi.yFrac()).isCloseTo(0.1, within(1e-9));
        assertThat(roi.widthFrac()).isCloseTo(0.2, within(1e-9));
        assertThat(roi.heightFrac()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void outOfRangeBoxIsNotClamped() {
        FragmentSelector selector = factory.fromDetectionBox(List.of(-50.0, 10.0, 1500.0, 30.0), 1000, 100);

        assertThat(selector.boundingBox()).containsExactly(-50.0, 10.0, 1500.0, 30.0);
        assertThat(selector.regionOfInterest().xFrac()).isNegative();
        assertThat(selector.regionOfInterest().widthFrac()).isGreaterThan(1.0);
    }

    @Test
    void fullImageSelectorSpansWholeFrame() {
        FragmentSelector selector = factory.fromFullImage(3000, 4000);

        assertThat(selector.boundingBox()).containsExactly(0.0, 0.0, 3000.0, 4000.0);
        assertThat(selector.regionOfInterest()).isEqualTo(new RegionOfInterest(0.0, 0.0, 1.0, 1.0));
    }

    @Test
    void rejectsBoxWithoutFourCoordinates() {
        assertThatThrownBy(() -> factory.fromDetectionBox(List.of(1.0, 2.0, 3.0), 10, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
