package com.example.leafmachine.service.annotation;

import com.example.leafmachine.model.FragmentSelector;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FragmentSelectorFactory {

    /**
     * Wraps a detection box as given. Out-of-range coordinates are passed through.
     */
    public FragmentSelector fromDetectionBox(List<? extends Number> box, int imageWidth, int imageHeight) {
        if (box == null || box.size() != 4) {
            throw new IllegalArgumentException("Bounding box must contain exactly four coordinates");
        }
        return new FragmentSelector(List.<Number>copyOf(box), imageHeight, imageWidth);
    }

    public FragmentSelector fromFullImage(int imageWidth, int imageHeight) {
        List<Number> fullFrame = List.of(0.0, 0.0, (double) imageWidth, (double) imageHeight);
        return new FragmentSelector(fullFrame, imageHeight, imageWidth);
    }
}
