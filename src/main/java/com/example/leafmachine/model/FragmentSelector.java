package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Region of an image an annotation points at. Keeps the raw {@code [x1, y1, x2, y2]} box
 * together with the image size it was measured against and exposes the normalized
 * region through {@link #regionOfInterest()}.
 * <p>
 * Coordinates are not validated: boxes that fall outside the image produce fractions
 * outside {@code [0, 1]}.
 */
@JsonIgnoreProperties({"boundingBox", "imageHeight", "imageWidth"})
public record FragmentSelector(List<Number> boundingBox, int imageHeight, int imageWidth) {

    public static final String TYPE = "oa:FragmentSelector";
    public static final String MEDIA_FRAGMENTS = "https://www.w3.org/TR/media-frags/";

    public FragmentSelector {
        boundingBox = List.copyOf(boundingBox);
    }

    @JsonProperty("@type")
    public String type() {
        return TYPE;
    }

    @JsonProperty("dcterms:conformsTo")
    public String conformsTo() {
        return MEDIA_FRAGMENTS;
    }

    @JsonProperty("ac:hasROI")
    public RegionOfInterest regionOfInterest() {
        double x1 = boundingBox.get(0).doubleValue();
        double y1 = boundingBox.get(1).doubleValue();
        double x2 = boundingBox.get(2).doubleValue();
        double y2 = boundingBox.get(3).doubleValue();
        return new RegionOfInterest(
                x1 / imageWidth,
                y1 / imageHeight,
                (x2 - x1) / imageWidth,
                (y2 - y1) / imageHeight);
    }
}
