package com.genads.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Output frame ratios supported by the ad generator.
 */
@RequiredArgsConstructor
public enum AspectRatio {

    SQUARE("1:1"),
    VERTICAL("9:16"),
    LANDSCAPE("16:9"),
    PORTRAIT("4:5"),
    CINEMATIC("21:9");

    public static final AspectRatio DEFAULT = LANDSCAPE;

    private final String code;

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AspectRatio fromCode(String code) {
        return Arrays.stream(values())
                .filter(ratio -> ratio.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported aspect ratio: " + code));
    }
}
