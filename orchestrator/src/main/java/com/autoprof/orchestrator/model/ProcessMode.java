package com.autoprof.orchestrator.model;

import java.util.Arrays;

/**
 * How a run is dispatched.
 *
 *   image              : one image, standard sequence
 *   image list         : many images, standard sequence
 *   forced image       : one image, geometry taken from a previous fit
 *   forced image list  : many images, geometry taken from previous fits
 */
public enum ProcessMode {
    IMAGE("image"),
    IMAGE_LIST("image list"),
    FORCED_IMAGE("forced image"),
    FORCED_IMAGE_LIST("forced image list");

    private final String value;

    ProcessMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isForced() {
        return this == FORCED_IMAGE || this == FORCED_IMAGE_LIST;
    }

    public boolean isList() {
        return this == IMAGE_LIST || this == FORCED_IMAGE_LIST;
    }

    /**
     * Accepts either the configuration spelling ("forced image list") or the
     * constant name ("FORCED_IMAGE_LIST").
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ProcessMode fromValue(String value) {
        if (value != null) {
            for (ProcessMode mode : values()) {
                if (mode.value.equalsIgnoreCase(value.trim()) || mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unrecognized process_mode '" + value + "'! Should be in: "
                + Arrays.stream(values()).map(ProcessMode::value).toList());
    }
}
