package com.autoprof.orchestrator.image;

import com.autoprof.orchestrator.engine.Options;

import java.io.IOException;

/**
 * Loads the primary image for a job.
 *
 * Implementations may consult any option (extension numbers, cutout windows,
 * unit conversions). Any exception they throw is treated as an unreadable
 * image and fails only that job.
 */
@FunctionalInterface
public interface ImageReader {

    ImageData read(String imageFile, Options options) throws IOException;
}
