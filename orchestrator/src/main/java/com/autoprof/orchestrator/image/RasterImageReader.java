package com.autoprof.orchestrator.image;

import com.autoprof.orchestrator.engine.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.File;
import java.io.IOException;

/**
 * Default {@link ImageReader} for formats the JDK's ImageIO understands
 * (PNG, TIFF, BMP, ...). Band 0 of the raster is used as the pixel value.
 *
 * Survey data is normally FITS; declare an {@code ImageReader} bean to
 * replace this one.
 */
public class RasterImageReader implements ImageReader {

    private static final Logger log = LoggerFactory.getLogger(RasterImageReader.class);

    @Override
    public ImageData read(String imageFile, Options options) throws IOException {
        if (imageFile == null) {
            throw new IOException("No image file given");
        }
        File file = new File(imageFile);
        BufferedImage img = ImageIO.read(file);
        if (img == null) {
            throw new IOException("No ImageIO reader understands " + imageFile);
        }

        Raster raster = img.getRaster();
        int height = raster.getHeight();
        int width  = raster.getWidth();
        double[][] pixels = new double[height][width];
        for (int r = 0; r < height; r++) {
            raster.getSamples(0, r, width, 1, 0, pixels[r]);
        }
        log.debug("Read {} ({}x{})", imageFile, width, height);
        return new ImageData(pixels);
    }
}
