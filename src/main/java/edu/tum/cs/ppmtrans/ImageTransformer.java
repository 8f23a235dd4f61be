package edu.tum.cs.ppmtrans;

import java.io.IOException;
import java.util.ArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

import edu.tum.cs.ppmtrans.image.ImageCodec;
import edu.tum.cs.ppmtrans.image.Rgb;
import edu.tum.cs.ppmtrans.image.RgbImage;
import edu.tum.cs.ppmtrans.util.arrays.Array2;
import edu.tum.cs.ppmtrans.util.arrays.Transformation;

/**
 * Reads an image, applies a single transformation and writes the result to standard output.
 */
public class ImageTransformer {

	private static final Logger logger = Logger.getLogger(ImageTransformer.class.getName());

	private final ImageCodec codec;
	private final boolean logTiming;

	public ImageTransformer(ImageCodec codec, boolean logTiming) {
		this.codec = codec;
		this.logTiming = logTiming;
	}

	/**
	 * @return false if the transformed image could not be written
	 * @throws IOException if the input image could not be read
	 */
	public boolean run(TransformRequest request) throws IOException {
		RgbImage input = codec.read(request.getInputFile());
		Array2<Rgb> image = Array2.fromRowMajor(input.getWidth(), input.getHeight(), input.getPixels());

		apply(image, request.getTransformation(), request.isRowMajor());

		RgbImage output = new RgbImage(image.getWidth(), image.getHeight(),
				new ArrayList<Rgb>(image.elementsRowMajor()), input.getDenominator());
		try {
			codec.write(output, null);
		} catch (IOException ex) {
			logger.log(Level.SEVERE, "Unable to write file!", ex);
			return false;
		}
		return true;
	}

	void apply(Array2<Rgb> image, Transformation t, boolean rowMajor) {
		if (logTiming) {
			long startTime = System.nanoTime();
			image.transform(t, rowMajor);
			long endTime = System.nanoTime();
			logger.info(String.format("%s took %.8f seconds.", t.getDisplayName(), (endTime - startTime) / 1e9));
		} else
			image.transform(t, rowMajor);
	}

}
