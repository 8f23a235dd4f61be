package edu.tum.cs.ppmtrans;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

import edu.tum.cs.ppmtrans.image.ImageCodec;
import edu.tum.cs.ppmtrans.util.TransformConfiguration;

public class PpmTrans {

	private static final Logger logger = Logger.getLogger(PpmTrans.class.getName());

	private static final TransformConfiguration cfg = new TransformConfiguration(PpmTrans.class);

	static ImageCodec createCodec(TransformConfiguration cfg) throws ReflectiveOperationException {
		String className = cfg.getProperty(TransformConfiguration.PROP_CODEC);
		return Class.forName(className).asSubclass(ImageCodec.class).getDeclaredConstructor().newInstance();
	}

	/**
	 * @return the process exit status
	 */
	static int run(String[] args, TransformConfiguration cfg) {
		TransformRequest request;
		try {
			request = TransformRequest.parse(args, cfg);
		} catch (IllegalArgumentException ex) {
			System.err.println(ex.getMessage());
			System.err.println(TransformRequest.USAGE);
			return 1;
		}

		logger.fine(request.toString());
		try {
			ImageTransformer transformer = new ImageTransformer(createCodec(cfg),
					cfg.getLocalBooleanProperty("logTiming", false));
			return transformer.run(request) ? 0 : 1;
		} catch (IOException ex) {
			logger.log(Level.SEVERE, "Unable to read file!", ex);
		} catch (ReflectiveOperationException | RuntimeException ex) {
			logger.log(Level.SEVERE, "Could not transform image", ex);
		}
		return 1;
	}

	public static void main(String[] args) {
		System.exit(run(args, cfg));
	}

}
