package edu.tum.cs.ppmtrans;

import com.google.common.primitives.Ints;

import edu.tum.cs.ppmtrans.util.TransformConfiguration;
import edu.tum.cs.ppmtrans.util.arrays.Transformation;

/**
 * A single transformation of an input image, as selected on the command line.
 */
public class TransformRequest {

	public static final String USAGE = "usage: PpmTrans [--row-major | --col-major] " +
			"[-f|--flip horizontal|vertical | -r|--rotate 0|90|180|270 | --transpose] [file]";

	private final Transformation transformation;
	private final boolean rowMajor;
	private final String inputFile;

	public TransformRequest(Transformation transformation, boolean rowMajor, String inputFile) {
		this.transformation = transformation;
		this.rowMajor = rowMajor;
		this.inputFile = inputFile;
	}

	public Transformation getTransformation() {
		return transformation;
	}

	public boolean isRowMajor() {
		return rowMajor;
	}

	/**
	 * @return name of the image file to read, or null for standard input
	 */
	public String getInputFile() {
		return inputFile;
	}

	public static TransformRequest parse(String[] args, TransformConfiguration cfg) {
		boolean rowMajor = false;
		boolean colMajor = false;
		Transformation transformation = null;
		String inputFile = null;
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			Transformation selected = null;
			if (arg.equals("--row-major"))
				rowMajor = true;
			else if (arg.equals("--col-major"))
				colMajor = true;
			else if (arg.equals("-f") || arg.equals("--flip"))
				selected = Transformation.forFlip(requireValue(args, ++i, arg));
			else if (arg.equals("-r") || arg.equals("--rotate")) {
				String value = requireValue(args, ++i, arg);
				Integer degrees = Ints.tryParse(value);
				if (degrees == null)
					throw new IllegalArgumentException("invalid rotation angle '" + value + "'");
				selected = Transformation.forRotation(degrees);
			} else if (arg.equals("--transpose"))
				selected = Transformation.TRANSPOSE;
			else if (arg.startsWith("-") && (arg.length() > 1))
				throw new IllegalArgumentException("unknown option '" + arg + "'");
			else if (inputFile == null)
				inputFile = arg;
			else
				throw new IllegalArgumentException("more than one input file given");

			if (selected != null) {
				if (transformation != null)
					throw new IllegalArgumentException("only one of --flip, --rotate and --transpose may be given");
				transformation = selected;
			}
		}

		if (rowMajor && colMajor)
			throw new IllegalArgumentException("--row-major and --col-major are mutually exclusive");
		if (!rowMajor && !colMajor)
			rowMajor = cfg.isRowMajorDefault();
		if (transformation == null)
			transformation = Transformation.IDENTITY;
		return new TransformRequest(transformation, rowMajor, inputFile);
	}

	private static String requireValue(String[] args, int index, String option) {
		if (index >= args.length)
			throw new IllegalArgumentException("option '" + option + "' requires a value");
		return args[index];
	}

	@Override
	public String toString() {
		return transformation.getDisplayName() + " of " + ((inputFile != null) ? ("'" + inputFile + "'") : "stdin") +
				(rowMajor ? " (row-major)" : " (column-major)");
	}

}
