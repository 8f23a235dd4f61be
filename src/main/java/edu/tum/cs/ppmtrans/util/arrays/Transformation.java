package edu.tum.cs.ppmtrans.util.arrays;

/**
 * Geometric transformations of a 2D array, expressed as a mapping from source coordinates (column, row) of a
 * {@code width} x {@code height} array to destination coordinates. Rotations are clockwise.
 */
public enum Transformation {

	IDENTITY("Identity") {
		@Override
		public int getTargetColumn(int column, int row, int width, int height) {
			return column;
		}

		@Override
		public int getTargetRow(int column, int row, int width, int height) {
			return row;
		}
	},
	FLIP_HORIZONTAL("Horizontal flip") {
		@Override
		public int getTargetColumn(int column, int row, int width, int height) {
			return width - column - 1;
		}

		@Override
		public int getTargetRow(int column, int row, int width, int height) {
			return row;
		}
	},
	FLIP_VERTICAL("Vertical flip") {
		@Override
		public int getTargetColumn(int column, int row, int width, int height) {
			return column;
		}

		@Override
		public int getTargetRow(int column, int row, int width, int height) {
			return height - row - 1;
		}
	},
	ROTATE_90("90 degree rotation", true) {
		@Override
		public int getTargetColumn(int column, int row, int width, int height) {
			return height - row - 1;
		}

		@Override
		public int getTargetRow(int column, int row, int width, int height) {
			return column;
		}
	},
	ROTATE_180("180 degree rotation") {
		@Override
		public int getTargetColumn(int column, int row, int width, int height) {
			return width - column - 1;
		}

		@Override
		public int getTargetRow(int column, int row, int width, int height) {
			return height - row - 1;
		}
	},
	ROTATE_270("270 degree rotation", true) {
		@Override
		public int getTargetColumn(int column, int row, int width, int height) {
			return row;
		}

		@Override
		public int getTargetRow(int column, int row, int width, int height) {
			return width - column - 1;
		}
	},
	TRANSPOSE("Transposition", true) {
		@Override
		public int getTargetColumn(int column, int row, int width, int height) {
			return row;
		}

		@Override
		public int getTargetRow(int column, int row, int width, int height) {
			return column;
		}
	};

	private final String displayName;
	private final boolean swapsDimensions;

	private Transformation(String displayName) {
		this(displayName, false);
	}

	private Transformation(String displayName, boolean swapsDimensions) {
		this.displayName = displayName;
		this.swapsDimensions = swapsDimensions;
	}

	public String getDisplayName() {
		return displayName;
	}

	public boolean swapsDimensions() {
		return swapsDimensions;
	}

	public int getTargetWidth(int width, int height) {
		return swapsDimensions ? height : width;
	}

	public int getTargetHeight(int width, int height) {
		return swapsDimensions ? width : height;
	}

	public abstract int getTargetColumn(int column, int row, int width, int height);

	public abstract int getTargetRow(int column, int row, int width, int height);

	/**
	 * @param degrees clockwise rotation angle, one of 0, 90, 180 or 270
	 */
	public static Transformation forRotation(int degrees) {
		switch (degrees) {
		case 0:
			return IDENTITY;
		case 90:
			return ROTATE_90;
		case 180:
			return ROTATE_180;
		case 270:
			return ROTATE_270;
		default:
			throw new IllegalArgumentException("unsupported rotation angle " + degrees +
					", expected one of 0, 90, 180, 270");
		}
	}

	public static Transformation forFlip(String direction) {
		if (direction.equals("horizontal"))
			return FLIP_HORIZONTAL;
		else if (direction.equals("vertical"))
			return FLIP_VERTICAL;
		throw new IllegalArgumentException("unsupported flip direction '" + direction +
				"', expected 'horizontal' or 'vertical'");
	}

}
