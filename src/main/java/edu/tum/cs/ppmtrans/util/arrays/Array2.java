package edu.tum.cs.ppmtrans.util.arrays;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.exception.NullArgumentException;

import com.google.common.base.Joiner;

/**
 * Fixed-size 2D array of {@code width} columns and {@code height} rows. Elements are stored in row-major order,
 * i.e. the element in column {@code c} and row {@code r} is found at index {@code r * width + c}.
 */
public class Array2<T extends Duplicable<T>> implements Duplicable<Array2<T>> {

	/**
	 * Writable reference to a single cell. A slot obtained before a transformation refers to the replaced contents
	 * and no longer affects the array.
	 */
	public interface Slot<T> {

		public T get();

		public void set(T value);

	}

	private class CellSlot implements Slot<T> {
		private final List<T> source = data;
		private final int index;

		public CellSlot(int index) {
			this.index = index;
		}

		@Override
		public T get() {
			return source.get(index);
		}

		@Override
		public void set(T value) {
			if (value == null)
				throw new NullArgumentException();
			source.set(index, value);
		}
	}

	private class RowMajorIterator implements Array2DIterator<T> {
		private final List<T> source = data;
		private final int numColumns = width;
		private int index = -1;

		@Override
		public boolean hasNext() {
			return (index < (source.size() - 1));
		}

		@Override
		public void advance() {
			index++;
		}

		@Override
		public T getValue() {
			return source.get(index);
		}

		@Override
		public int getColumn() {
			return index % numColumns;
		}

		@Override
		public int getRow() {
			return index / numColumns;
		}
	}

	private class ColumnMajorIterator implements Array2DIterator<T> {
		private final List<T> source = data;
		private final int numColumns = width;
		private final int numRows = height;
		private int column, row = -1, index = -numColumns;

		@Override
		public boolean hasNext() {
			return !source.isEmpty() && ((row < (numRows - 1)) || (column < (numColumns - 1)));
		}

		@Override
		public void advance() {
			if (++row >= numRows) {
				row = 0;
				index = ++column;
			} else
				index += numColumns;
		}

		@Override
		public T getValue() {
			return source.get(index);
		}

		@Override
		public int getColumn() {
			return column;
		}

		@Override
		public int getRow() {
			return row;
		}
	}

	private int width;
	private int height;
	private List<T> data;

	/**
	 * Creates an array with every cell holding a copy of {@code value}.
	 */
	public Array2(int width, int height, T value) {
		if (value == null)
			throw new NullArgumentException();
		int size = checkedSize(width, height);
		List<T> values = new ArrayList<T>(size);
		for (int i = 0; i < size; i++)
			values.add(value.duplicate());
		this.width = width;
		this.height = height;
		this.data = values;
	}

	private Array2(int width, int height, List<T> data) {
		this.width = width;
		this.height = height;
		this.data = data;
	}

	/**
	 * Creates an array backed by {@code values}, which must be in row-major order.
	 *
	 * @throws DimensionMismatchException if the number of values is not {@code width * height}
	 * @throws NullArgumentException if any of the values is null
	 */
	public static <T extends Duplicable<T>> Array2<T> fromRowMajor(int width, int height, T[] values) {
		checkLength(width, height, values.length);
		checkElements(Arrays.asList(values));
		return new Array2<T>(width, height, Arrays.asList(values));
	}

	/**
	 * Creates an array holding the elements of {@code values}, which must be in row-major order.
	 *
	 * @throws DimensionMismatchException if the number of values is not {@code width * height}
	 * @throws NullArgumentException if any of the values is null
	 */
	public static <T extends Duplicable<T>> Array2<T> fromRowMajor(int width, int height,
			List<? extends T> values) {
		checkLength(width, height, values.size());
		checkElements(values);
		return new Array2<T>(width, height, new ArrayList<T>(values));
	}

	private static int checkedSize(int width, int height) {
		if (width < 0)
			throw new NotPositiveException(width);
		if (height < 0)
			throw new NotPositiveException(height);
		return Math.multiplyExact(width, height);
	}

	private static void checkLength(int width, int height, int length) {
		int expected = checkedSize(width, height);
		if (length != expected)
			throw new DimensionMismatchException(length, expected);
	}

	private static void checkElements(List<?> values) {
		for (Object value : values)
			if (value == null)
				throw new NullArgumentException();
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/**
	 * @return a read-only view of all elements in row-major order
	 */
	public List<T> elementsRowMajor() {
		return Collections.unmodifiableList(data);
	}

	private int getIndex(int column, int row) {
		if ((column >= 0) && (column < width) && (row >= 0) && (row < height))
			return row * width + column;
		return -1;
	}

	/**
	 * @return the element at the given position, or an empty optional if the position is out of bounds
	 */
	public Optional<T> get(int column, int row) {
		int index = getIndex(column, row);
		if (index < 0)
			return Optional.empty();
		return Optional.of(data.get(index));
	}

	/**
	 * @return a writable reference to the cell at the given position, or an empty optional if the position is out
	 * 	of bounds
	 */
	public Optional<Slot<T>> getMut(int column, int row) {
		int index = getIndex(column, row);
		if (index < 0)
			return Optional.empty();
		return Optional.<Slot<T>>of(new CellSlot(index));
	}

	public Array2DIterator<T> rowMajorIterator() {
		return new RowMajorIterator();
	}

	public Array2DIterator<T> columnMajorIterator() {
		return new ColumnMajorIterator();
	}

	public void flipHorizontal(boolean rowMajor) {
		transform(Transformation.FLIP_HORIZONTAL, rowMajor);
	}

	public void flipVertical(boolean rowMajor) {
		transform(Transformation.FLIP_VERTICAL, rowMajor);
	}

	public void rotate90(boolean rowMajor) {
		transform(Transformation.ROTATE_90, rowMajor);
	}

	public void rotate180(boolean rowMajor) {
		transform(Transformation.ROTATE_180, rowMajor);
	}

	public void rotate270(boolean rowMajor) {
		transform(Transformation.ROTATE_270, rowMajor);
	}

	public void transpose(boolean rowMajor) {
		transform(Transformation.TRANSPOSE, rowMajor);
	}

	/**
	 * Applies a transformation by copying every element into a newly allocated array, then replaces dimensions
	 * and contents of this array with the result. The traversal order of the source does not affect the result.
	 *
	 * @param rowMajor traverse the source in row-major order if true, in column-major order otherwise
	 */
	public void transform(Transformation t, boolean rowMajor) {
		if (t == Transformation.IDENTITY)
			return;

		int targetWidth = t.getTargetWidth(width, height);
		int targetHeight = t.getTargetHeight(width, height);
		List<T> target = new ArrayList<T>(Collections.<T>nCopies(data.size(), null));

		Array2DIterator<T> it = rowMajor ? rowMajorIterator() : columnMajorIterator();
		while (it.hasNext()) {
			it.advance();
			int column = t.getTargetColumn(it.getColumn(), it.getRow(), width, height);
			int row = t.getTargetRow(it.getColumn(), it.getRow(), width, height);
			if ((column < 0) || (column >= targetWidth) || (row < 0) || (row >= targetHeight))
				throw new AssertionError(t + " mapped (" + it.getColumn() + ", " + it.getRow() + ") to (" +
						column + ", " + row + ") outside of " + targetWidth + "x" + targetHeight);
			target.set(row * targetWidth + column, it.getValue().duplicate());
		}

		width = targetWidth;
		height = targetHeight;
		data = target;
	}

	@Override
	public Array2<T> duplicate() {
		List<T> copy = new ArrayList<T>(data.size());
		for (T value : data)
			copy.add(value.duplicate());
		return new Array2<T>(width, height, copy);
	}

	@Override
	public int hashCode() {
		return (31 * (31 * width + height)) + data.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Array2))
			return false;
		Array2<?> other = (Array2<?>) obj;
		return (width == other.width) && (height == other.height) && data.equals(other.data);
	}

	@Override
	public String toString() {
		List<String> rows = new ArrayList<String>(height);
		for (int r = 0; r < height; r++)
			rows.add("[" + Joiner.on(", ").join(data.subList(r * width, (r + 1) * width)) + "]");
		return width + "x" + height + " [" + Joiner.on(", ").join(rows) + "]";
	}

}
