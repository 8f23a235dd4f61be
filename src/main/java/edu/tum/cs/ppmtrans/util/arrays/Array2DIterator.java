package edu.tum.cs.ppmtrans.util.arrays;

/**
 * Cursor over the cells of an {@link Array2}. Call {@link #advance()} before reading the first cell.
 */
public interface Array2DIterator<T> {

	public boolean hasNext();

	public void advance();

	public T getValue();

	public int getColumn();

	public int getRow();

}
