package edu.tum.cs.ppmtrans.util.arrays;

/**
 * Implemented by values that can be explicitly copied. Element type bound of {@link Array2}.
 */
public interface Duplicable<T> {

	/**
	 * @return a copy of this value that shares no mutable state with it
	 */
	public T duplicate();

}
