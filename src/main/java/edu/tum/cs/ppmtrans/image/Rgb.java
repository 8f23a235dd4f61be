package edu.tum.cs.ppmtrans.image;

import edu.tum.cs.ppmtrans.util.arrays.Duplicable;

/**
 * A pixel with red, green and blue channel values, each between 0 and the denominator of the image it belongs to.
 */
public class Rgb implements Duplicable<Rgb> {

	private int red;
	private int green;
	private int blue;

	public Rgb(int red, int green, int blue) {
		this.red = red;
		this.green = green;
		this.blue = blue;
	}

	public int getRed() {
		return red;
	}

	public void setRed(int red) {
		this.red = red;
	}

	public int getGreen() {
		return green;
	}

	public void setGreen(int green) {
		this.green = green;
	}

	public int getBlue() {
		return blue;
	}

	public void setBlue(int blue) {
		this.blue = blue;
	}

	@Override
	public Rgb duplicate() {
		return new Rgb(red, green, blue);
	}

	@Override
	public int hashCode() {
		return (((red * 31) + green) * 31) + blue;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Rgb))
			return false;
		Rgb other = (Rgb) obj;
		return (red == other.red) && (green == other.green) && (blue == other.blue);
	}

	@Override
	public String toString() {
		return "(" + red + ", " + green + ", " + blue + ")";
	}

}
