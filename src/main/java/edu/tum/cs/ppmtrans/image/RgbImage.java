package edu.tum.cs.ppmtrans.image;

import java.util.List;

public class RgbImage {

	private final int width;
	private final int height;
	private final List<Rgb> pixels;
	private final int denominator;

	/**
	 * @param pixels pixel values in row-major order
	 * @param denominator maximum channel value
	 */
	public RgbImage(int width, int height, List<Rgb> pixels, int denominator) {
		this.width = width;
		this.height = height;
		this.pixels = pixels;
		this.denominator = denominator;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public List<Rgb> getPixels() {
		return pixels;
	}

	public int getDenominator() {
		return denominator;
	}

}
