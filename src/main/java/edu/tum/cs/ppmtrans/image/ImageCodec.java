package edu.tum.cs.ppmtrans.image;

import java.io.IOException;

/**
 * Reads and writes images in some file format. A {@code null} file name refers to standard input or output.
 */
public interface ImageCodec {

	public RgbImage read(String fileName) throws IOException;

	public void write(RgbImage image, String fileName) throws IOException;

}
