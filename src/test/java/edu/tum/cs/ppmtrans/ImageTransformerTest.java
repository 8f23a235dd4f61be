package edu.tum.cs.ppmtrans;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.Test;

import edu.tum.cs.ppmtrans.image.ImageCodec;
import edu.tum.cs.ppmtrans.image.Rgb;
import edu.tum.cs.ppmtrans.image.RgbImage;
import edu.tum.cs.ppmtrans.util.arrays.Array2;
import edu.tum.cs.ppmtrans.util.arrays.Transformation;

public class ImageTransformerTest {

	private static class MemoryCodec implements ImageCodec {
		private final RgbImage input;
		private final boolean failOnWrite;
		private String readFileName;
		private RgbImage written;

		public MemoryCodec(RgbImage input, boolean failOnWrite) {
			this.input = input;
			this.failOnWrite = failOnWrite;
		}

		@Override
		public RgbImage read(String fileName) throws IOException {
			readFileName = fileName;
			if (input == null)
				throw new IOException("no such file");
			return input;
		}

		@Override
		public void write(RgbImage image, String fileName) throws IOException {
			if (failOnWrite)
				throw new IOException("disk full");
			written = image;
		}
	}

	private static class RecordingHandler extends Handler {
		private final List<String> messages = new ArrayList<String>();

		@Override
		public void publish(LogRecord record) {
			messages.add(record.getMessage());
		}

		@Override
		public void flush() {
		}

		@Override
		public void close() {
		}
	}

	private static final int denominator = 255;

	private static List<Rgb> gray(int... values) {
		List<Rgb> pixels = new ArrayList<Rgb>();
		for (int v : values)
			pixels.add(new Rgb(v, v, v));
		return pixels;
	}

	private static RgbImage input() {
		return new RgbImage(2, 3, gray(1, 2, 3, 4, 5, 6), denominator);
	}

	@Test
	public void testRotate() throws IOException {
		MemoryCodec codec = new MemoryCodec(input(), false);
		ImageTransformer transformer = new ImageTransformer(codec, true);
		assertTrue(transformer.run(new TransformRequest(Transformation.ROTATE_90, false, "in.ppm")));

		assertEquals("in.ppm", codec.readFileName);
		assertEquals(3, codec.written.getWidth());
		assertEquals(2, codec.written.getHeight());
		assertEquals(denominator, codec.written.getDenominator());
		assertEquals(gray(5, 3, 1, 6, 4, 2), codec.written.getPixels());
	}

	@Test
	public void testIdentity() throws IOException {
		MemoryCodec codec = new MemoryCodec(input(), false);
		ImageTransformer transformer = new ImageTransformer(codec, false);
		assertTrue(transformer.run(new TransformRequest(Transformation.IDENTITY, true, null)));

		assertNull(codec.readFileName);
		assertEquals(2, codec.written.getWidth());
		assertEquals(3, codec.written.getHeight());
		assertEquals(gray(1, 2, 3, 4, 5, 6), codec.written.getPixels());
	}

	@Test
	public void testAllTransformations() throws IOException {
		for (Transformation t : Transformation.values()) {
			MemoryCodec rowMajorCodec = new MemoryCodec(input(), false);
			new ImageTransformer(rowMajorCodec, false).run(new TransformRequest(t, true, null));
			MemoryCodec colMajorCodec = new MemoryCodec(input(), false);
			new ImageTransformer(colMajorCodec, false).run(new TransformRequest(t, false, null));
			assertEquals(t.toString(), rowMajorCodec.written.getPixels(), colMajorCodec.written.getPixels());
		}
	}

	private static List<String> applyAndRecord(boolean logTiming, Array2<Rgb> image, Transformation t) {
		Logger logger = Logger.getLogger(ImageTransformer.class.getName());
		RecordingHandler handler = new RecordingHandler();
		logger.addHandler(handler);
		try {
			new ImageTransformer(new MemoryCodec(input(), false), logTiming).apply(image, t, true);
		} finally {
			logger.removeHandler(handler);
		}
		return handler.messages;
	}

	@Test
	public void testTimingLog() {
		Array2<Rgb> image = Array2.fromRowMajor(2, 3, gray(1, 2, 3, 4, 5, 6));
		List<String> messages = applyAndRecord(true, image, Transformation.TRANSPOSE);
		assertEquals(1, messages.size());
		assertTrue(messages.get(0), messages.get(0).startsWith("Transposition took "));
		assertEquals(Array2.fromRowMajor(3, 2, gray(1, 3, 5, 2, 4, 6)), image);

		assertTrue(applyAndRecord(false, image, Transformation.TRANSPOSE).isEmpty());
		assertEquals(Array2.fromRowMajor(2, 3, gray(1, 2, 3, 4, 5, 6)), image);
	}

	@Test
	public void testIdentityWithTiming() {
		Array2<Rgb> image = Array2.fromRowMajor(2, 3, gray(1, 2, 3, 4, 5, 6));
		applyAndRecord(true, image, Transformation.IDENTITY);
		assertEquals(Array2.fromRowMajor(2, 3, gray(1, 2, 3, 4, 5, 6)), image);
	}

	@Test
	public void testWriteFailure() throws IOException {
		MemoryCodec codec = new MemoryCodec(input(), true);
		ImageTransformer transformer = new ImageTransformer(codec, false);
		assertFalse(transformer.run(new TransformRequest(Transformation.TRANSPOSE, true, null)));
	}

	@Test(expected = IOException.class)
	public void testReadFailure() throws IOException {
		ImageTransformer transformer = new ImageTransformer(new MemoryCodec(null, false), false);
		transformer.run(new TransformRequest(Transformation.TRANSPOSE, true, "missing.ppm"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInconsistentImage() throws IOException {
		RgbImage broken = new RgbImage(3, 3, Arrays.asList(new Rgb(0, 0, 0)), denominator);
		new ImageTransformer(new MemoryCodec(broken, false), false).run(
				new TransformRequest(Transformation.ROTATE_180, true, null));
	}

}
