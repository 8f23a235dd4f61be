package edu.tum.cs.ppmtrans;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.io.StringReader;

import org.junit.Test;

import edu.tum.cs.ppmtrans.image.ImageCodec;
import edu.tum.cs.ppmtrans.image.RgbImage;
import edu.tum.cs.ppmtrans.util.TransformConfiguration;

public class PpmTransTest {

	public static class NullCodec implements ImageCodec {
		@Override
		public RgbImage read(String fileName) throws IOException {
			throw new IOException("not supported");
		}

		@Override
		public void write(RgbImage image, String fileName) throws IOException {
			throw new IOException("not supported");
		}
	}

	private static TransformConfiguration config(String content) {
		return new TransformConfiguration(PpmTrans.class, new StringReader(content));
	}

	@Test
	public void testExitStatus() {
		// reading fails
		assertEquals(1, PpmTrans.run(new String[] { "--transpose" }, config("codec=" + NullCodec.class.getName())));
		// no codec configured
		assertEquals(1, PpmTrans.run(new String[] { "--transpose" }, config("")));
		// unknown codec class
		assertEquals(1, PpmTrans.run(new String[0], config("codec=no.such.Codec")));
		// usage error
		assertEquals(1, PpmTrans.run(new String[] { "-r", "45" }, config("codec=" + NullCodec.class.getName())));
	}

	@Test
	public void testCreateCodec() throws ReflectiveOperationException {
		TransformConfiguration cfg = new TransformConfiguration(PpmTrans.class,
				new StringReader("codec=" + NullCodec.class.getName()));
		assertTrue(PpmTrans.createCodec(cfg) instanceof NullCodec);
	}

	@Test(expected = ClassCastException.class)
	public void testCodecOfWrongType() throws ReflectiveOperationException {
		TransformConfiguration cfg = new TransformConfiguration(PpmTrans.class,
				new StringReader("codec=" + String.class.getName()));
		PpmTrans.createCodec(cfg);
	}

}
