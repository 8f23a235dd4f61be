package edu.tum.cs.ppmtrans.util;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.Properties;

public class TransformConfiguration extends Properties {

	private static final long serialVersionUID = -2385007321461520413L;

	public static final String CONFIG_FILE_PROPERTY = "edu.tum.cs.ppmtrans.config";
	private static final String defaultResource = "/ppmtrans.properties";

	// well-known global properties
	public static final String PROP_CODEC = "codec";
	public static final String PROP_ITERATION_ORDER = "iterationOrder";

	public static final String ORDER_ROW_MAJOR = "row-major";
	public static final String ORDER_COL_MAJOR = "col-major";

	private final String root;

	public TransformConfiguration(Class<?> cls) {
		try {
			String configFileName = System.getProperty(CONFIG_FILE_PROPERTY);
			if (configFileName != null) {
				Reader reader = new FileReader(configFileName);
				try {
					load(reader);
				} finally {
					reader.close();
				}
			} else {
				InputStream in = TransformConfiguration.class.getResourceAsStream(defaultResource);
				if (in != null) {
					try {
						load(in);
					} finally {
						in.close();
					}
				}
			}
		} catch (IOException ex) {
			throw new RuntimeException("error reading configuration", ex);
		}
		root = cls.getSimpleName();
	}

	public TransformConfiguration(Class<?> cls, Reader reader) {
		try {
			load(reader);
		} catch (IOException ex) {
			throw new RuntimeException("error reading configuration", ex);
		}
		root = cls.getSimpleName();
	}

	private String makeGlobal(String key) {
		return root + "." + key;
	}

	@Override
	public String getProperty(String key, String defaultValue) {
		String value = super.getProperty(key);
		if (value == null) {
			value = defaultValue;
			if (value == null)
				throw new RuntimeException("required property '" + key + "' not specified");
		}
		return value;
	}

	public String getLocalProperty(String key, String defaultValue) {
		return getProperty(makeGlobal(key), defaultValue);
	}

	@Override
	public String getProperty(String key) {
		return getProperty(key, null);
	}

	public String getLocalProperty(String key) {
		return getLocalProperty(key, null);
	}

	public boolean getBooleanProperty(String key, Boolean defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		return Boolean.parseBoolean(rawValue);
	}

	public boolean getLocalBooleanProperty(String key, Boolean defaultValue) {
		return getBooleanProperty(makeGlobal(key), defaultValue);
	}

	/**
	 * @return true if the configured default traversal order is row-major
	 */
	public boolean isRowMajorDefault() {
		String order = getProperty(PROP_ITERATION_ORDER, ORDER_ROW_MAJOR);
		if (order.equals(ORDER_ROW_MAJOR))
			return true;
		else if (order.equals(ORDER_COL_MAJOR))
			return false;
		throw new RuntimeException("invalid iteration order '" + order + "' for key '" + PROP_ITERATION_ORDER +
				"'");
	}

}
