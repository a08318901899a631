package org.smap.xlsconvert.Utilities;

import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/*
 * Settings for a conversion, read from xlsconvert.properties on the classpath
 */
public class ConvertSettings {

	private static Logger log =
			 Logger.getLogger(ConvertSettings.class.getName());

	public static final String PROPERTIES_FILE = "xlsconvert.properties";

	public static final String DEFAULT_LANGUAGE = "English";
	public static final String DEFAULT_HIERARCHY = "org/smap/xlsconvert/resources/location_hierarchy.json";
	public static final String DEFAULT_OUTPUT_TYPE = "xlsx";

	Properties properties = new Properties();

	public ConvertSettings() {
		this(PROPERTIES_FILE);
	}

	public ConvertSettings(String resource) {
		try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
			if(is != null) {
				properties.load(is);
			} else {
				log.info("Settings file " + resource + " not found, using defaults");
			}
		} catch (Exception e) {
			log.log(Level.SEVERE, "Error reading properties", e);
		}
	}

	public ConvertSettings(Properties p) {
		properties.putAll(p);
	}

	/*
	 * The language written to the settings sheet
	 */
	public String getDefaultLanguage() {
		return getSetting("default_language", DEFAULT_LANGUAGE);
	}

	/*
	 * Classpath resource holding the location hierarchy used to seed cascading selects
	 */
	public String getLocationHierarchy() {
		return getSetting("location_hierarchy", DEFAULT_HIERARCHY);
	}

	/*
	 * xls or xlsx
	 */
	public String getOutputType() {
		String type = getSetting("output_type", DEFAULT_OUTPUT_TYPE);
		if(!type.equals("xls") && !type.equals("xlsx")) {
			log.info("Invalid output type: " + type + " using " + DEFAULT_OUTPUT_TYPE);
			type = DEFAULT_OUTPUT_TYPE;
		}
		return type;
	}

	private String getSetting(String key, String def) {
		String value = properties.getProperty(key);
		if(value != null) {
			value = value.trim();
		}
		return GeneralUtilityMethods.isBlank(value) ? def : value;
	}
}
