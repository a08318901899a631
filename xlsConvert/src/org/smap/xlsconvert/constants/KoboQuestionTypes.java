package org.smap.xlsconvert.constants;

public class KoboQuestionTypes {

	public static final String TEXT = "text";
	public static final String INTEGER = "integer";
	public static final String DECIMAL = "decimal";
	public static final String SELECT_ONE = "select_one";
	public static final String SELECT_MULTIPLE = "select_multiple";
	public static final String NOTE = "note";
	public static final String GEOPOINT = "geopoint";
	public static final String GEOTRACE = "geotrace";
	public static final String GEOSHAPE = "geoshape";
	public static final String DATE = "date";
	public static final String TIME = "time";
	public static final String DATETIME = "dateTime";
	public static final String IMAGE = "image";
	public static final String AUDIO = "audio";
	public static final String VIDEO = "video";
	public static final String FILE = "file";
	public static final String BARCODE = "barcode";
	public static final String CALCULATE = "calculate";
	public static final String ACKNOWLEDGE = "acknowledge";
	public static final String HIDDEN = "hidden";
	public static final String XML_EXTERNAL = "xml-external";
	public static final String BEGIN_GROUP = "begin group";
	public static final String END_GROUP = "end group";
	public static final String BEGIN_REPEAT = "begin repeat";
	public static final String END_REPEAT = "end repeat";

	// A select type followed by a space and the list name
	public static final String SELECT_ONE_PREFIX = SELECT_ONE + " ";
	public static final String SELECT_MULTIPLE_PREFIX = SELECT_MULTIPLE + " ";

	public static final String [] STANDARD_TYPES = {
			TEXT, INTEGER, DECIMAL, SELECT_ONE, SELECT_MULTIPLE,
			NOTE, GEOPOINT, GEOTRACE, GEOSHAPE, DATE, TIME,
			DATETIME, IMAGE, AUDIO, VIDEO, FILE, BARCODE,
			CALCULATE, ACKNOWLEDGE, HIDDEN, XML_EXTERNAL,
			BEGIN_GROUP, END_GROUP, BEGIN_REPEAT, END_REPEAT
	};

	/*
	 * SurveyCTO types that have no Kobo equivalent
	 */
	public static final String [] UNSUPPORTED_TYPES = {
			"deviceid", "username", "subscriberid", "simserial",
			"phonenumber", "caseid", "text audit", "comments", "audit"
	};

	/*
	 * Return true if the type is part of the Kobo vocabulary
	 */
	public static boolean isStandardType(String type) {
		if(type == null) {
			return false;
		}
		for(String t : STANDARD_TYPES) {
			if(t.equals(type)) {
				return true;
			}
		}
		return type.startsWith(SELECT_ONE_PREFIX) || type.startsWith(SELECT_MULTIPLE_PREFIX);
	}

	public static boolean isUnsupportedType(String type) {
		if(type == null) {
			return false;
		}
		for(String t : UNSUPPORTED_TYPES) {
			if(t.equals(type)) {
				return true;
			}
		}
		return false;
	}

	private KoboQuestionTypes() {
	}
}
