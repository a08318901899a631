package org.smap.xlsconvert.constants;

/*
 * Sheet and column names of an XLSForm
 */
public class XLSFormColumns {

	// Sheets
	public static final String SURVEY_SHEET = "survey";
	public static final String CHOICES_SHEET = "choices";
	public static final String SETTINGS_SHEET = "settings";

	// Survey sheet
	public static final String TYPE = "type";
	public static final String NAME = "name";
	public static final String LABEL = "label";
	public static final String HINT = "hint";
	public static final String CALCULATION = "calculation";
	public static final String REQUIRED = "required";
	public static final String RELEVANT = "relevant";
	public static final String CONSTRAINT = "constraint";
	public static final String CHOICE_FILTER = "choice_filter";
	public static final String DEFAULT = "default";
	public static final String APPEARANCE = "appearance";
	public static final String CONSTRAINT_MESSAGE = "constraint_message";
	public static final String REQUIRED_MESSAGE = "required_message";
	public static final String REPEAT_COUNT = "repeat_count";
	public static final String PARAMETERS = "parameters";

	// Canonical language columns
	public static final String LABEL_ENGLISH = "label::English";
	public static final String LABEL_ARABIC = "label::Arabic";
	public static final String HINT_ENGLISH = "hint::English";
	public static final String HINT_ARABIC = "hint::Arabic";

	// Choices sheet
	public static final String LIST_NAME = "list_name";

	// Settings sheet
	public static final String FORM_TITLE = "form_title";
	public static final String FORM_ID = "form_id";
	public static final String DEFAULT_LANGUAGE = "default_language";
	public static final String VERSION = "version";
	public static final String INSTANCE_NAME = "instance_name";

	// Columns not used by Kobo
	public static final String STYLE = "style";
	public static final String READONLY = "readonly";
	public static final String PUBLISHABLE = "publishable";
	public static final String AUTOPLAY = "autoplay";

	public static final String [] CANONICAL_LANGUAGE_COLUMNS = {
			LABEL_ENGLISH, LABEL_ARABIC, HINT_ENGLISH, HINT_ARABIC
	};

	public static final String [] SURVEY_COLUMNS = {
			TYPE, NAME, LABEL, HINT, LABEL_ENGLISH, LABEL_ARABIC, HINT_ENGLISH, HINT_ARABIC,
			CALCULATION, REQUIRED, RELEVANT, CONSTRAINT, CHOICE_FILTER, DEFAULT, APPEARANCE,
			CONSTRAINT_MESSAGE, REQUIRED_MESSAGE, REPEAT_COUNT, PARAMETERS
	};

	public static final String [] CHOICES_COLUMNS = {
			LIST_NAME, NAME, LABEL, LABEL_ENGLISH, LABEL_ARABIC
	};

	public static final String [] SETTINGS_COLUMNS = {
			FORM_TITLE, FORM_ID, DEFAULT_LANGUAGE, VERSION, INSTANCE_NAME
	};

	private XLSFormColumns() {
	}
}
