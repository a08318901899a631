package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

/*
 * Every named question needs a label and hint in both languages
 * Missing ones are filled with placeholder text built from the question name
 */
public class LabelFallbackManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(LabelFallbackManager.class.getName());

	public static final String LABEL_ENGLISH_TEMPLATE = "Input for ";
	public static final String LABEL_ARABIC_TEMPLATE = "إدخال لـ ";
	public static final String HINT_ENGLISH_TEMPLATE = "Hint for ";
	public static final String HINT_ARABIC_TEMPLATE = "تلميح لـ ";

	public LabelFallbackManager(ResourceBundle l) {
		super(l);
	}

	@Override
	public String getName() {
		return "Apply Label Fallbacks";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		return state.withSurvey(addFallbacks(state.getSurvey(), warnings));
	}

	public Table addFallbacks(Table in, ArrayList<ApplicationWarning> warnings) {

		Table survey = in.copy();
		if(!survey.hasColumn(XLSFormColumns.NAME)) {
			return survey;
		}

		int count = 0;
		for(int i = 0; i < survey.size(); i++) {
			Row r = survey.getRow(i);
			if(r.isBlank(XLSFormColumns.NAME)) {
				continue;
			}

			String name = r.getName();
			StringBuilder filled = new StringBuilder();
			for(String col : XLSFormColumns.CANONICAL_LANGUAGE_COLUMNS) {
				if(survey.hasColumn(col) && r.isBlank(col)) {
					r.set(col, getFallback(col, name));
					if(filled.length() > 0) {
						filled.append(", ");
					}
					filled.append(col);
				}
			}
			if(filled.length() > 0) {
				addWarning(warnings, "cv_fallback", i, XLSFormColumns.SURVEY_SHEET, filled.toString(), name, null);
				count++;
			}
		}

		log.info("Rows with placeholder labels: " + count);
		return survey;
	}

	/*
	 * Get the placeholder text for a language column
	 */
	public static String getFallback(String column, String name) {
		String template;
		if(column.equals(XLSFormColumns.LABEL_ENGLISH)) {
			template = LABEL_ENGLISH_TEMPLATE;
		} else if(column.equals(XLSFormColumns.LABEL_ARABIC)) {
			template = LABEL_ARABIC_TEMPLATE;
		} else if(column.equals(XLSFormColumns.HINT_ENGLISH)) {
			template = HINT_ENGLISH_TEMPLATE;
		} else {
			template = HINT_ARABIC_TEMPLATE;
		}
		return template + name;
	}
}
