package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.constants.KoboQuestionTypes;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

/*
 * Replace question types that Kobo does not support
 */
public class QuestionTypeManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(QuestionTypeManager.class.getName());

	/*
	 * SurveyCTO list names that are mapped onto the standard location lists
	 * Checked in this order
	 */
	private static final String [][] LEGACY_LISTS = {
			{"sGovernorate", "governorate"},
			{"sDistrict", "district"},
			{"sSubdistrict", "subdistrict"}
	};

	public QuestionTypeManager(ResourceBundle l) {
		super(l);
	}

	@Override
	public String getName() {
		return "Fix Field Types";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		return state.withSurvey(fixTypes(state.getSurvey(), warnings));
	}

	public Table fixTypes(Table in, ArrayList<ApplicationWarning> warnings) {

		Table survey = in.copy();
		if(!survey.hasColumn(XLSFormColumns.TYPE)) {
			return survey;
		}

		int changed = 0;
		for(int i = 0; i < survey.size(); i++) {
			Row r = survey.getRow(i);
			if(r.isBlank(XLSFormColumns.TYPE)) {
				continue;
			}

			String type = r.getType().trim();
			String newType = getKoboType(type);
			if(!newType.equals(type)) {
				addWarning(warnings, "cv_type", i, XLSFormColumns.SURVEY_SHEET, type, newType, null);
				changed++;
			}
			r.setType(newType);
		}

		log.info("Question types changed: " + changed);
		return survey;
	}

	/*
	 * Get the Kobo type for a SurveyCTO type
	 */
	public static String getKoboType(String type) {

		if(KoboQuestionTypes.isUnsupportedType(type)) {
			return KoboQuestionTypes.TEXT;
		}

		if(type.startsWith(KoboQuestionTypes.SELECT_ONE_PREFIX)) {
			for(String [] legacy : LEGACY_LISTS) {
				if(type.contains(legacy[0])) {
					return KoboQuestionTypes.SELECT_ONE_PREFIX + legacy[1];
				}
			}
		}

		if(!KoboQuestionTypes.isStandardType(type)) {
			return KoboQuestionTypes.TEXT;
		}
		return type;
	}
}
