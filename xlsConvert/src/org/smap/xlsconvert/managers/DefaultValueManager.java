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
 * Remove default values that are looked up or refer to other questions
 */
public class DefaultValueManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(DefaultValueManager.class.getName());

	public static final String [] INVALID_FRAGMENTS = {"pulldata(", "${"};

	public DefaultValueManager(ResourceBundle l) {
		super(l);
	}

	@Override
	public String getName() {
		return "Remove Invalid Defaults";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		return state.withSurvey(removeInvalidDefaults(state.getSurvey(), warnings));
	}

	public Table removeInvalidDefaults(Table in, ArrayList<ApplicationWarning> warnings) {

		Table survey = in.copy();
		if(!survey.hasColumn(XLSFormColumns.DEFAULT)) {
			return survey;
		}

		int count = 0;
		for(int i = 0; i < survey.size(); i++) {
			Row r = survey.getRow(i);
			String def = r.getDefault();
			if(def == null) {
				continue;
			}
			for(String f : INVALID_FRAGMENTS) {
				if(def.contains(f)) {
					r.setDefault(null);
					addWarning(warnings, "cv_def", i, XLSFormColumns.SURVEY_SHEET, def, null, null);
					count++;
					break;
				}
			}
		}

		log.info("Default values removed: " + count);
		return survey;
	}
}
