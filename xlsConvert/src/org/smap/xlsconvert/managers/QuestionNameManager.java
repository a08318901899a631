package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.GeneralUtilityMethods;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

/*
 * Make question names valid and unique
 * Duplicates get a numeric suffix, _1, _2 and so on, counted separately for each name
 */
public class QuestionNameManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(QuestionNameManager.class.getName());

	// Used when nothing is left of a name after removing invalid characters
	public static final String EMPTY_NAME_BASE = "field";

	public QuestionNameManager(ResourceBundle l) {
		super(l);
	}

	@Override
	public String getName() {
		return "Normalize Field Names";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		return state.withSurvey(normalizeNames(state.getSurvey(), warnings));
	}

	public Table normalizeNames(Table in, ArrayList<ApplicationWarning> warnings) {

		Table survey = in.copy();
		if(!survey.hasColumn(XLSFormColumns.NAME)) {
			return survey;
		}

		HashMap<String, Integer> counters = new HashMap<> ();
		HashSet<String> used = new HashSet<> ();

		for(int i = 0; i < survey.size(); i++) {
			Row r = survey.getRow(i);
			if(r.isBlank(XLSFormColumns.NAME)) {
				continue;
			}

			String original = r.getName();
			String base = GeneralUtilityMethods.normalizeName(original);
			if(base.length() == 0) {
				addWarning(warnings, "cv_qname_empty", i, XLSFormColumns.SURVEY_SHEET, original, null, null);
				base = EMPTY_NAME_BASE;
			}

			String name = base;
			if(used.contains(base)) {
				int suffix = counters.containsKey(base) ? counters.get(base) : 0;
				do {
					suffix++;
					name = base + "_" + suffix;
				} while(used.contains(name));
				counters.put(base, suffix);
			}
			used.add(name);

			if(!name.equals(original)) {
				r.setName(name);
				addWarning(warnings, "cv_qname", i, XLSFormColumns.SURVEY_SHEET, original, name, null);
			}
		}

		log.info("Unique question names: " + used.size());
		return survey;
	}
}
