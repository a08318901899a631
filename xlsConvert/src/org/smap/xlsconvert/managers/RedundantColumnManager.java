package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Table;

/*
 * Remove empty columns and SurveyCTO columns that Kobo does not use
 * The settings sheet is not changed
 */
public class RedundantColumnManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(RedundantColumnManager.class.getName());

	public static final String [] UNUSED_COLUMNS = {
			XLSFormColumns.STYLE,
			XLSFormColumns.READONLY,
			XLSFormColumns.PUBLISHABLE,
			XLSFormColumns.AUTOPLAY
	};

	public RedundantColumnManager(ResourceBundle l) {
		super(l);
	}

	@Override
	public String getName() {
		return "Remove Redundant Columns";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		Table survey = prune(state.getSurvey(), warnings);
		Table choices = state.getChoices() == null ? null : prune(state.getChoices(), warnings);
		return state.withSurvey(survey).withChoices(choices);
	}

	public Table prune(Table in, ArrayList<ApplicationWarning> warnings) {

		Table table = in.copy();

		for(String c : new ArrayList<String> (table.getColumns())) {
			if(table.isColumnBlank(c)) {
				table.removeColumn(c);
				addWarning(warnings, "cv_col_drop", -1, table.getName(), c, null, null);
			}
		}

		for(String c : UNUSED_COLUMNS) {
			if(table.hasColumn(c)) {
				table.removeColumn(c);
				addWarning(warnings, "cv_col_drop", -1, table.getName(), c, null, null);
			}
		}

		log.info(table.getName() + " has " + table.getColumns().size() + " columns");
		return table;
	}
}
