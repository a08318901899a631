package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationException;
import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.ConvertSettings;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

/*
 * Load the survey, choices and settings worksheets
 * The survey is required, the other two are created if they are missing
 */
public class CoreSheetManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(CoreSheetManager.class.getName());

	private String defaultLanguage;

	public CoreSheetManager(ResourceBundle l, ConvertSettings settings) {
		super(l);
		defaultLanguage = settings.getDefaultLanguage();
	}

	@Override
	public String getName() {
		return "Load Core Sheets";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) throws ApplicationException {

		if(state.getSurvey() == null) {
			throw new ApplicationException(localisation.getString("cv_nw"));
		}

		Table survey = removeEmptyRows(state.getSurvey(), warnings);

		Table choices;
		if(state.getChoices() == null) {
			choices = new Table(XLSFormColumns.CHOICES_SHEET);
			choices.addColumn(XLSFormColumns.LIST_NAME);
			choices.addColumn(XLSFormColumns.NAME);
			choices.addColumn(XLSFormColumns.LABEL);
			addWarning(warnings, "cv_ws_missing", -1, XLSFormColumns.CHOICES_SHEET, null, null, null);
		} else {
			choices = removeEmptyRows(state.getChoices(), warnings);
		}

		Table settings;
		if(state.getSettings() == null) {
			settings = SettingsManager.getDefaultSettings(state.getFormName(), defaultLanguage);
			addWarning(warnings, "cv_ws_created", -1, XLSFormColumns.SETTINGS_SHEET, state.getFormName(), null, null);
		} else {
			settings = removeEmptyRows(state.getSettings(), warnings);
		}

		ArrayList<String> extra = survey.getExtraColumns(XLSFormColumns.SURVEY_COLUMNS);
		if(!extra.isEmpty()) {
			log.info("Survey columns that are not XLSForm columns: " + extra);
		}
		log.info("Loaded " + state.getFormName() + ": " + survey.size() + " survey rows, "
				+ choices.size() + " choices");
		return new PipelineState(survey, choices, settings, state.getFormName());
	}

	/*
	 * Remove rows that do not have a value in any column
	 */
	private Table removeEmptyRows(Table in, ArrayList<ApplicationWarning> warnings) {
		Table out = new Table(in.getName(), in.getColumns());
		int removed = 0;
		for(Row r : in.getRows()) {
			if(r.isEmpty()) {
				removed++;
			} else {
				out.addRow(new Row(r));
			}
		}
		if(removed > 0) {
			addWarning(warnings, "cv_blank_rows", -1, in.getName(), String.valueOf(removed), null, null);
		}
		return out;
	}
}
