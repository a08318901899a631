package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.ConvertSettings;
import org.smap.xlsconvert.Utilities.GeneralUtilityMethods;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

/*****************************************************************************

This file is part of SMAP.

SMAP is free software: you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation, either version 3 of the License, or
(at your option) any later version.

SMAP is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with SMAP.  If not, see <http://www.gnu.org/licenses/>.

 ******************************************************************************/

/*
 * Make sure the settings sheet has a title, form id and default language
 * The default language is always overwritten
 */
public class SettingsManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(SettingsManager.class.getName());

	private String defaultLanguage;

	public SettingsManager(ResourceBundle l, ConvertSettings settings) {
		super(l);
		defaultLanguage = settings.getDefaultLanguage();
	}

	@Override
	public String getName() {
		return "Check Settings Sheet";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		return state.withSettings(fixSettings(state.getSettings(), state.getFormName(), warnings));
	}

	public Table fixSettings(Table in, String formName, ArrayList<ApplicationWarning> warnings) {

		if(in == null || in.size() == 0) {
			log.info("Creating settings for " + formName);
			addWarning(warnings, "cv_ws_created", -1, XLSFormColumns.SETTINGS_SHEET, formName, null, null);
			return getDefaultSettings(formName, defaultLanguage);
		}

		Table settings = in.copy();
		Row first = settings.getRow(0);

		if(!settings.hasColumn(XLSFormColumns.FORM_TITLE) || first.isBlank(XLSFormColumns.FORM_TITLE)) {
			setColumn(settings, XLSFormColumns.FORM_TITLE, formName, warnings);
		}

		if(!settings.hasColumn(XLSFormColumns.FORM_ID) || first.isBlank(XLSFormColumns.FORM_ID)) {
			setColumn(settings, XLSFormColumns.FORM_ID, GeneralUtilityMethods.normalizeName(formName), warnings);
		}

		String existing = first.get(XLSFormColumns.DEFAULT_LANGUAGE);
		if(existing == null || !existing.equals(defaultLanguage)) {
			setColumn(settings, XLSFormColumns.DEFAULT_LANGUAGE, defaultLanguage, warnings);
		}

		return settings;
	}

	/*
	 * Settings for a form that did not have any
	 */
	public static Table getDefaultSettings(String formName, String language) {
		Table settings = new Table(XLSFormColumns.SETTINGS_SHEET);
		settings.addColumn(XLSFormColumns.FORM_TITLE);
		settings.addColumn(XLSFormColumns.FORM_ID);
		settings.addColumn(XLSFormColumns.DEFAULT_LANGUAGE);

		Row row = new Row();
		row.set(XLSFormColumns.FORM_TITLE, formName);
		row.set(XLSFormColumns.FORM_ID, GeneralUtilityMethods.normalizeName(formName));
		row.set(XLSFormColumns.DEFAULT_LANGUAGE, language);
		settings.addRow(row);

		return settings;
	}

	private void setColumn(Table settings, String column, String value, ArrayList<ApplicationWarning> warnings) {
		settings.addColumn(column);
		for(Row r : settings.getRows()) {
			r.set(column, value);
		}
		addWarning(warnings, "cv_setting", -1, XLSFormColumns.SETTINGS_SHEET, column, value, null);
	}
}
