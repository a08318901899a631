package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationWarning;
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
 * Merge the many ways SurveyCTO names language columns into
 *  label::English, label::Arabic, hint::English and hint::Arabic
 */
public class LanguageColumnManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(LanguageColumnManager.class.getName());

	/*
	 * Alias column -> canonical column
	 * Only exact matches are recognised
	 */
	private static final HashMap<String, String> ALIASES = new LinkedHashMap<> ();
	static {
		ALIASES.put("label", XLSFormColumns.LABEL_ENGLISH);
		ALIASES.put("label:English", XLSFormColumns.LABEL_ENGLISH);
		ALIASES.put("label::English (en)", XLSFormColumns.LABEL_ENGLISH);
		ALIASES.put("label::English", XLSFormColumns.LABEL_ENGLISH);

		ALIASES.put("label:العربية", XLSFormColumns.LABEL_ARABIC);
		ALIASES.put("label::Arabic (ar)", XLSFormColumns.LABEL_ARABIC);
		ALIASES.put("label::العربية", XLSFormColumns.LABEL_ARABIC);
		ALIASES.put("label::Arabic", XLSFormColumns.LABEL_ARABIC);

		ALIASES.put("hint", XLSFormColumns.HINT_ENGLISH);
		ALIASES.put("hint:English", XLSFormColumns.HINT_ENGLISH);
		ALIASES.put("hint::English (en)", XLSFormColumns.HINT_ENGLISH);
		ALIASES.put("hint::English", XLSFormColumns.HINT_ENGLISH);

		ALIASES.put("hint:العربية", XLSFormColumns.HINT_ARABIC);
		ALIASES.put("hint::Arabic (ar)", XLSFormColumns.HINT_ARABIC);
		ALIASES.put("hint::العربية", XLSFormColumns.HINT_ARABIC);
		ALIASES.put("hint::Arabic", XLSFormColumns.HINT_ARABIC);
	}

	public LanguageColumnManager(ResourceBundle l) {
		super(l);
	}

	@Override
	public String getName() {
		return "Normalize Language Columns";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		Table survey = normalize(state.getSurvey(), warnings);
		Table choices = state.getChoices() == null ? null : normalize(state.getChoices(), warnings);
		return state.withSurvey(survey).withChoices(choices);
	}

	public Table normalize(Table in, ArrayList<ApplicationWarning> warnings) {

		Table table = in.copy();
		ArrayList<String> originalColumns = new ArrayList<> (table.getColumns());

		for(String c : XLSFormColumns.CANONICAL_LANGUAGE_COLUMNS) {
			table.addColumn(c);
		}

		// Copy alias values into blank canonical cells, first match wins
		HashMap<String, Integer> copied = new LinkedHashMap<> ();
		for(Row r : table.getRows()) {
			for(String c : originalColumns) {
				String target = ALIASES.get(c);
				if(target != null && !target.equals(c) && r.isBlank(target) && !r.isBlank(c)) {
					r.set(target, r.get(c));
					Integer count = copied.get(c);
					copied.put(c, count == null ? 1 : count + 1);
				}
			}
		}
		for(String c : copied.keySet()) {
			addWarning(warnings, "cv_lang_merge", -1, table.getName(),
					String.valueOf(copied.get(c)), c, ALIASES.get(c));
		}

		// Drop the language variants
		for(String c : originalColumns) {
			if(isLanguageVariant(c)) {
				table.removeColumn(c);
				addWarning(warnings, "cv_lang_drop", -1, table.getName(), c, null, null);
			}
		}

		log.info("Language columns normalized for " + table.getName());
		return table;
	}

	/*
	 * A label or hint column with a language that is not one of the canonical columns
	 * Plain label and hint columns are kept
	 */
	private boolean isLanguageVariant(String column) {
		if(!column.startsWith(XLSFormColumns.LABEL + ":") && !column.startsWith(XLSFormColumns.HINT + ":")) {
			return false;
		}
		for(String c : XLSFormColumns.CANONICAL_LANGUAGE_COLUMNS) {
			if(c.equals(column)) {
				return false;
			}
		}
		return true;
	}
}
