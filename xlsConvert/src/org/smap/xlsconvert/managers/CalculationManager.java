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
 * Questions with expressions that Kobo cannot handle are turned into text questions
 * This is a text search for known problem fragments, the expressions are not parsed
 */
public class CalculationManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(CalculationManager.class.getName());

	public static final String [] INVALID_FRAGMENTS = {
			"pulldata(", "duration(", "if(<", "if(=", "if(,)",
			"selected(,)", "(+())", "(*1)", "(*2)", "${"
	};

	public static final String [] EXPRESSION_COLUMNS = {
			XLSFormColumns.CALCULATION,
			XLSFormColumns.REQUIRED,
			XLSFormColumns.RELEVANT,
			XLSFormColumns.CONSTRAINT,
			XLSFormColumns.CHOICE_FILTER
	};

	public CalculationManager(ResourceBundle l) {
		super(l);
	}

	@Override
	public String getName() {
		return "Clean Calculation Fields";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		return state.withSurvey(cleanExpressions(state.getSurvey(), warnings));
	}

	public Table cleanExpressions(Table in, ArrayList<ApplicationWarning> warnings) {

		Table survey = in.copy();
		if(!survey.hasColumn(XLSFormColumns.TYPE)) {
			return survey;
		}

		int count = 0;
		for(int i = 0; i < survey.size(); i++) {
			Row r = survey.getRow(i);
			for(String col : EXPRESSION_COLUMNS) {
				String fragment = getInvalidPattern(r.get(col));
				if(fragment != null) {
					r.setType(KoboQuestionTypes.TEXT);
					r.setCalculation(null);
					addWarning(warnings, "cv_expr", i, XLSFormColumns.SURVEY_SHEET, col, fragment, null);
					count++;
					break;
				}
			}
		}

		log.info("Questions with invalid expressions: " + count);
		return survey;
	}

	/*
	 * Return the first invalid fragment found in the expression or null if there are none
	 */
	public static String getInvalidPattern(String expression) {
		if(expression == null) {
			return null;
		}
		for(String f : INVALID_FRAGMENTS) {
			if(expression.contains(f)) {
				return f;
			}
		}
		return null;
	}
}
