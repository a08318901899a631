package org.smap.xlsconvert.managers;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.GeneralUtilityMethods;
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
 * Close any groups or repeats that are left open
 * Only the number of begins and ends is checked, crossed pairs are not detected
 * The missing end rows are added at the end of the survey, repeats are closed before groups
 */
public class GroupRepeatManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(GroupRepeatManager.class.getName());

	public GroupRepeatManager(ResourceBundle l) {
		super(l);
	}

	@Override
	public String getName() {
		return "Validate Group & Repeat Logic";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		return state.withSurvey(balance(state.getSurvey(), warnings));
	}

	public Table balance(Table in, ArrayList<ApplicationWarning> warnings) {

		Table survey = in.copy();
		if(!survey.hasColumn(XLSFormColumns.TYPE)) {
			return survey;
		}

		Deque<Integer> groups = new ArrayDeque<> ();
		Deque<Integer> repeats = new ArrayDeque<> ();

		for(int i = 0; i < survey.size(); i++) {
			String type = survey.getRow(i).getType();
			if(type == null) {
				continue;
			}
			type = type.trim();
			if(type.equals(KoboQuestionTypes.BEGIN_GROUP)) {
				groups.push(i);
			} else if(type.equals(KoboQuestionTypes.BEGIN_REPEAT)) {
				repeats.push(i);
			} else if(type.equals(KoboQuestionTypes.END_GROUP)) {
				if(groups.isEmpty()) {
					addWarning(warnings, "cv_stray_end", i, XLSFormColumns.SURVEY_SHEET, type, null, null);
				} else {
					groups.pop();
				}
			} else if(type.equals(KoboQuestionTypes.END_REPEAT)) {
				if(repeats.isEmpty()) {
					addWarning(warnings, "cv_stray_end", i, XLSFormColumns.SURVEY_SHEET, type, null, null);
				} else {
					repeats.pop();
				}
			}
		}

		// The stacks are popped innermost first
		while(!repeats.isEmpty()) {
			closeOpen(survey, repeats.pop(), KoboQuestionTypes.BEGIN_REPEAT, KoboQuestionTypes.END_REPEAT, warnings);
		}
		while(!groups.isEmpty()) {
			closeOpen(survey, groups.pop(), KoboQuestionTypes.BEGIN_GROUP, KoboQuestionTypes.END_GROUP, warnings);
		}

		log.info("Survey has " + survey.size() + " rows after balancing groups");
		return survey;
	}

	private void closeOpen(Table survey, int openIdx, String beginType, String endType,
			ArrayList<ApplicationWarning> warnings) {
		Row end = new Row();
		end.setType(endType);
		survey.addRow(end);
		addWarning(warnings, "cv_end_added", -1, XLSFormColumns.SURVEY_SHEET, endType, beginType,
				String.valueOf(GeneralUtilityMethods.getSheetRow(openIdx)));
	}
}
