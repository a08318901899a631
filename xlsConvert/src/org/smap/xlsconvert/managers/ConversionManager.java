package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationException;
import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.ConvertSettings;
import org.smap.xlsconvert.model.LocationHierarchy;
import org.smap.xlsconvert.model.PipelineState;
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
 * Convert a SurveyCTO form into a Kobo form
 * The steps are always run in the same order, each one gets the state produced by the one before
 */
public class ConversionManager {

	private static Logger log =
			 Logger.getLogger(ConversionManager.class.getName());

	private ArrayList<ApplicationWarning> warnings;
	private ArrayList<ConversionStep> steps = new ArrayList<> ();

	public ConversionManager(ResourceBundle l, ArrayList<ApplicationWarning> warnings,
			ConvertSettings settings) throws ApplicationException {
		this(l, warnings, settings, CascadeManager.loadHierarchy(l, settings));
	}

	public ConversionManager(ResourceBundle l, ArrayList<ApplicationWarning> warnings,
			ConvertSettings settings, LocationHierarchy hierarchy) {
		this.warnings = warnings;

		steps.add(new CoreSheetManager(l, settings));
		steps.add(new LanguageColumnManager(l));
		steps.add(new QuestionTypeManager(l));
		steps.add(new LabelFallbackManager(l));
		steps.add(new CalculationManager(l));
		steps.add(new DefaultValueManager(l));
		steps.add(new QuestionNameManager(l));
		steps.add(new GroupRepeatManager(l));
		steps.add(new CascadeManager(l, hierarchy));
		steps.add(new SettingsManager(l, settings));
		steps.add(new RedundantColumnManager(l));
	}

	/*
	 * Run every step
	 * The choices and settings may be null
	 */
	public PipelineState runPipeline(Table survey, Table choices, Table settings, String formName) throws ApplicationException {

		PipelineState state = new PipelineState(survey, choices, settings, formName);
		for(int i = 0; i < steps.size(); i++) {
			state = runStep(i, state);
		}
		log.info("Conversion of " + formName + " complete with " + warnings.size() + " warnings");
		return state;
	}

	/*
	 * Run a single step on a saved state
	 */
	public PipelineState runStep(int idx, PipelineState state) throws ApplicationException {
		ConversionStep step = steps.get(idx);
		log.info("Step " + idx + ": " + step.getName());
		return step.apply(state, warnings);
	}

	public ArrayList<String> getStepNames() {
		ArrayList<String> names = new ArrayList<> ();
		for(ConversionStep s : steps) {
			names.add(s.getName());
		}
		return names;
	}

	public ArrayList<ApplicationWarning> getWarnings() {
		return warnings;
	}
}
