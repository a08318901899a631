package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.ResourceBundle;

import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.GeneralUtilityMethods;
import org.smap.xlsconvert.Utilities.XLSUtilities;

/*
 * Common code for conversion steps
 */
public abstract class StepManager implements ConversionStep {

	protected ResourceBundle localisation = null;

	protected StepManager(ResourceBundle l) {
		localisation = l;
	}

	/*
	 * Record a correction made to the form
	 * rowIndex is the index of the row in the table or -1 if the warning is not about a row
	 */
	protected void addWarning(ArrayList<ApplicationWarning> warnings, String code, int rowIndex, String sheet,
			String param1, String param2, String param3) {
		if(warnings != null) {
			int row = rowIndex >= 0 ? GeneralUtilityMethods.getSheetRow(rowIndex) : -1;
			String msg = XLSUtilities.getMessage(localisation, code, row, sheet, param1, param2, param3);
			warnings.add(new ApplicationWarning(getName(), msg));
		}
	}
}
