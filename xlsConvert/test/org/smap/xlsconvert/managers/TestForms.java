package org.smap.xlsconvert.managers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.ResourceBundle;

import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.GeneralUtilityMethods;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

/*
 * Builders for the small forms used in the step tests
 */
final class TestForms {

	static final ResourceBundle LOCALISATION = GeneralUtilityMethods.getLocalisation();

	private TestForms() {
	}

	/*
	 * Create a table from a header and rows of values, null values are left out of the row
	 */
	static Table table(String name, String [] columns, String [] ... rows) {
		Table t = new Table(name, Arrays.asList(columns));
		for(String [] values : rows) {
			Row r = new Row();
			for(int i = 0; i < columns.length && i < values.length; i++) {
				r.set(columns[i], values[i]);
			}
			t.addRow(r);
		}
		return t;
	}

	static String [] cols(String ... columns) {
		return columns;
	}

	static String [] row(String ... values) {
		return values;
	}

	static ArrayList<ApplicationWarning> warnings() {
		return new ArrayList<> ();
	}

	static List<String> messages(List<ApplicationWarning> warnings) {
		ArrayList<String> msgs = new ArrayList<> ();
		for(ApplicationWarning w : warnings) {
			msgs.add(w.getMessage());
		}
		return msgs;
	}
}
