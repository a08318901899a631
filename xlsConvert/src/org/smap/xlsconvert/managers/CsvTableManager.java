package org.smap.xlsconvert.managers;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationException;
import org.smap.xlsconvert.Utilities.GeneralUtilityMethods;
import org.smap.xlsconvert.Utilities.XLSUtilities;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;

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
 * Export a worksheet as CSV so that it can be edited and then load the edited file back
 */
public class CsvTableManager {

	private static Logger log =
			 Logger.getLogger(CsvTableManager.class.getName());

	private ResourceBundle localisation;

	public CsvTableManager(ResourceBundle l) {
		localisation = l;
	}

	/*
	 * Write the table as CSV, the header is the first line
	 */
	public void writeTable(Table table, Writer writer) throws IOException {

		CSVWriter csvWriter = new CSVWriter(writer);
		List<String> cols = table.getColumns();
		csvWriter.writeNext(cols.toArray(new String[0]));

		for(Row r : table.getRows()) {
			String [] line = new String[cols.size()];
			for(int i = 0; i < cols.size(); i++) {
				String value = r.get(cols.get(i));
				line[i] = GeneralUtilityMethods.isBlank(value) ? "" : value;
			}
			csvWriter.writeNext(line);
		}
		csvWriter.flush();
	}

	/*
	 * Read an edited CSV file into a table
	 */
	public Table readTable(String sheetName, Reader reader) throws ApplicationException {

		Table table = new Table(sheetName);
		CSVReader csvReader = null;
		try {
			csvReader = new CSVReader(reader);

			String [] cols = csvReader.readNext();
			ArrayList<String> headers = new ArrayList<> ();
			boolean hasHeader = false;
			if(cols != null) {
				for(String n : cols) {
					String name = n == null ? "" : GeneralUtilityMethods.removeBOM(n).trim();
					headers.add(name);		// Empty names are kept as place holders so that the indexes match
					if(name.length() > 0) {
						table.addColumn(name);
						hasHeader = true;
					}
				}
			}
			if(!hasHeader) {
				throw XLSUtilities.getApplicationException(localisation, "cv_csv_empty", -1, sheetName, null, null, null);
			}

			String [] line = csvReader.readNext();
			while(line != null) {
				if(line.length > headers.size()) {
					throw XLSUtilities.getApplicationException(localisation, "cv_csv_cols", -1, sheetName,
							String.valueOf(line.length), String.valueOf(headers.size()), null);
				}
				Row r = new Row();
				for(int i = 0; i < line.length; i++) {
					String col = headers.get(i);
					if(col.length() > 0 && line[i] != null && line[i].length() > 0) {
						r.set(col, line[i]);
					}
				}
				if(!r.isEmpty()) {
					table.addRow(r);
				}
				line = csvReader.readNext();
			}

		} catch (ApplicationException e) {
			throw e;
		} catch (Exception e) {
			log.log(Level.SEVERE, "Error reading csv for " + sheetName, e);
			throw new ApplicationException(XLSUtilities.getMessage(localisation, "cv_csv", -1, sheetName,
					e.getMessage(), null, null), e);
		} finally {
			if(csvReader != null) {try{csvReader.close();}catch(Exception e) {log.log(Level.SEVERE, "Closing csv", e);}}
		}

		log.info("Loaded " + table.size() + " rows from csv for " + sheetName);
		return table;
	}

	/*
	 * Replace one worksheet of the form with an edited CSV file
	 * If the file cannot be read the exception is thrown and the existing state is unchanged
	 */
	public PipelineState applyEdit(PipelineState state, String sheetName, Reader reader) throws ApplicationException {

		if(sheetName == null || !(sheetName.equals(XLSFormColumns.SURVEY_SHEET)
				|| sheetName.equals(XLSFormColumns.CHOICES_SHEET)
				|| sheetName.equals(XLSFormColumns.SETTINGS_SHEET))) {
			throw XLSUtilities.getApplicationException(localisation, "cv_csv_sheet", -1, null, sheetName, null, null);
		}

		Table table = readTable(sheetName, reader);
		if(sheetName.equals(XLSFormColumns.SURVEY_SHEET)) {
			return state.withSurvey(table);
		} else if(sheetName.equals(XLSFormColumns.CHOICES_SHEET)) {
			return state.withChoices(table);
		} else {
			return state.withSettings(table);
		}
	}
}
