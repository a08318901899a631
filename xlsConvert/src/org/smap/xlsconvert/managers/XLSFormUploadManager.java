package org.smap.xlsconvert.managers;

/*
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

 */

import java.io.InputStream;
import java.util.HashMap;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FilenameUtils;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.smap.xlsconvert.Utilities.ApplicationException;
import org.smap.xlsconvert.Utilities.XLSUtilities;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Table;

/*
 * Read the survey, choices and settings worksheets of a SurveyCTO form
 */
public class XLSFormUploadManager {

	private static Logger log =
			 Logger.getLogger(XLSFormUploadManager.class.getName());

	private ResourceBundle localisation;

	public XLSFormUploadManager(ResourceBundle l) {
		localisation = l;
	}

	/*
	 * Get the form from an uploaded file, the form name is the file name without its extension
	 */
	public PipelineState getForm(InputStream inputStream, String fileName) throws ApplicationException {
		return getForm(inputStream, fileName, getFormName(fileName));
	}

	public PipelineState getForm(InputStream inputStream, String fileName, String formName) throws ApplicationException {

		Workbook wb = null;
		try {
			wb = WorkbookFactory.create(inputStream);
		} catch (Exception e) {
			log.log(Level.SEVERE, "Error opening " + fileName, e);
			throw new ApplicationException(XLSUtilities.getMessage(localisation, "cv_nf", -1, null,
					fileName, null, null), e);
		}

		try {
			Table survey = getTable(wb, XLSFormColumns.SURVEY_SHEET);
			Table choices = getTable(wb, XLSFormColumns.CHOICES_SHEET);
			Table settings = getTable(wb, XLSFormColumns.SETTINGS_SHEET);
			return new PipelineState(survey, choices, settings, formName);
		} finally {
			try {wb.close();} catch (Exception e) {log.log(Level.SEVERE, "Closing workbook", e);}
		}
	}

	public static String getFormName(String fileName) {
		return FilenameUtils.getBaseName(fileName);
	}

	/*
	 * Get a worksheet as a table
	 * The first row that is not empty is the header, null is returned if there is no sheet
	 */
	private Table getTable(Workbook wb, String sheetName) throws ApplicationException {

		Sheet sheet = wb.getSheet(sheetName);
		if(sheet == null) {
			log.info("Worksheet " + sheetName + " not found");
			return null;
		}

		Table table = new Table(sheetName);
		HashMap<String, Integer> header = null;
		int lastRowNum = sheet.getLastRowNum();

		for(int rowNum = 0; rowNum <= lastRowNum; rowNum++) {
			Row row = sheet.getRow(rowNum);
			if(row == null) {
				continue;
			}

			if(header == null) {
				header = XLSUtilities.getHeader(row, localisation, rowNum + 1, sheetName);
				for(String col : header.keySet()) {
					table.addColumn(col);
				}
				continue;
			}

			int lastCellNum = row.getLastCellNum();
			org.smap.xlsconvert.model.Row r = new org.smap.xlsconvert.model.Row();
			for(String col : header.keySet()) {
				r.set(col, XLSUtilities.getTextColumn(row, col, header, lastCellNum, null));
			}
			table.addRow(r);
		}

		log.info("Worksheet " + sheetName + ": " + table.getColumns().size() + " columns, " + table.size() + " rows");
		return table;
	}
}
