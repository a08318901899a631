package org.smap.xlsconvert.managers;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.smap.xlsconvert.Utilities.GeneralUtilityMethods;
import org.smap.xlsconvert.Utilities.XLSUtilities;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Table;

/*
 * Write a converted form as an XLSForm workbook
 */
public class XLSFormManager {

	private static Logger log =
			 Logger.getLogger(XLSFormManager.class.getName());

	private static final int DEFAULT_WIDTH = 256 * 20;		// 20 characters
	private static final int LABEL_WIDTH = 256 * 40;

	Workbook wb = null;

	public XLSFormManager(String type) {
		if(type != null && type.equals("xls")) {
			wb = new HSSFWorkbook();
		} else {
			wb = new XSSFWorkbook();
		}
	}

	public void createXLSForm(OutputStream outputStream, PipelineState state) throws IOException {

		try {
			Map<String, CellStyle> styles = XLSUtilities.createStyles(wb);

			Sheet surveySheet = wb.createSheet(XLSFormColumns.SURVEY_SHEET);
			Sheet choicesSheet = wb.createSheet(XLSFormColumns.CHOICES_SHEET);
			Sheet settingsSheet = wb.createSheet(XLSFormColumns.SETTINGS_SHEET);

			// Freeze panes by default
			surveySheet.createFreezePane(2, 1);
			choicesSheet.createFreezePane(3, 1);

			writeTable(surveySheet, state.getSurvey(), styles, true);
			writeTable(choicesSheet, state.getChoices(), styles, false);
			writeTable(settingsSheet, state.getSettings(), styles, false);

			wb.write(outputStream);
			log.info("Written form " + state.getFormName());
		} finally {
			wb.close();
		}
	}

	/*
	 * Write the header and rows of a table
	 * Group and repeat rows in the survey are highlighted
	 */
	private void writeTable(Sheet sheet, Table table, Map<String, CellStyle> styles, boolean isSurvey) {

		if(table == null) {
			return;
		}

		List<String> cols = table.getColumns();

		// Column widths
		for(int i = 0; i < cols.size(); i++) {
			sheet.setColumnWidth(i, getWidth(cols.get(i)));
		}

		Row headerRow = sheet.createRow(0);
		CellStyle headerStyle = styles.get("header");
		for(int i = 0; i < cols.size(); i++) {
			Cell cell = headerRow.createCell(i);
			cell.setCellStyle(headerStyle);
			cell.setCellValue(cols.get(i));
		}

		int rowNumber = 1;		// Heading row is 0
		for(org.smap.xlsconvert.model.Row r : table.getRows()) {
			Row row = sheet.createRow(rowNumber++);
			CellStyle typeStyle = isSurvey && r.getType() != null ? styles.get(r.getType()) : null;
			for(int i = 0; i < cols.size(); i++) {
				String col = cols.get(i);
				Cell cell = row.createCell(i);
				if(typeStyle != null) {
					cell.setCellStyle(typeStyle);
				} else if(isLabel(col)) {
					cell.setCellStyle(styles.get("label"));
				}
				String value = r.get(col);
				if(!GeneralUtilityMethods.isBlank(value)) {
					cell.setCellValue(value);
				}
			}
		}
	}

	private int getWidth(String col) {
		return isLabel(col) ? LABEL_WIDTH : DEFAULT_WIDTH;
	}

	private boolean isLabel(String col) {
		return col.startsWith(XLSFormColumns.LABEL) || col.startsWith(XLSFormColumns.HINT);
	}
}
