package org.smap.xlsconvert.Utilities;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Workbook;

public class XLSUtilities {

	private static Logger log =
			Logger.getLogger(XLSUtilities.class.getName());

	/**
	 * create a library of cell styles
	 */
	public static Map<String, CellStyle> createStyles(Workbook wb){

		Map<String, CellStyle> styles = new HashMap<String, CellStyle>();

		Font boldFont = wb.createFont();
		boldFont.setBold(true);

		/*
		 * Styles for XLS Form
		 */
		CellStyle style = wb.createCellStyle();
		style.setFont(boldFont);
		styles.put("header", style);

		style = wb.createCellStyle();
		style.setWrapText(true);
		styles.put("label", style);

		style = wb.createCellStyle();
		style.setFillForegroundColor(IndexedColors.LIGHT_GREEN.getIndex());
		style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
		styles.put("begin repeat", style);
		styles.put("end repeat", style);

		style = wb.createCellStyle();
		style.setFillForegroundColor(IndexedColors.LIGHT_CORNFLOWER_BLUE.getIndex());
		style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
		styles.put("begin group", style);
		styles.put("end group", style);

		return styles;
	}

	/*
	 * Get a hashmap of column name and column index
	 * Iteration order of the returned map is the order of the columns in the sheet
	 */
	public static HashMap<String, Integer> getHeader(Row row, ResourceBundle localisation, int rowNumber, String sheet) throws ApplicationException {
		HashMap<String, Integer> header = new LinkedHashMap<String, Integer> ();

		int lastCellNum = row.getLastCellNum();
		Cell cell = null;
		String name = null;

		for(int i = 0; i <= lastCellNum; i++) {
			cell = row.getCell(i);
			if(cell != null) {
				try {
					name = cell.getStringCellValue();
				} catch (Exception e) {
					name = null;		// Ignore non string headers
					log.log(Level.SEVERE, "Ignoring " + e.getMessage(), e);
				}

				if(name != null && name.trim().length() > 0) {
					name = GeneralUtilityMethods.removeBOM(name.trim());
					if(name.toLowerCase().equals("list name") ||
							name.toLowerCase().equals("list_name") ||
							name.toLowerCase().equals("name") ||
							name.toLowerCase().equals("label")) {
						name = name.toLowerCase();	// Automatically set columns that need to be lower case to lower case
					}

					if(name.equals("list name")) {
						name = "list_name";
					}
					Integer exists = header.get(name);
					if(exists == null) {
						header.put(name, i);
					} else {
						throw getApplicationException(localisation, "cv_dh", rowNumber, sheet, name, null, null);
					}
				}
			}
		}

		return header;
	}

	/*
	 * Get the text value of a cell and return null if the cell is empty
	 */
	public static String getTextColumn(Row row, String name, HashMap<String, Integer> header, int lastCellNum, String default_value) throws ApplicationException {

		String value = null;
		Integer cellIndex;
		int idx;

		cellIndex = header.get(name);
		if(cellIndex != null && cellIndex < lastCellNum) {
			idx = cellIndex;
			Cell c = row.getCell(idx);
			if(c != null) {
				value = getCellValue(c);
				if(value != null) {
					value = value.replaceAll("\u00A0", " ");		// Replace non breaking space with space
					value = value.trim();  	// Remove trailing whitespace, its not visible to users
					if(value.length() == 0) {
						value = null;
					}
				}
			}
		}

		if(value == null) {
			value = default_value;
		}

		return value;
	}

	/*
	 * Get a cell value as String from XLS
	 */
	private static String getCellValue(Cell c) throws ApplicationException {

		CellType type = c.getCellType();
		if(type == CellType.FORMULA) {
			type = c.getCachedFormulaResultType();
		}

		String value = null;
		if(type == CellType.NUMERIC) {
			if (DateUtil.isCellDateFormatted(c)) {
				SimpleDateFormat dateFormat = new SimpleDateFormat("yyyy-MM-dd HH:mm");
				Date dateValue = c.getDateCellValue();
				value = dateFormat.format(dateValue);
			} else {
				double dValue = c.getNumericCellValue();
				value = String.valueOf(dValue);
				if(value.endsWith(".0")) {
					value = value.substring(0, value.lastIndexOf('.'));
				}
			}
		} else if(type == CellType.STRING) {
			value = c.getStringCellValue();
		} else if(type == CellType.BOOLEAN) {
			value = String.valueOf(c.getBooleanCellValue());
		} else if(type == CellType.BLANK) {
			value = null;
		} else {
			throw(new ApplicationException("Error: Unknown cell type: " + type +
					" in sheet "  + c.getSheet().getSheetName() +
					" in row " + (c.getRowIndex() + 1) +
					", column " + (c.getColumnIndex() + 1)));
		}

		return value;
	}

	/*
	 * Build a localised exception that identifies the location of the problem
	 */
	public static ApplicationException getApplicationException(
			ResourceBundle localisation,
			String code,
			int row,
			String sheet,
			String param1,
			String param2,
			String param3) {

		return new ApplicationException(getMessage(localisation, code, row, sheet, param1, param2, param3));
	}

	/*
	 * Localised message with the sheet, row and parameters substituted
	 */
	public static String getMessage(
			ResourceBundle localisation,
			String code,
			int row,
			String sheet,
			String param1,
			String param2,
			String param3) {

		StringBuffer buf = null;
		if(row >= 0) {
			buf = new StringBuffer(localisation.getString("cv_rn")).append(" ");
		} else {
			buf = new StringBuffer("");
		}
		buf.append(localisation.getString(code));

		String msg = buf.toString();
		if(sheet != null) {
			msg = msg.replace("%sheet", sheet);
			msg = msg.replace("%s2", sheet);
		}
		msg = msg.replace("%row", String.valueOf(row));

		if(param1 != null) {
			msg = msg.replace("%s1", param1);
		}

		if(param2 != null) {
			msg = msg.replace("%s3", param2);
		}

		if(param3 != null) {
			msg = msg.replace("%s4", param3);
		}

		return msg;
	}
}
