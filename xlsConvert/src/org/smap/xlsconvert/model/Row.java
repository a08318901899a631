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

package org.smap.xlsconvert.model;

import java.util.HashMap;
import java.util.Map;

import org.smap.xlsconvert.Utilities.GeneralUtilityMethods;
import org.smap.xlsconvert.constants.XLSFormColumns;

/*
 * A row in a worksheet
 * The recognised XLSForm columns have typed accessors, any other column is reached by name
 * Columns that have not been set are blank
 */
public class Row {

	private HashMap<String, String> values = new HashMap<> ();

	public Row() {
	}

	/*
	 * Copy constructor
	 */
	public Row(Row r) {
		values.putAll(r.values);
	}

	public Row(Map<String, String> v) {
		values.putAll(v);
	}

	public String get(String column) {
		return values.get(column);
	}

	/*
	 * Setting a column to null removes it from the row
	 */
	public void set(String column, String value) {
		if(value == null) {
			values.remove(column);
		} else {
			values.put(column, value);
		}
	}

	public void remove(String column) {
		values.remove(column);
	}

	public boolean isBlank(String column) {
		return GeneralUtilityMethods.isBlank(values.get(column));
	}

	/*
	 * True if every cell in the row is blank
	 */
	public boolean isEmpty() {
		for(String v : values.values()) {
			if(!GeneralUtilityMethods.isBlank(v)) {
				return false;
			}
		}
		return true;
	}

	public String getType() {
		return values.get(XLSFormColumns.TYPE);
	}

	public void setType(String type) {
		set(XLSFormColumns.TYPE, type);
	}

	public String getName() {
		return values.get(XLSFormColumns.NAME);
	}

	public void setName(String name) {
		set(XLSFormColumns.NAME, name);
	}

	public String getCalculation() {
		return values.get(XLSFormColumns.CALCULATION);
	}

	public void setCalculation(String calculation) {
		set(XLSFormColumns.CALCULATION, calculation);
	}

	public String getDefault() {
		return values.get(XLSFormColumns.DEFAULT);
	}

	public void setDefault(String def) {
		set(XLSFormColumns.DEFAULT, def);
	}

	public String getListName() {
		return values.get(XLSFormColumns.LIST_NAME);
	}

	public void setListName(String listName) {
		set(XLSFormColumns.LIST_NAME, listName);
	}

	@Override
	public boolean equals(Object o) {
		if(this == o) {
			return true;
		}
		if(!(o instanceof Row)) {
			return false;
		}
		return values.equals(((Row) o).values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
