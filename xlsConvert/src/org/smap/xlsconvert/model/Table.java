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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/*
 * A worksheet
 * Columns are held in sheet order, rows in form order
 * Conversion steps never change a table they were given, they work on a copy
 */
public class Table {

	private String name;
	private ArrayList<String> columns = new ArrayList<> ();
	private ArrayList<Row> rows = new ArrayList<> ();

	public Table(String name) {
		this.name = name;
	}

	public Table(String name, List<String> columns) {
		this.name = name;
		for(String c : columns) {
			addColumn(c);
		}
	}

	/*
	 * Return a deep copy of the table
	 */
	public Table copy() {
		Table t = new Table(name, columns);
		for(Row r : rows) {
			t.rows.add(new Row(r));
		}
		return t;
	}

	public String getName() {
		return name;
	}

	public List<String> getColumns() {
		return Collections.unmodifiableList(columns);
	}

	/*
	 * The rows of the table, changes to the returned rows change the table
	 */
	public List<Row> getRows() {
		return rows;
	}

	public Row getRow(int idx) {
		return rows.get(idx);
	}

	public int size() {
		return rows.size();
	}

	public boolean hasColumn(String column) {
		return columns.contains(column);
	}

	/*
	 * Add a column at the end of the table, existing columns are left where they are
	 */
	public void addColumn(String column) {
		if(!columns.contains(column)) {
			columns.add(column);
		}
	}

	public void removeColumn(String column) {
		if(columns.remove(column)) {
			for(Row r : rows) {
				r.remove(column);
			}
		}
	}

	/*
	 * Add a row, any columns it has that are not in the table are added
	 */
	public void addRow(Row row, List<String> rowColumns) {
		for(String c : rowColumns) {
			addColumn(c);
		}
		rows.add(row);
	}

	public void addRow(Row row) {
		rows.add(row);
	}

	/*
	 * True if the column is blank in every row
	 */
	public boolean isColumnBlank(String column) {
		for(Row r : rows) {
			if(!r.isBlank(column)) {
				return false;
			}
		}
		return true;
	}

	public ArrayList<String> getValues(String column) {
		ArrayList<String> values = new ArrayList<> ();
		for(Row r : rows) {
			values.add(r.get(column));
		}
		return values;
	}

	/*
	 * Columns that are not in the list of known columns for this sheet
	 */
	public ArrayList<String> getExtraColumns(String [] known) {
		ArrayList<String> extra = new ArrayList<> ();
		for(String c : columns) {
			boolean isKnown = false;
			for(String k : known) {
				if(k.equals(c)) {
					isKnown = true;
					break;
				}
			}
			if(!isKnown) {
				extra.add(c);
			}
		}
		return extra;
	}

	@Override
	public boolean equals(Object o) {
		if(this == o) {
			return true;
		}
		if(!(o instanceof Table)) {
			return false;
		}
		Table t = (Table) o;
		return name.equals(t.name) && columns.equals(t.columns) && rows.equals(t.rows);
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + rows.hashCode();
	}

	@Override
	public String toString() {
		return name + " " + columns + " " + rows.size() + " rows";
	}
}
