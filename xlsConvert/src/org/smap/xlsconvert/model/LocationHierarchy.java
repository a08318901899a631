package org.smap.xlsconvert.model;

import java.util.ArrayList;

/*
 * Location lists used to seed cascading selects
 * Lists are ordered from the top level down
 */
public class LocationHierarchy {
	public ArrayList<LocationList> lists = new ArrayList<> ();

	/*
	 * The names of the choice lists that are replaced by this hierarchy
	 */
	public ArrayList<String> getListNames() {
		ArrayList<String> names = new ArrayList<> ();
		for(LocationList l : lists) {
			names.add(l.list_name);
		}
		return names;
	}

	public LocationList getList(String name) {
		for(LocationList l : lists) {
			if(l.list_name.equals(name)) {
				return l;
			}
		}
		return null;
	}

	public int size() {
		int count = 0;
		for(LocationList l : lists) {
			count += l.items.size();
		}
		return count;
	}
}
