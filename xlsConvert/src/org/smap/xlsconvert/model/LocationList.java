package org.smap.xlsconvert.model;

import java.util.ArrayList;

/*
 * One level of a location hierarchy, for example the districts
 */
public class LocationList {
	public String list_name;
	public String parent_list;		// null for the top level
	public ArrayList<LocationItem> items = new ArrayList<> ();

	public LocationList() {
	}

	public LocationList(String listName, String parentList) {
		this.list_name = listName;
		this.parent_list = parentList;
	}
}
