package org.smap.xlsconvert.model;

/*
 * A single location in a location list
 */
public class LocationItem {
	public String name;
	public String label_english;
	public String label_arabic;
	public String parent;			// Name of the location in the parent list

	public LocationItem() {
	}

	public LocationItem(String name, String labelEnglish, String labelArabic, String parent) {
		this.name = name;
		this.label_english = labelEnglish;
		this.label_arabic = labelArabic;
		this.parent = parent;
	}
}
